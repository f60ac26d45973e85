package com.example.chat.realtime.session;

/**
 * Edge of an identity's live-connection count crossing zero.
 */
public enum PresenceTransition {
    ONLINE,
    OFFLINE,
    NONE
}
