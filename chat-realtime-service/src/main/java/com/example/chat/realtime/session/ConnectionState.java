package com.example.chat.realtime.session;

/**
 * Lifecycle of one WebSocket connection. Transitions only move forward;
 * {@link #CLOSED} is terminal.
 */
public enum ConnectionState {
    CONNECTING,
    AUTHENTICATED,
    ACTIVE,
    CLOSED
}
