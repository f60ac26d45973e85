package com.example.chat.realtime.outbound;

/**
 * Eviction class of an outbound frame when a connection's queue is full.
 */
public enum FramePriority {
    /** Presence, pongs and acknowledgements. The oldest one is evicted to make room. */
    LOW,
    /** Chat messages. Overflow closes the connection instead of dropping or reordering. */
    NORMAL,
    /** Game notifications and error replies. Never evicted. */
    HIGH
}
