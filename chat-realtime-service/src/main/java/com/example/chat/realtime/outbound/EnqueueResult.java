package com.example.chat.realtime.outbound;

public enum EnqueueResult {
    ACCEPTED,
    /** A low-priority frame found no room and nothing evictable. */
    DROPPED,
    /** The queue overflowed on a frame that may not be dropped; the connection must close. */
    SLOW_CONSUMER,
    /** The connection is already closing; the frame was discarded. */
    CLOSED;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
