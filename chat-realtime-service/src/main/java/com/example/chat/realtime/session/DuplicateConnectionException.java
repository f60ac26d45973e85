package com.example.chat.realtime.session;

/**
 * A connection id was registered twice. Connection ids are generated server-side,
 * so this signals a bug rather than a client error.
 */
public class DuplicateConnectionException extends IllegalStateException {

    public DuplicateConnectionException(String connectionId) {
        super("Connection already registered: " + connectionId);
    }
}
