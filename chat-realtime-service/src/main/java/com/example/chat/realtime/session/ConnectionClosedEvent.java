package com.example.chat.realtime.session;

import com.example.chat.shared.exception.ChatErrorKind;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * A connection was closed server-side and must leave the registry without waiting for
 * its transport to wind down.
 */
@Getter
public class ConnectionClosedEvent extends ApplicationEvent {
    private final ChatConnection connection;
    private final ChatErrorKind reason;

    public ConnectionClosedEvent(Object source, ChatConnection connection, ChatErrorKind reason) {
        super(source);
        this.connection = connection;
        this.reason = reason;
    }
}
