package com.example.chat.realtime.session;

import com.example.chat.shared.exception.ChatErrorKind;
import org.springframework.web.reactive.socket.CloseStatus;

/**
 * WebSocket close codes for connection-fatal errors. 4000-4999 is the range
 * reserved for applications.
 */
public final class ChatCloseStatus {

    public static final CloseStatus UNAUTHORIZED = new CloseStatus(4001, "Unauthorized");
    public static final CloseStatus MALFORMED_COMMAND = new CloseStatus(4002, "MalformedCommand");
    public static final CloseStatus SLOW_CONSUMER = new CloseStatus(4008, "SlowConsumer");
    public static final CloseStatus SERVER_SHUTDOWN = CloseStatus.GOING_AWAY;

    private ChatCloseStatus() {
    }

    public static CloseStatus forKind(ChatErrorKind kind) {
        switch (kind) {
            case UNAUTHORIZED:
                return UNAUTHORIZED;
            case MALFORMED_COMMAND:
                return MALFORMED_COMMAND;
            case SLOW_CONSUMER:
                return SLOW_CONSUMER;
            default:
                return CloseStatus.SERVER_ERROR;
        }
    }
}
