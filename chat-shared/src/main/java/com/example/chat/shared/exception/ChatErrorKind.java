package com.example.chat.shared.exception;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.http.HttpStatus;

/**
 * Error taxonomy shared by the WebSocket protocol and the HTTP read side.
 * The label is the wire value of the {@code kind} field in error frames.
 */
public enum ChatErrorKind {
    UNAUTHORIZED("Unauthorized", true, HttpStatus.UNAUTHORIZED),
    MALFORMED_COMMAND("MalformedCommand", false, HttpStatus.BAD_REQUEST),
    INVALID_MESSAGE("InvalidMessage", false, HttpStatus.BAD_REQUEST),
    BLOCKED("Blocked", false, HttpStatus.FORBIDDEN),
    RATE_LIMITED("RateLimited", false, HttpStatus.TOO_MANY_REQUESTS),
    SLOW_CONSUMER("SlowConsumer", true, HttpStatus.SERVICE_UNAVAILABLE),
    PERSISTENCE_FAILURE("PersistenceFailure", false, HttpStatus.SERVICE_UNAVAILABLE);

    private final String label;
    private final boolean fatal;
    private final HttpStatus httpStatus;

    ChatErrorKind(String label, boolean fatal, HttpStatus httpStatus) {
        this.label = label;
        this.fatal = fatal;
        this.httpStatus = httpStatus;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Whether this error closes the connection it occurred on.
     */
    public boolean isFatal() {
        return fatal;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
