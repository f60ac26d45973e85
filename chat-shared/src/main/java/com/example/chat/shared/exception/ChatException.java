package com.example.chat.shared.exception;

import lombok.Getter;

@Getter
public class ChatException extends RuntimeException {

    private final ChatErrorKind kind;

    public ChatException(ChatErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ChatException(ChatErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
