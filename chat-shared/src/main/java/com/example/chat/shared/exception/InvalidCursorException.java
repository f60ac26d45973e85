package com.example.chat.shared.exception;

public class InvalidCursorException extends ChatException {

    public InvalidCursorException(String message) {
        super(ChatErrorKind.MALFORMED_COMMAND, message);
    }
}
