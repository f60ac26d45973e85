package com.example.chat.shared.exception;

public class UnauthorizedException extends ChatException {

    public UnauthorizedException(String message) {
        super(ChatErrorKind.UNAUTHORIZED, message);
    }
}
