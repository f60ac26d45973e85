package com.example.chat.shared.exception;

/**
 * The history store could not append a message. The triggering command is aborted
 * and nothing is delivered for it.
 */
public class PersistenceFailureException extends ChatException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(ChatErrorKind.PERSISTENCE_FAILURE, message, cause);
    }
}
