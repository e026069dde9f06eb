package com.chatmirror.projector;

/**
 * A change event that is malformed or incomplete. It is dropped, never retried.
 */
public class InvalidEventException extends RuntimeException {
    public InvalidEventException(String message) {
        super(message);
    }

    public InvalidEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
