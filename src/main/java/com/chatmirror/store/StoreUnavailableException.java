package com.chatmirror.store;

/**
 * The backing store could not complete a read or a pipeline. Callers may retry with backoff.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
