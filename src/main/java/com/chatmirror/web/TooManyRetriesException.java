package com.chatmirror.web;

public class TooManyRetriesException extends Exception {
    public TooManyRetriesException(int retries, Throwable lastFailure) {
        super("Too many retries: " + retries, lastFailure);
    }
}
