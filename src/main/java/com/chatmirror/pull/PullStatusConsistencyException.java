package com.chatmirror.pull;

/**
 * The in-process view of a puller disagrees with its persisted status record.
 */
public class PullStatusConsistencyException extends RuntimeException {
    public PullStatusConsistencyException(String message) {
        super(message);
    }
}
