package com.chatmirror.projector;

/**
 * Stored records and indexes contradict what an event expects. Not repaired automatically.
 */
public class DataInconsistencyException extends RuntimeException {
    public DataInconsistencyException(String message) {
        super(message);
    }
}
