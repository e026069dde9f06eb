package com.chatmirror.pull;

public class AlreadyRunningException extends RuntimeException {
    public AlreadyRunningException(SubscriptionKey key) {
        super("Pulling is already running for " + key);
    }
}
