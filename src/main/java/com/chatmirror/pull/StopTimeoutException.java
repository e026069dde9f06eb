package com.chatmirror.pull;

public class StopTimeoutException extends RuntimeException {
    public StopTimeoutException(SubscriptionKey key, long timeoutMs) {
        super("Pulling for " + key + " did not stop within " + timeoutMs + "ms");
    }
}
