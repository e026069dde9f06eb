package com.chatmirror.pull;

public record SubscriptionKey(String endpoint, String subscriptionId) {
    public SubscriptionKey {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint must be a non-empty string");
        }
        if (subscriptionId == null || subscriptionId.isBlank()) {
            throw new IllegalArgumentException("subscription id must be a non-empty string");
        }
    }

    @Override
    public String toString() {
        return endpoint + "/" + subscriptionId;
    }
}
