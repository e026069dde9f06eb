package com.chatmirror.pull;

import io.vertx.core.json.JsonObject;

/**
 * Status reported for a subscription. {@code timestamp} is null when the puller never ran.
 */
public record PullStatusResponse(String subscriptionId, PullStatus status, String message, String timestamp) {

    public JsonObject toJson() {
        return new JsonObject()
                .put("subscription_id", subscriptionId)
                .put("task_status", status.code())
                .put("message", message)
                .put("timestamp", timestamp);
    }
}
