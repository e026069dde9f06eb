package com.chatmirror.projector;

import io.vertx.core.json.JsonObject;

public record BatchResult(int processed, int skipped) {
    public static final BatchResult EMPTY = new BatchResult(0, 0);

    public BatchResult plus(BatchResult other) {
        return new BatchResult(processed + other.processed, skipped + other.skipped);
    }

    public BatchResult plusSkipped(int count) {
        return new BatchResult(processed, skipped + count);
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("processed", processed)
                .put("skipped", skipped);
    }
}
