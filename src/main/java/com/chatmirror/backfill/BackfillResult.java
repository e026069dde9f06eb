package com.chatmirror.backfill;

import io.vertx.core.json.JsonObject;

public record BackfillResult(String conversationId, int processed, int skipped, int pages, int batches) {

    public JsonObject toJson() {
        return new JsonObject()
                .put("conversation_id", conversationId)
                .put("processed", processed)
                .put("skipped", skipped)
                .put("pages", pages)
                .put("batches", batches);
    }
}
