package com.chatmirror.projector;

import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * One entry of a message's append-only text history. The timestamp is ISO-8601 UTC with a {@code Z} suffix.
 */
public record TextRevision(String value, String createTime) {
    private static final DateTimeFormatter ISO_UTC_Z =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    public static TextRevision of(String value, Instant at) {
        return new TextRevision(value == null ? "" : value, formatTimestamp(at));
    }

    public static String formatTimestamp(Instant at) {
        return ISO_UTC_Z.format(at.truncatedTo(ChronoUnit.MICROS));
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("value", value)
                .put("create_time", createTime);
    }

    public static TextRevision fromJson(JsonObject json) {
        return new TextRevision(json.getString("value", ""), json.getString("create_time"));
    }
}
