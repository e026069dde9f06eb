package com.chatmirror.store;

import java.util.Map;

/**
 * A single write queued on a {@link StorePipeline}.
 */
public record StoreCommand(Type type, String key, String member, double score, String value, Map<String, String> fields) {

    public enum Type {
        SET,
        DEL,
        ZADD,
        ZREM,
        HSET
    }

    public static StoreCommand set(String key, String value) {
        return new StoreCommand(Type.SET, key, null, 0, value, null);
    }

    public static StoreCommand del(String key) {
        return new StoreCommand(Type.DEL, key, null, 0, null, null);
    }

    public static StoreCommand zadd(String key, String member, double score) {
        return new StoreCommand(Type.ZADD, key, member, score, null, null);
    }

    public static StoreCommand zrem(String key, String member) {
        return new StoreCommand(Type.ZREM, key, member, 0, null, null);
    }

    public static StoreCommand hset(String key, Map<String, String> fields) {
        return new StoreCommand(Type.HSET, key, null, 0, null, Map.copyOf(fields));
    }
}
