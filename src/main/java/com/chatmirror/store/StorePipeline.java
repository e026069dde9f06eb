package com.chatmirror.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Ordered batch of writes that an {@link IndexStore} executes as one atomic unit.
 */
public class StorePipeline {
    private final List<StoreCommand> commands = new ArrayList<>();

    public StorePipeline set(String key, String value) {
        commands.add(StoreCommand.set(key, value));
        return this;
    }

    public StorePipeline del(String key) {
        commands.add(StoreCommand.del(key));
        return this;
    }

    public StorePipeline zadd(String key, String member, double score) {
        commands.add(StoreCommand.zadd(key, member, score));
        return this;
    }

    public StorePipeline zrem(String key, String member) {
        commands.add(StoreCommand.zrem(key, member));
        return this;
    }

    public StorePipeline hset(String key, Map<String, String> fields) {
        commands.add(StoreCommand.hset(key, fields));
        return this;
    }

    public List<StoreCommand> commands() {
        return Collections.unmodifiableList(commands);
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }

    public int size() {
        return commands.size();
    }
}
