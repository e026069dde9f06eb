package com.chatmirror.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-local {@link IndexStore}, selected by {@code storage_mock}. Pipelines are applied under a single lock.
 */
public class InMemoryIndexStore implements IndexStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryIndexStore.class);

    private final Map<String, String> values = new HashMap<>();
    private final Map<String, Map<String, Double>> sortedSets = new HashMap<>();
    private final Map<String, Map<String, String>> hashes = new HashMap<>();

    @Override
    public synchronized String get(String key) {
        return values.get(key);
    }

    @Override
    public synchronized Map<String, String> getAll(Collection<String> keys) {
        Map<String, String> found = new LinkedHashMap<>();
        for (String key : keys) {
            String value = values.get(key);
            if (value != null) {
                found.put(key, value);
            }
        }
        return found;
    }

    @Override
    public synchronized Double score(String key, String member) {
        Map<String, Double> set = sortedSets.get(key);
        return set == null ? null : set.get(member);
    }

    @Override
    public synchronized List<ScoredMember> rangeByScore(String key, double minScore, double maxScore) {
        Map<String, Double> set = sortedSets.get(key);
        List<ScoredMember> result = new ArrayList<>();
        if (set == null) {
            return result;
        }
        for (Map.Entry<String, Double> e : set.entrySet()) {
            if (e.getValue() >= minScore && e.getValue() <= maxScore) {
                result.add(new ScoredMember(e.getKey(), e.getValue()));
            }
        }
        // redis orders equal scores lexicographically by member
        result.sort(Comparator.comparingDouble(ScoredMember::score).thenComparing(ScoredMember::member));
        return result;
    }

    @Override
    public synchronized Map<String, String> getHash(String key) {
        Map<String, String> hash = hashes.get(key);
        return hash == null ? Map.of() : new HashMap<>(hash);
    }

    @Override
    public synchronized void execute(StorePipeline pipeline) {
        for (StoreCommand command : pipeline.commands()) {
            apply(command);
        }
        LOGGER.debug("executed pipeline of {} commands", pipeline.size());
    }

    private void apply(StoreCommand command) {
        switch (command.type()) {
            case SET:
                values.put(command.key(), command.value());
                break;
            case DEL:
                values.remove(command.key());
                sortedSets.remove(command.key());
                hashes.remove(command.key());
                break;
            case ZADD:
                sortedSets.computeIfAbsent(command.key(), k -> new HashMap<>()).put(command.member(), command.score());
                break;
            case ZREM:
                Map<String, Double> set = sortedSets.get(command.key());
                if (set != null) {
                    set.remove(command.member());
                    if (set.isEmpty()) {
                        sortedSets.remove(command.key());
                    }
                }
                break;
            case HSET:
                hashes.computeIfAbsent(command.key(), k -> new HashMap<>()).putAll(command.fields());
                break;
            default:
                throw new IllegalArgumentException("Unsupported store command: " + command.type());
        }
    }
}
