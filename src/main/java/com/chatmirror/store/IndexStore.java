package com.chatmirror.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Ordered key-value store holding message records, per-partition sorted indexes and pull status hashes.
 *
 * <p>All methods block the calling thread until the store answers. Implementations throw
 * {@link StoreUnavailableException} when the store cannot be reached within their bound.</p>
 */
public interface IndexStore extends AutoCloseable {

    /**
     * @return the string stored at {@code key}, or null when absent
     */
    String get(String key);

    /**
     * Multi-get. Keys with no value are absent from the returned map.
     */
    Map<String, String> getAll(Collection<String> keys);

    /**
     * @return the score of {@code member} in the sorted set at {@code key}, or null when not a member
     */
    Double score(String key, String member);

    /**
     * Members of the sorted set at {@code key} with a score in [{@code minScore}, {@code maxScore}], lowest score first.
     */
    List<ScoredMember> rangeByScore(String key, double minScore, double maxScore);

    /**
     * @return all fields of the hash at {@code key}; empty when the hash does not exist
     */
    Map<String, String> getHash(String key);

    /**
     * Executes every queued command atomically: either all are applied or none are.
     */
    void execute(StorePipeline pipeline);

    @Override
    default void close() {
    }
}
