package com.chatmirror.pull;

import com.chatmirror.projector.TextRevision;
import com.chatmirror.store.IndexStore;
import com.chatmirror.store.StorePipeline;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Persists pull status records as hashes under {@code pull_status:<subscriptionId>}.
 */
public class PullStatusRepository {
    static final String KEY_PREFIX = "pull_status:";
    static final String FIELD_STATUS = "task_status";
    static final String FIELD_MESSAGE = "message";
    static final String FIELD_TIMESTAMP = "timestamp";

    private final IndexStore store;
    private final Clock clock;

    public PullStatusRepository(IndexStore store) {
        this(store, Clock.systemUTC());
    }

    public PullStatusRepository(IndexStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public static String key(String subscriptionId) {
        return KEY_PREFIX + subscriptionId;
    }

    public void write(String subscriptionId, PullStatus status, String message) {
        store.execute(new StorePipeline().hset(key(subscriptionId), Map.of(
                FIELD_STATUS, status.code(),
                FIELD_MESSAGE, message,
                FIELD_TIMESTAMP, TextRevision.formatTimestamp(Instant.now(clock)))));
    }

    public Optional<PullStatusResponse> read(String subscriptionId) {
        Map<String, String> hash = store.getHash(key(subscriptionId));
        String code = hash.get(FIELD_STATUS);
        if (code == null) {
            return Optional.empty();
        }
        return Optional.of(new PullStatusResponse(subscriptionId, PullStatus.fromCode(code),
                hash.get(FIELD_MESSAGE), hash.get(FIELD_TIMESTAMP)));
    }

    public void delete(String subscriptionId) {
        store.execute(new StorePipeline().del(key(subscriptionId)));
    }
}
