package com.chatmirror.projector;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;

/**
 * Counters for projected chat events, tagged by platform.
 */
public class ProjectionMetrics {
    private final Platform platform;
    private final Counter skipped;
    private final Counter failed;

    public ProjectionMetrics(Platform platform) {
        this.platform = platform;
        this.skipped = Counter
                .builder("chat_mirror_events_skipped_total")
                .description("counter for chat events that left the mirror unchanged")
                .tag("platform", platform.keyPrefix())
                .register(Metrics.globalRegistry);
        this.failed = Counter
                .builder("chat_mirror_events_failed_total")
                .description("counter for chat events that could not be projected")
                .tag("platform", platform.keyPrefix())
                .register(Metrics.globalRegistry);
    }

    public void recordApplied(ChangeType type, int count) {
        Counter
                .builder("chat_mirror_events_applied_total")
                .description("counter for chat events written to the mirror")
                .tags("platform", platform.keyPrefix(), "change_type", type.wireName())
                .register(Metrics.globalRegistry)
                .increment(count);
    }

    public void recordSkipped(int count) {
        skipped.increment(count);
    }

    public void recordFailed() {
        failed.increment();
    }
}
