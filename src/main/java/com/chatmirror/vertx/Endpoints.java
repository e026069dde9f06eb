package com.chatmirror.vertx;

import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public enum Endpoints {
    OPS_HEALTHCHECK("/ops/healthcheck"),
    PULL_START("/chat/pull/start"),
    PULL_STOP("/chat/pull/stop"),
    PULL_STATUS("/chat/pull/status"),
    HISTORY_BACKFILL("/chat/history/backfill");
    private final String path;

    Endpoints(final String path) {
        this.path = path;
    }

    public static Set<String> pathSet() {
        return Stream.of(Endpoints.values()).map(Endpoints::toString).collect(Collectors.toSet());
    }

    @Override
    public String toString() {
        return path;
    }
}
