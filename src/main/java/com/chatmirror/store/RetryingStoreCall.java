package com.chatmirror.store;

import com.chatmirror.web.TooManyRetriesException;
import com.google.common.base.Stopwatch;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Re-runs an asynchronous store operation on failure with exponential backoff, capped at {@code maxBackoffMs}.
 * Only idempotent operations may be passed in.
 */
public class RetryingStoreCall {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingStoreCall.class);
    private final Vertx vertx;
    private final int retryCount;
    private final long retryBackoffMs;
    private final long maxBackoffMs;

    public RetryingStoreCall(Vertx vertx, int retryCount, long retryBackoffMs, long maxBackoffMs) {
        this.vertx = vertx;
        this.retryCount = retryCount;
        this.retryBackoffMs = retryBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
    }

    public <T> Future<T> call(String operation, Supplier<Future<T>> op) {
        final UUID requestId = UUID.randomUUID();
        return this.call(operation, op, 0, requestId)
                .onFailure(ex -> LOGGER.error("store_error: requestId={} {} failed", requestId, operation, ex));
    }

    private <T> Future<T> call(String operation, Supplier<Future<T>> op, int currentRetries, UUID requestId) {
        final Stopwatch sw = Stopwatch.createStarted();

        Future<T> attempt;
        try {
            attempt = op.get();
        } catch (RuntimeException e) {
            attempt = Future.failedFuture(e);
        }

        return attempt
                .onSuccess(v -> LOGGER.debug("requestId={} {} completed in {}ms, currentRetries={}",
                        requestId, operation, sw.elapsed(TimeUnit.MILLISECONDS), currentRetries))
                .recover(cause -> {
                    if (currentRetries >= this.retryCount) {
                        LOGGER.error("store_error: requestId={} retry count exceeded for {}", requestId, operation);
                        return Future.failedFuture(new TooManyRetriesException(currentRetries, cause));
                    }

                    long backoff = backoffFor(currentRetries);
                    LOGGER.warn("store_error: requestId={} {} failed ({}), currentRetries={}, backing off for {}ms before retrying",
                            requestId, operation, cause.getMessage(), currentRetries, backoff);
                    if (backoff <= 0) {
                        return call(operation, op, currentRetries + 1, requestId);
                    }
                    Promise<T> retried = Promise.promise();
                    vertx.setTimer(backoff, id -> call(operation, op, currentRetries + 1, requestId).onComplete(retried));
                    return retried.future();
                });
    }

    long backoffFor(int currentRetries) {
        if (this.retryBackoffMs <= 0) {
            return 0;
        }
        long backoff = this.retryBackoffMs << Math.min(currentRetries, 20);
        return Math.min(backoff, this.maxBackoffMs);
    }
}
