package com.chatmirror.store;

import com.chatmirror.Const;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.redis.client.Command;
import io.vertx.redis.client.Redis;
import io.vertx.redis.client.RedisAPI;
import io.vertx.redis.client.RedisOptions;
import io.vertx.redis.client.Request;
import io.vertx.redis.client.Response;
import io.vertx.redis.client.ResponseType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link IndexStore} backed by Redis through the Vert.x Redis client.
 *
 * <p>Every call is submitted to the client asynchronously and the calling thread waits for the result for at most
 * {@code timeoutMs}. Calling from a Vert.x event-loop thread is rejected. Pipelines are sent on one connection
 * wrapped in MULTI/EXEC.</p>
 */
public class RedisIndexStore implements IndexStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(RedisIndexStore.class);

    private final Redis redis;
    private final RedisAPI api;
    private final RetryingStoreCall retrying;
    private final long timeoutMs;

    public RedisIndexStore(Redis redis, RetryingStoreCall retrying, long timeoutMs) {
        this.redis = redis;
        this.api = RedisAPI.api(redis);
        this.retrying = retrying;
        this.timeoutMs = timeoutMs;
    }

    public static RedisIndexStore create(Vertx vertx, JsonObject config) {
        String connectionString = config.getString(Const.Config.RedisConnectionStringProp, "redis://localhost:6379");
        RedisOptions options = new RedisOptions()
                .setConnectionString(connectionString)
                .setMaxPoolSize(config.getInteger(Const.Config.RedisMaxPoolSizeProp, 8))
                .setMaxPoolWaiting(config.getInteger(Const.Config.RedisMaxPoolWaitingProp, 64));
        RetryingStoreCall retrying = new RetryingStoreCall(vertx,
                config.getInteger(Const.Config.StoreRetryCountProp, 2),
                config.getLong(Const.Config.StoreRetryBackoffMsProp, 1000L),
                config.getLong(Const.Config.StoreMaxRetryBackoffMsProp, 3000L));
        long timeoutMs = config.getLong(Const.Config.StoreTimeoutMsProp, 15000L);
        LOGGER.info("redis index store initialized: maxPoolSize={}, timeoutMs={}", options.getMaxPoolSize(), timeoutMs);
        return new RedisIndexStore(Redis.createClient(vertx, options), retrying, timeoutMs);
    }

    @Override
    public String get(String key) {
        Response response = await("GET " + key, retrying.call("GET " + key, () -> api.get(key)));
        return response == null ? null : response.toString();
    }

    @Override
    public Map<String, String> getAll(Collection<String> keys) {
        Map<String, String> found = new LinkedHashMap<>();
        if (keys.isEmpty()) {
            return found;
        }
        List<String> keyList = new ArrayList<>(keys);
        Response response = await("MGET " + keyList.size() + " keys",
                retrying.call("MGET", () -> api.mget(keyList)));
        for (int i = 0; i < keyList.size() && response != null && i < response.size(); i++) {
            Response value = response.get(i);
            if (value != null) {
                found.put(keyList.get(i), value.toString());
            }
        }
        return found;
    }

    @Override
    public Double score(String key, String member) {
        Response response = await("ZSCORE " + key, retrying.call("ZSCORE " + key, () -> api.zscore(key, member)));
        return response == null ? null : response.toDouble();
    }

    @Override
    public List<ScoredMember> rangeByScore(String key, double minScore, double maxScore) {
        List<String> args = List.of(key, formatBound(minScore), formatBound(maxScore), "WITHSCORES");
        Response response = await("ZRANGEBYSCORE " + key,
                retrying.call("ZRANGEBYSCORE " + key, () -> api.zrangebyscore(args)));
        List<ScoredMember> members = new ArrayList<>();
        if (response == null) {
            return members;
        }
        if (response.size() > 0 && response.get(0).type() == ResponseType.MULTI) {
            // RESP3 replies with [member, score] pairs
            for (Response pair : response) {
                members.add(new ScoredMember(pair.get(0).toString(), pair.get(1).toDouble()));
            }
        } else {
            for (int i = 0; i + 1 < response.size(); i += 2) {
                members.add(new ScoredMember(response.get(i).toString(), response.get(i + 1).toDouble()));
            }
        }
        return members;
    }

    @Override
    public Map<String, String> getHash(String key) {
        Response response = await("HGETALL " + key, retrying.call("HGETALL " + key, () -> api.hgetall(key)));
        Map<String, String> hash = new HashMap<>();
        if (response == null) {
            return hash;
        }
        for (String field : response.getKeys()) {
            Response value = response.get(field);
            hash.put(field, value == null ? null : value.toString());
        }
        return hash;
    }

    @Override
    public void execute(StorePipeline pipeline) {
        if (pipeline.isEmpty()) {
            return;
        }
        List<Request> requests = new ArrayList<>(pipeline.size() + 2);
        requests.add(Request.cmd(Command.MULTI));
        for (StoreCommand command : pipeline.commands()) {
            requests.add(toRequest(command));
        }
        requests.add(Request.cmd(Command.EXEC));

        String operation = "MULTI/EXEC of " + pipeline.size() + " commands";
        await(operation, retrying.call(operation, () -> redis.batch(requests).compose(responses -> {
            Response exec = responses.get(responses.size() - 1);
            if (exec == null) {
                return Future.failedFuture(new IllegalStateException("transaction aborted by server"));
            }
            return Future.succeededFuture(exec);
        })));
    }

    @Override
    public void close() {
        redis.close();
        LOGGER.info("redis index store closed");
    }

    private static Request toRequest(StoreCommand command) {
        switch (command.type()) {
            case SET:
                return Request.cmd(Command.SET).arg(command.key()).arg(command.value());
            case DEL:
                return Request.cmd(Command.DEL).arg(command.key());
            case ZADD:
                return Request.cmd(Command.ZADD).arg(command.key()).arg(formatScore(command.score())).arg(command.member());
            case ZREM:
                return Request.cmd(Command.ZREM).arg(command.key()).arg(command.member());
            case HSET:
                Request hset = Request.cmd(Command.HSET).arg(command.key());
                command.fields().forEach((field, value) -> hset.arg(field).arg(value));
                return hset;
            default:
                throw new IllegalArgumentException("Unsupported store command: " + command.type());
        }
    }

    static String formatScore(double score) {
        return BigDecimal.valueOf(score).toPlainString();
    }

    static String formatBound(double bound) {
        if (bound == Double.NEGATIVE_INFINITY) {
            return "-inf";
        }
        if (bound == Double.POSITIVE_INFINITY) {
            return "+inf";
        }
        return formatScore(bound);
    }

    private <T> T await(String operation, Future<T> future) {
        if (Context.isOnEventLoopThread()) {
            throw new IllegalStateException("Blocking store call " + operation + " issued from an event-loop thread");
        }
        try {
            return future.toCompletionStage().toCompletableFuture().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while waiting for " + operation, e);
        } catch (TimeoutException e) {
            throw new StoreUnavailableException(operation + " did not complete within " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            throw new StoreUnavailableException(operation + " failed", e.getCause());
        }
    }
}
