package com.chatmirror.vertx;

import com.chatmirror.Const;
import com.chatmirror.auth.InternalAuthMiddleware;
import com.chatmirror.platform.PlatformBinding;
import com.chatmirror.projector.Platform;
import com.chatmirror.pull.AlreadyRunningException;
import com.chatmirror.pull.PullStatusConsistencyException;
import com.chatmirror.pull.PullStatusResponse;
import com.chatmirror.pull.PullerRegistry;
import com.chatmirror.pull.StopTimeoutException;
import com.chatmirror.pull.SubscriptionPuller;
import com.chatmirror.store.StoreUnavailableException;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.AsyncResult;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.Callable;

import static com.chatmirror.util.HttpResponseHelper.*;

/**
 * Internal HTTP surface for controlling subscription pullers and triggering history backfills.
 * Every operation blocks on the store or a platform API, so all of them run on worker threads.
 */
public class ChatMirrorServiceVerticle extends AbstractVerticle {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChatMirrorServiceVerticle.class);

    static final String PARAM_PLATFORM = "platform";
    static final String PARAM_ENDPOINT = "endpoint";
    static final String PARAM_SUBSCRIPTION = "subscription";
    static final String PARAM_CONVERSATION = "conversation";

    private final PullerRegistry pullers;
    private final Map<Platform, PlatformBinding> bindings;
    private final InternalAuthMiddleware internalAuth;
    private final int listenPort;
    private final boolean isVerbose;

    public ChatMirrorServiceVerticle(JsonObject config, PullerRegistry pullers, Map<Platform, PlatformBinding> bindings) {
        this.pullers = pullers;
        this.bindings = Map.copyOf(bindings);
        this.internalAuth = new InternalAuthMiddleware(config.getString(Const.Config.InternalApiTokenProp));
        this.listenPort = config.getInteger(Const.Config.ServicePortProp, Const.Port.ServicePort);
        this.isVerbose = config.getBoolean(Const.Config.ServiceVerboseProp, false);
    }

    @Override
    public void start(Promise<Void> startPromise) {
        LOGGER.info("starting ChatMirrorServiceVerticle, platforms: {}", bindings.keySet());
        vertx.createHttpServer()
                .requestHandler(createRouter())
                .listen(listenPort, result -> handleListenResult(startPromise, result));
    }

    private void handleListenResult(Promise<Void> startPromise, AsyncResult<HttpServer> result) {
        if (result.succeeded()) {
            LOGGER.info("ChatMirrorServiceVerticle started on HTTP port: {}", result.result().actualPort());
            startPromise.complete();
        } else {
            LOGGER.error("listen failed: " + result.cause());
            startPromise.fail(new Throwable(result.cause()));
        }
    }

    Router createRouter() {
        Router router = Router.router(vertx);
        router.route().handler(BodyHandler.create());

        router.post(Endpoints.PULL_START.toString())
                .handler(internalAuth.handle(this::handlePullStart));
        router.post(Endpoints.PULL_STOP.toString())
                .handler(internalAuth.handle(this::handlePullStop));
        router.get(Endpoints.PULL_STATUS.toString())
                .handler(internalAuth.handle(this::handlePullStatus));
        router.post(Endpoints.HISTORY_BACKFILL.toString())
                .handler(internalAuth.handle(this::handleBackfill));
        router.get(Endpoints.OPS_HEALTHCHECK.toString())
                .handler(this::handleHealthCheck);

        router.route().failureHandler(new GenericFailureHandler());
        return router;
    }

    private void handleHealthCheck(RoutingContext rc) {
        sendSuccess(rc.response(), new JsonObject().put("status", "ok"));
    }

    private void handlePullStart(RoutingContext rc) {
        respond(rc, () -> {
            JsonObject params = params(rc);
            PlatformBinding binding = binding(params);
            SubscriptionPuller puller = pullers.getOrCreate(params.getString(PARAM_ENDPOINT), params.getString(PARAM_SUBSCRIPTION));
            puller.start(binding.handler());
            return puller.checkStatus().toJson();
        });
    }

    private void handlePullStop(RoutingContext rc) {
        respond(rc, () -> {
            JsonObject params = params(rc);
            SubscriptionPuller puller = pullers.getOrCreate(params.getString(PARAM_ENDPOINT), params.getString(PARAM_SUBSCRIPTION));
            PullStatusResponse status = puller.stop();
            return status.toJson();
        });
    }

    private void handlePullStatus(RoutingContext rc) {
        respond(rc, () -> {
            JsonObject params = params(rc);
            SubscriptionPuller puller = pullers.getOrCreate(params.getString(PARAM_ENDPOINT), params.getString(PARAM_SUBSCRIPTION));
            return puller.checkStatus().toJson();
        });
    }

    private void handleBackfill(RoutingContext rc) {
        respond(rc, () -> {
            JsonObject params = params(rc);
            PlatformBinding binding = binding(params);
            return binding.backfill().backfill(params.getString(PARAM_CONVERSATION)).toJson();
        });
    }

    private PlatformBinding binding(JsonObject params) {
        Platform platform = Platform.fromName(params.getString(PARAM_PLATFORM));
        PlatformBinding binding = bindings.get(platform);
        if (binding == null) {
            throw new IllegalArgumentException("Platform " + platform + " is not configured");
        }
        return binding;
    }

    /**
     * Request parameters from the query string, overridden by a JSON body when present.
     */
    static JsonObject params(RoutingContext rc) {
        JsonObject params = new JsonObject();
        rc.queryParams().forEach(e -> params.put(e.getKey(), e.getValue()));
        String body = rc.body() == null ? null : rc.body().asString();
        if (body != null && !body.isBlank()) {
            try {
                params.mergeIn(new JsonObject(body));
            } catch (DecodeException e) {
                throw new IllegalArgumentException("Request body is not a JSON object", e);
            }
        }
        return params;
    }

    private void respond(RoutingContext rc, Callable<JsonObject> operation) {
        vertx.<JsonObject>executeBlocking(promise -> {
            try {
                promise.complete(operation.call());
            } catch (Exception e) {
                promise.fail(e);
            }
        }, false, ar -> {
            HttpServerResponse resp = rc.response();
            if (ar.succeeded()) {
                if (isVerbose) {
                    LOGGER.info("{} {} -> {}", rc.request().method(), rc.normalizedPath(), ar.result().encode());
                }
                sendSuccess(resp, ar.result());
            } else {
                sendFailure(rc, ar.cause());
            }
        });
    }

    private static void sendFailure(RoutingContext rc, Throwable cause) {
        HttpServerResponse resp = rc.response();
        String reason = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        if (cause instanceof IllegalArgumentException) {
            LOGGER.warn("bad request to {}: {}", rc.normalizedPath(), reason);
            sendBadRequest(resp, reason);
        } else if (cause instanceof AlreadyRunningException || cause instanceof PullStatusConsistencyException) {
            LOGGER.warn("conflict on {}: {}", rc.normalizedPath(), reason);
            sendConflict(resp, reason);
        } else if (cause instanceof StoreUnavailableException) {
            LOGGER.error("store_error: {} failed", rc.normalizedPath(), cause);
            sendUnavailable(resp, reason);
        } else if (cause instanceof StopTimeoutException) {
            LOGGER.error("{} timed out: {}", rc.normalizedPath(), reason);
            sendTimeout(resp, reason);
        } else {
            LOGGER.error("unexpected error on {}", rc.normalizedPath(), cause);
            sendError(resp, reason);
        }
    }
}
