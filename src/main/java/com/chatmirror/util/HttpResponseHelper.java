package com.chatmirror.util;

import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonObject;

/**
 * Utility class for HTTP JSON response handling.
 * Ensures consistent response format across handlers.
 */
public class HttpResponseHelper {

    /**
     * Send a JSON response with the specified status code.
     */
    public static void sendJson(HttpServerResponse resp, int statusCode, JsonObject body) {
        resp.setStatusCode(statusCode)
            .putHeader(HttpHeaders.CONTENT_TYPE, "application/json")
            .end(body.encode());
    }

    /**
     * Send a 200 OK response with JSON body.
     */
    public static void sendSuccess(HttpServerResponse resp, JsonObject body) {
        sendJson(resp, 200, body);
    }

    /**
     * Send a 400 Bad Request response.
     */
    public static void sendBadRequest(HttpServerResponse resp, String reason) {
        sendJson(resp, 400, new JsonObject().put("status", "bad_request").put("reason", reason));
    }

    /**
     * Send a 409 Conflict response.
     */
    public static void sendConflict(HttpServerResponse resp, String reason) {
        sendJson(resp, 409, new JsonObject().put("status", "conflict").put("reason", reason));
    }

    /**
     * Send a 503 Service Unavailable response.
     */
    public static void sendUnavailable(HttpServerResponse resp, String reason) {
        sendJson(resp, 503, new JsonObject().put("status", "unavailable").put("reason", reason));
    }

    /**
     * Send a 504 Gateway Timeout response.
     */
    public static void sendTimeout(HttpServerResponse resp, String reason) {
        sendJson(resp, 504, new JsonObject().put("status", "timeout").put("reason", reason));
    }

    /**
     * Send a 500 Internal Server Error response.
     */
    public static void sendError(HttpServerResponse resp, String error) {
        sendJson(resp, 500, new JsonObject().put("status", "failed").put("error", error));
    }
}
