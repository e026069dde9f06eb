package com.chatmirror.web;

import com.google.common.base.Stopwatch;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Blocking JSON GET client for the chat platform APIs.
 *
 * <p>Transport errors, 429 and 5xx responses are retried with a doubling backoff. A 404 yields null.
 * Any other non-2xx status raises {@link UnexpectedStatusCodeException}.</p>
 */
public class JsonHttpClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonHttpClient.class);
    private final HttpClient httpClient;
    private final String bearerToken;
    private final int retryCount;
    private final long retryBackoffMs;
    private final Duration requestTimeout;

    public JsonHttpClient(String bearerToken, int retryCount, long retryBackoffMs, Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(requestTimeout).build(), bearerToken, retryCount, retryBackoffMs, requestTimeout);
    }

    public JsonHttpClient(HttpClient httpClient, String bearerToken, int retryCount, long retryBackoffMs, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.bearerToken = bearerToken;
        this.retryCount = retryCount;
        this.retryBackoffMs = retryBackoffMs;
        this.requestTimeout = requestTimeout;
    }

    /**
     * @return the decoded response body, or null when the resource does not exist
     * @throws IOException when retries are exhausted or the body is not JSON
     */
    public JsonObject getJson(URI uri) throws IOException {
        final UUID requestId = UUID.randomUUID();
        Throwable lastFailure = null;

        for (int currentRetries = 0; currentRetries <= retryCount; currentRetries++) {
            if (currentRetries > 0) {
                long backoff = retryBackoffMs << Math.min(currentRetries - 1, 20);
                LOGGER.warn("requestId={} failed sending to {}, currentRetries={}, backing off for {}ms before retrying",
                        requestId, uri, currentRetries - 1, backoff);
                sleep(backoff);
            }

            LOGGER.debug("requestId={} Sending request to {}, currentRetries={}", requestId, uri, currentRetries);
            final Stopwatch sw = Stopwatch.createStarted();
            HttpResponse<String> response;
            try {
                response = httpClient.send(buildRequest(uri), HttpResponse.BodyHandlers.ofString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while calling " + uri);
            } catch (IOException e) {
                lastFailure = e;
                continue;
            }
            sw.stop();

            int status = response.statusCode();
            LOGGER.debug("requestId={} Request to {} completed in {}ms, currentRetries={}, status={}",
                    requestId, uri, sw.elapsed(TimeUnit.MILLISECONDS), currentRetries, status);

            if (status >= 200 && status < 300) {
                return decode(uri, response.body());
            }
            if (status == 404) {
                return null;
            }
            if (status == 429 || status >= 500) {
                lastFailure = new UnexpectedStatusCodeException(status, uri.toString());
                continue;
            }
            throw new UnexpectedStatusCodeException(status, uri.toString());
        }

        LOGGER.error("requestId={} retry count exceeded for sending to {}", requestId, uri);
        throw new IOException("Request to " + uri + " failed", new TooManyRetriesException(retryCount, lastFailure));
    }

    private HttpRequest buildRequest(URI uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET();
        if (bearerToken != null && !bearerToken.isBlank()) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }
        return builder.build();
    }

    private static JsonObject decode(URI uri, String body) throws IOException {
        if (body == null || body.isBlank()) {
            return new JsonObject();
        }
        try {
            return new JsonObject(body);
        } catch (DecodeException e) {
            throw new IOException("Response from " + uri + " is not a JSON object", e);
        }
    }

    private static void sleep(long ms) throws InterruptedIOException {
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted during retry backoff");
        }
    }
}
