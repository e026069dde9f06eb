package com.chatmirror.web;

import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class JsonHttpClientTest {
    private Vertx vertx;
    private HttpServer server;
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        server = vertx.createHttpServer().requestHandler(req -> {
            int n = calls.incrementAndGet();
            lastAuthorization.set(req.getHeader("Authorization"));
            switch (req.path()) {
                case "/ok":
                    req.response().putHeader("Content-Type", "application/json").end("{\"value\":1}");
                    break;
                case "/missing":
                    req.response().setStatusCode(404).end();
                    break;
                case "/forbidden":
                    req.response().setStatusCode(403).end();
                    break;
                case "/flaky":
                    if (n < 3) {
                        req.response().setStatusCode(n == 1 ? 503 : 429).end();
                    } else {
                        req.response().end("{\"value\":3}");
                    }
                    break;
                default:
                    req.response().setStatusCode(500).end();
            }
        }).listen(0).toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    @AfterEach
    void tearDown() throws Exception {
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.actualPort() + path);
    }

    private JsonHttpClient client(int retries) {
        return new JsonHttpClient("secret", retries, 1, Duration.ofSeconds(5));
    }

    @Test
    void ok_returnsBodyAndSendsBearer() throws IOException {
        JsonObject body = client(0).getJson(uri("/ok"));

        assertEquals(1, body.getInteger("value"));
        assertEquals("Bearer secret", lastAuthorization.get());
    }

    @Test
    void notFound_returnsNull() throws IOException {
        assertNull(client(2).getJson(uri("/missing")));
        assertEquals(1, calls.get());
    }

    @Test
    void clientError_isNotRetried() {
        UnexpectedStatusCodeException e = assertThrows(UnexpectedStatusCodeException.class,
                () -> client(3).getJson(uri("/forbidden")));
        assertEquals(403, e.getStatusCode());
        assertEquals(1, calls.get());
    }

    @Test
    void throttlingAndServerErrors_areRetried() throws IOException {
        assertEquals(3, client(3).getJson(uri("/flaky")).getInteger("value"));
        assertEquals(3, calls.get());
    }

    @Test
    void retriesExhausted_throwsIOException() {
        IOException e = assertThrows(IOException.class, () -> client(2).getJson(uri("/broken")));
        assertInstanceOf(TooManyRetriesException.class, e.getCause());
        assertEquals(3, calls.get());
    }
}
