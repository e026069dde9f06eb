package com.chatmirror.auth;

import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guards internal endpoints with a static bearer token.
 */
public class InternalAuthMiddleware {
    private static final Logger LOGGER = LoggerFactory.getLogger(InternalAuthMiddleware.class);
    private static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BEARER_TOKEN_PREFIX = "bearer ";

    private final String internalApiToken;

    public InternalAuthMiddleware(String internalApiToken) {
        if (internalApiToken == null || internalApiToken.isBlank()) {
            LOGGER.warn("internal api token not configured, all internal requests will be rejected");
        }
        this.internalApiToken = internalApiToken;
    }

    static String extractBearerToken(final String headerValue) {
        if (headerValue == null) {
            return null;
        }

        final String v = headerValue.trim();
        if (v.length() < BEARER_TOKEN_PREFIX.length()) {
            return null;
        }

        final String givenPrefix = v.substring(0, BEARER_TOKEN_PREFIX.length());

        if (!BEARER_TOKEN_PREFIX.equals(givenPrefix.toLowerCase())) {
            return null;
        }
        return v.substring(BEARER_TOKEN_PREFIX.length());
    }

    public Handler<RoutingContext> handle(Handler<RoutingContext> handler) {
        return rc -> {
            final String authKey = extractBearerToken(rc.request().getHeader(AUTHORIZATION_HEADER));
            if (authKey == null || internalApiToken == null || internalApiToken.isBlank() || !authKey.equals(internalApiToken)) {
                // auth key doesn't match internal key
                rc.fail(401);
            } else {
                handler.handle(rc);
            }
        };
    }
}
