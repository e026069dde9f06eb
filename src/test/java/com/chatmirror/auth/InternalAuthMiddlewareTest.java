package com.chatmirror.auth;

import io.vertx.core.Handler;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class InternalAuthMiddlewareTest {
    @Mock
    private RoutingContext routingContext;
    @Mock
    private HttpServerRequest request;
    @Mock
    private Handler<RoutingContext> nextHandler;
    private InternalAuthMiddleware internalAuth;

    @BeforeEach
    public void setup() {
        internalAuth = new InternalAuthMiddleware("apiToken");
        when(routingContext.request()).thenReturn(request);
    }

    @Test
    public void internalAuthHandlerSucceed() {
        when(request.getHeader("Authorization")).thenReturn("Bearer apiToken");
        internalAuth.handle(nextHandler).handle(routingContext);
        verify(nextHandler).handle(routingContext);
        verify(routingContext, never()).fail(anyInt());
    }

    @Test
    public void internalAuthHandlerNoAuthorizationHeader() {
        internalAuth.handle(nextHandler).handle(routingContext);
        verifyNoInteractions(nextHandler);
        verify(routingContext).fail(401);
    }

    @Test
    public void authHandlerInvalidAuthorizationHeader() {
        when(request.getHeader("Authorization")).thenReturn("Bogus Header Value");
        internalAuth.handle(nextHandler).handle(routingContext);
        verifyNoInteractions(nextHandler);
        verify(routingContext).fail(401);
    }

    @Test
    public void authHandlerUnknownKey() {
        when(request.getHeader("Authorization")).thenReturn("Bearer unknown-key");
        internalAuth.handle(nextHandler).handle(routingContext);
        verifyNoInteractions(nextHandler);
        verify(routingContext).fail(401);
    }

    @Test
    public void unconfiguredTokenRejectsEverything() {
        InternalAuthMiddleware unconfigured = new InternalAuthMiddleware(null);
        when(request.getHeader("Authorization")).thenReturn("Bearer ");
        unconfigured.handle(nextHandler).handle(routingContext);
        verifyNoInteractions(nextHandler);
        verify(routingContext).fail(401);
    }

    @Test
    public void extractBearerToken() {
        assertEquals("abc", InternalAuthMiddleware.extractBearerToken("bearer abc"));
        assertEquals("abc", InternalAuthMiddleware.extractBearerToken("  BEARER abc "));
        assertNull(InternalAuthMiddleware.extractBearerToken("Basic abc"));
        assertNull(InternalAuthMiddleware.extractBearerToken(null));
    }
}
