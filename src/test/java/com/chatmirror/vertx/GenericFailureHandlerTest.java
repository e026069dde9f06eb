package com.chatmirror.vertx;

import io.vertx.core.http.HttpClosedException;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.ext.web.RoutingContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class GenericFailureHandlerTest {
    @Mock
    private RoutingContext routingContext;
    @Mock
    private HttpServerResponse response;

    private GenericFailureHandler handler;

    @BeforeEach
    public void setup() {
        handler = new GenericFailureHandler();
        when(routingContext.response()).thenReturn(response);
        when(routingContext.normalizedPath()).thenReturn("/chat/pull/start");
        when(response.ended()).thenReturn(false);
        when(response.closed()).thenReturn(false);
        when(response.setStatusCode(anyInt())).thenReturn(response);
    }

    @Test
    public void unauthorized_respondsWithReasonPhrase() {
        when(routingContext.statusCode()).thenReturn(401);

        handler.handle(routingContext);

        verify(response).setStatusCode(401);
        verify(response).end("Unauthorized");
    }

    @Test
    public void noStatusCode_defaultsTo500() {
        when(routingContext.statusCode()).thenReturn(-1);
        when(routingContext.failure()).thenReturn(new RuntimeException("boom"));

        handler.handle(routingContext);

        verify(response).setStatusCode(500);
        verify(response).end("Internal Server Error");
    }

    @Test
    public void closedConnection_isIgnored() {
        when(routingContext.statusCode()).thenReturn(-1);
        when(routingContext.failure()).thenReturn(new HttpClosedException("closed"));

        handler.handle(routingContext);

        verify(response, never()).setStatusCode(anyInt());
        verify(response).end();
    }

    @Test
    public void endedResponse_isLeftAlone() {
        when(routingContext.statusCode()).thenReturn(500);
        when(response.ended()).thenReturn(true);

        handler.handle(routingContext);

        verify(response, never()).setStatusCode(anyInt());
    }
}
