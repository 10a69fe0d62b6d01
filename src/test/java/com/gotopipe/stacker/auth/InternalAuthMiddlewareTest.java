package com.gotopipe.stacker.auth;

import io.vertx.core.Handler;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

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
        internalAuth = new InternalAuthMiddleware("apiToken", "test");
        when(routingContext.request()).thenReturn(request);
    }

    @Test
    public void internalAuthHandlerSucceed() {
        when(request.getHeader("Authorization")).thenReturn("Bearer apiToken");
        internalAuth.handleWithAudit(nextHandler).handle(routingContext);
        verify(nextHandler).handle(routingContext);
        verify(routingContext, never()).fail(anyInt());
        verify(routingContext, times(1)).addBodyEndHandler(ArgumentMatchers.<Handler<Void>>any());
    }

    @Test
    public void internalAuthHandlerPrefixIsCaseInsensitive() {
        when(request.getHeader("Authorization")).thenReturn("  bearer apiToken ");
        internalAuth.handleWithAudit(nextHandler).handle(routingContext);
        verify(nextHandler).handle(routingContext);
    }

    @Test
    public void internalAuthHandlerNoAuthorizationHeader() {
        internalAuth.handleWithAudit(nextHandler).handle(routingContext);
        verifyNoInteractions(nextHandler);
        verify(routingContext).fail(401);
        verify(routingContext, never()).addBodyEndHandler(ArgumentMatchers.<Handler<Void>>any());
    }

    @Test
    public void authHandlerInvalidAuthorizationHeader() {
        when(request.getHeader("Authorization")).thenReturn("Bogus");
        internalAuth.handleWithAudit(nextHandler).handle(routingContext);
        verifyNoInteractions(nextHandler);
        verify(routingContext).fail(401);
    }

    @Test
    public void authHandlerUnknownKey() {
        when(request.getHeader("Authorization")).thenReturn("Bearer unknown-key");
        internalAuth.handleWithAudit(nextHandler).handle(routingContext);
        verifyNoInteractions(nextHandler);
        verify(routingContext).fail(401);
    }

    @Test
    public void authHandlerWithoutConfiguredTokenRejectsEverything() {
        InternalAuthMiddleware unconfigured = new InternalAuthMiddleware(null, "test");
        when(request.getHeader("Authorization")).thenReturn("Bearer null");
        unconfigured.handleWithAudit(nextHandler).handle(routingContext);
        verifyNoInteractions(nextHandler);
        verify(routingContext).fail(401);
    }
}
