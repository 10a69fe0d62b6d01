package com.gotopipe.stacker.auth;

import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guards internal endpoints with a shared bearer token and logs each call once its response has been sent.
 */
public class InternalAuthMiddleware {
    private static final Logger LOGGER = LoggerFactory.getLogger(InternalAuthMiddleware.class);

    private static class InternalAuthHandler {
        private static final String AUTHORIZATION_HEADER = "Authorization";
        private static final String BEARER_TOKEN_PREFIX = "bearer ";

        private final Handler<RoutingContext> innerHandler;
        private final String internalApiToken;

        private InternalAuthHandler(Handler<RoutingContext> handler, String internalApiToken) {
            this.innerHandler = handler;
            this.internalApiToken = internalApiToken;
        }

        private static String extractBearerToken(final String headerValue) {
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

        public void handle(RoutingContext rc) {
            final String authHeaderValue = rc.request().getHeader(AUTHORIZATION_HEADER);
            final String authKey = extractBearerToken(authHeaderValue);
            if (internalApiToken == null || authKey == null || !authKey.equals(internalApiToken)) {
                rc.fail(401);
            } else {
                this.innerHandler.handle(rc);
            }
        }
    }

    private final String internalApiToken;
    private final String auditSource;

    public InternalAuthMiddleware(String internalApiToken, String auditSource) {
        this.internalApiToken = internalApiToken;
        this.auditSource = auditSource;
        if (internalApiToken == null || internalApiToken.isBlank()) {
            LOGGER.warn("no internal api token configured for {}, all requests will be rejected", auditSource);
        }
    }

    public Handler<RoutingContext> handleWithAudit(Handler<RoutingContext> handler) {
        final Handler<RoutingContext> loggedHandler = logAndHandle(handler);
        InternalAuthHandler h = new InternalAuthHandler(loggedHandler, this.internalApiToken);
        return h::handle;
    }

    private Handler<RoutingContext> logAndHandle(Handler<RoutingContext> handler) {
        return ctx -> {
            ctx.addBodyEndHandler(v -> LOGGER.info("audit: source={}, method={}, path={}, status={}",
                auditSource, ctx.request().method(), ctx.normalizedPath(), ctx.response().getStatusCode()));
            handler.handle(ctx);
        };
    }
}
