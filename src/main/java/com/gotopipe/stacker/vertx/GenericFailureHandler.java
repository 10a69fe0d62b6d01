package com.gotopipe.stacker.vertx;

import io.vertx.core.Handler;
import io.vertx.core.http.HttpClosedException;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.ext.web.RoutingContext;
import org.apache.http.impl.EnglishReasonPhraseCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Router failure handler: answers with the failure's status code and reason phrase,
 * logging client errors as warnings and server errors as errors.
 */
public class GenericFailureHandler implements Handler<RoutingContext> {
    private static final Logger LOGGER = LoggerFactory.getLogger(GenericFailureHandler.class);

    @Override
    public void handle(RoutingContext ctx) {
        int statusCode = ctx.statusCode();
        HttpServerResponse response = ctx.response();
        String url = ctx.normalizedPath();
        Throwable t = ctx.failure();

        // closed by the client, nothing left to answer
        if (t instanceof HttpClosedException) {
            LOGGER.warn("Ignoring exception - URL: [{}] - Error:", url, t);
            if (!response.ended() && !response.closed()) {
                response.end();
            }
            return;
        }

        // If no status code was set, default to 500
        int finalStatusCode = statusCode == -1 ? 500 : statusCode;

        if (finalStatusCode >= 500 && finalStatusCode < 600) {
            LOGGER.error("URL: [{}] - Error response code: [{}] - Error:", url, finalStatusCode, t);
        } else if (finalStatusCode >= 400 && finalStatusCode < 500) {
            if (t == null) {
                LOGGER.warn("URL: [{}] - Error response code: [{}]", url, finalStatusCode);
            } else {
                LOGGER.warn("URL: [{}] - Error response code: [{}] - Error:", url, finalStatusCode, t);
            }
        } else {
            LOGGER.error("URL: [{}] - Unexpected status code: [{}] - Error:", url, finalStatusCode, t);
        }

        if (!response.ended() && !response.closed()) {
            String reason = EnglishReasonPhraseCatalog.INSTANCE.getReason(finalStatusCode, null);
            response.setStatusCode(finalStatusCode)
                    .end(reason != null ? reason : "Error");
        }
    }
}
