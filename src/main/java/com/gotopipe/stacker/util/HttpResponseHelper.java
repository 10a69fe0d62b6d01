package com.gotopipe.stacker.util;

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
     * Send a 200 OK response with idle status and message.
     */
    public static void sendIdle(HttpServerResponse resp, String message) {
        sendJson(resp, 200, new JsonObject().put("status", "idle").put("message", message));
    }

    /**
     * Send a 202 Accepted response indicating async job started.
     */
    public static void sendAccepted(HttpServerResponse resp, String message) {
        sendJson(resp, 202, new JsonObject().put("status", "accepted").put("message", message));
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
}
