package com.couchsession.http;

import com.couchsession.error.HttpStatusException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpResponse;

/**
 * Builds readable failure messages from the {@code error}/{@code reason} fields the server
 * puts in its JSON error bodies.
 */
public final class ResponseErrors {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ResponseErrors() {}

    public static boolean isSuccess(HttpResponse<?> response) {
        return response.statusCode() < 400;
    }

    /**
     * "HTTP 404" for a plain failure, "HTTP 404 not_found missing" when the body explains it.
     */
    public static String describe(HttpResponse<String> response) {
        StringBuilder message = new StringBuilder("HTTP ").append(response.statusCode());
        if (response.statusCode() >= 400) {
            JsonNode root = readBody(response);
            if (root != null && root.isObject()) {
                message.append(' ').append(root.path("error").asText(""))
                        .append(' ').append(root.path("reason").asText(""));
            }
        }
        return message.toString();
    }

    /**
     * The {@code error} field of a JSON body, or null when there is none.
     */
    public static String errorField(HttpResponse<String> response) {
        JsonNode root = readBody(response);
        if (root == null || !root.hasNonNull("error")) {
            return null;
        }
        return root.get("error").asText();
    }

    public static void raiseForStatus(HttpResponse<String> response) {
        if (!isSuccess(response)) {
            throw new HttpStatusException(describe(response) + " for url: " + response.uri(), response.statusCode());
        }
    }

    private static JsonNode readBody(HttpResponse<String> response) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readTree(body);
        } catch (Exception ignored) {
            // not JSON; the status alone has to do
            return null;
        }
    }
}
