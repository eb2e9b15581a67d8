package com.github.dimitryivaniuta.callpipeline.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.callpipeline.error.ApiError;

/**
 * Reads an API error out of a JSON object body.
 *
 * <p>Two shapes are understood: flat {@code {"error": "CODE", "error_description": "..."}}
 * and nested {@code {"error": {"code": "CODE", "message": "..."}}}.
 */
public final class ApiErrorMapper {

    private ApiErrorMapper() {}

    /**
     * @return the error, or null when the body denotes success
     */
    public static ApiError map(int status, JsonNode body) {
        JsonNode error = body.get("error");

        if (error != null && error.isObject()) {
            String code = error.path("code").asText("");
            String message = textOr(error.path("message"), code);
            if (!code.isEmpty()) return ApiError.remote(message, status, code, body);
        } else if (error != null && !error.isNull() && !error.asText("").isEmpty()) {
            String code = error.asText();
            String message = textOr(body.path("error_description"), code);
            return ApiError.remote(message, status, code, body);
        }

        if (status >= 400) {
            return ApiError.remote("HTTP " + status, status, "HTTP_" + status, body);
        }
        return null;
    }

    private static String textOr(JsonNode node, String fallback) {
        String s = node.isMissingNode() || node.isNull() ? "" : node.asText("");
        return s.isEmpty() ? fallback : s;
    }
}
