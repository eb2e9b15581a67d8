package com.github.dimitryivaniuta.callpipeline.error;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Outcome of one executor call: either the response body or the error that ended it.
 */
public record CallResult(JsonNode body, ApiError error, int attempts) {

    public static CallResult success(JsonNode body, int attempts) {
        return new CallResult(body, null, attempts);
    }

    public static CallResult failure(ApiError error, int attempts) {
        return new CallResult(null, error, attempts);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<ApiError> failure() {
        return Optional.ofNullable(error);
    }

    public JsonNode orElseThrow() {
        if (error != null) throw error.toException();
        return body;
    }
}
