package com.github.dimitryivaniuta.callpipeline.error;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * One failed call (or a failure raised before any call was made).
 *
 * <p>{@code fatal} and {@code retryable} are derived from the code and status, so a fatal
 * code is never retryable regardless of the HTTP status it arrived with.
 */
public record ApiError(
        String message,
        int status,
        String code,
        JsonNode payload,
        ErrorKind kind
) {

    public ApiError {
        message = (message == null) ? "" : message;
        code = (code == null) ? "" : code;
        payload = (payload == null) ? MissingNode.getInstance() : payload;
        if (kind == null) kind = classify(code, status);
    }

    /**
     * Error reported by the remote API, kind derived from code and status.
     */
    public static ApiError remote(String message, int status, String code, JsonNode payload) {
        return new ApiError(message, status, code, payload, null);
    }

    public static ApiError of(ErrorKind kind, String code, String message) {
        return new ApiError(message, 0, code, null, kind);
    }

    public static ApiError workflow(String code, String message) {
        return of(ErrorKind.WORKFLOW, code, message);
    }

    public static ApiError schema(String code, String message) {
        return of(ErrorKind.SCHEMA, code, message);
    }

    public boolean fatal() {
        return ErrorCodes.FATAL.contains(code);
    }

    public boolean retryable() {
        if (fatal()) return false;
        return ErrorCodes.QUERY_LIMIT_EXCEEDED.equals(code)
                || status >= 500
                || kind == ErrorKind.NETWORK;
    }

    public ApiCallException toException() {
        return new ApiCallException(this);
    }

    private static ErrorKind classify(String code, int status) {
        if (ErrorCodes.FATAL.contains(code)) return ErrorKind.FATAL;
        if (ErrorCodes.QUERY_LIMIT_EXCEEDED.equals(code) || status >= 500) return ErrorKind.TRANSIENT;
        return ErrorKind.REJECTED;
    }

    @Override
    public String toString() {
        return "ApiError{kind=" + kind + ", code=" + code + ", status=" + status + ", message=" + message + "}";
    }
}
