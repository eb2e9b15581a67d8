package com.github.dimitryivaniuta.callpipeline.error;

import java.util.Set;

public final class ErrorCodes {
    private ErrorCodes() {}

    public static final Set<String> FATAL = Set.of(
            "WRONG_AUTH_TYPE",
            "insufficient_scope",
            "INVALID_CREDENTIALS",
            "NO_AUTH_FOUND",
            "METHOD_NOT_FOUND",
            "ERROR_METHOD_NOT_FOUND",
            "INVALID_REQUEST",
            "ACCESS_DENIED",
            "PAYMENT_REQUIRED"
    );

    public static final String QUERY_LIMIT_EXCEEDED = "QUERY_LIMIT_EXCEEDED";
    public static final String EXPIRED_TOKEN = "expired_token";

    // transport / executor
    public static final String RETRIES_EXHAUSTED = "RETRIES_EXHAUSTED";
    public static final String NETWORK_ERROR = "NETWORK_ERROR";
    public static final String INTERRUPTED = "INTERRUPTED";

    // schema
    public static final String INVALID_JSON = "INVALID_JSON";
    public static final String INVALID_REQUEST_SCHEMA = "INVALID_REQUEST_SCHEMA";
    public static final String INVALID_OFFLINE_RESPONSE_SCHEMA = "INVALID_OFFLINE_RESPONSE_SCHEMA";
    public static final String INVALID_EVENT_SCHEMA = "INVALID_EVENT_SCHEMA";

    // workflow
    public static final String PLAN_NOT_FOUND = "PLAN_NOT_FOUND";
    public static final String PLAN_TENANT_MISMATCH = "PLAN_TENANT_MISMATCH";
    public static final String PLAN_ALREADY_EXECUTED = "PLAN_ALREADY_EXECUTED";
    public static final String PLAN_METHOD_MISMATCH = "PLAN_METHOD_MISMATCH";
    public static final String PLAN_REQUIRED = "PLAN_REQUIRED";
    public static final String UNKNOWN_PACK = "UNKNOWN_PACK";
    public static final String BATCH_TOO_LARGE = "BATCH_TOO_LARGE";
    public static final String METHOD_NOT_ALLOWED = "METHOD_NOT_ALLOWED";
    public static final String CONFIRMATION_REQUIRED = "CONFIRMATION_REQUIRED";

    // refresh
    public static final String MISSING_REFRESH_TOKEN = "MISSING_REFRESH_TOKEN";
    public static final String MISSING_CLIENT_CREDENTIALS = "MISSING_CLIENT_CREDENTIALS";
    public static final String INVALID_REFRESH_RESPONSE = "INVALID_REFRESH_RESPONSE";
}
