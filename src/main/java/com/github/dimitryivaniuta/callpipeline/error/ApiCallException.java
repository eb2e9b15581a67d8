package com.github.dimitryivaniuta.callpipeline.error;

import lombok.Getter;

/**
 * Single exception type for every pipeline failure; inspect {@link #getKind()} instead of
 * catching subclasses.
 */
@Getter
public class ApiCallException extends RuntimeException {

    private final ApiError error;

    public ApiCallException(ApiError error) {
        super(error.code().isEmpty() ? error.message() : error.code() + ": " + error.message());
        this.error = error;
    }

    public ApiCallException(ApiError error, Throwable cause) {
        this(error);
        initCause(cause);
    }

    public ErrorKind getKind() {
        return error.kind();
    }

    public String getCode() {
        return error.code();
    }

    public boolean isFatal() {
        return error.fatal();
    }
}
