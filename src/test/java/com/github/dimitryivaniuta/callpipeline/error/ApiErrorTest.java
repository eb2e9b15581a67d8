package com.github.dimitryivaniuta.callpipeline.error;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApiErrorTest {

    @Test
    void shouldNeverRetryFatalCodes() {
        ApiError error = ApiError.remote("denied", 503, "ACCESS_DENIED", null);

        assertThat(error.fatal()).isTrue();
        assertThat(error.retryable()).isFalse();
        assertThat(error.kind()).isEqualTo(ErrorKind.FATAL);
    }

    @Test
    void shouldClassifyByCodeAndStatus() {
        assertThat(ApiError.remote("", 200, ErrorCodes.QUERY_LIMIT_EXCEEDED, null).kind()).isEqualTo(ErrorKind.TRANSIENT);
        assertThat(ApiError.remote("", 500, "X", null).kind()).isEqualTo(ErrorKind.TRANSIENT);
        assertThat(ApiError.remote("", 404, "NOT_FOUND", null).kind()).isEqualTo(ErrorKind.REJECTED);
        assertThat(ApiError.remote("", 404, "NOT_FOUND", null).retryable()).isFalse();
    }

    @Test
    void shouldTreatNetworkKindAsRetryable() {
        ApiError error = ApiError.of(ErrorKind.NETWORK, ErrorCodes.NETWORK_ERROR, "timeout");

        assertThat(error.retryable()).isTrue();
        assertThat(error.payload().isMissingNode()).isTrue();
    }

    @Test
    void shouldExposeErrorThroughCallResult() {
        CallResult failed = CallResult.failure(ApiError.workflow(ErrorCodes.PLAN_REQUIRED, "plan first"), 0);

        assertThat(failed.isSuccess()).isFalse();
        assertThatThrownBy(failed::orElseThrow)
                .isInstanceOf(ApiCallException.class)
                .hasMessageContaining("plan first");
    }
}
