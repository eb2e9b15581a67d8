package com.github.dimitryivaniuta.callpipeline.gateway;

import com.github.dimitryivaniuta.callpipeline.tenant.ApiVersion;
import lombok.Builder;

import java.util.Map;

/**
 * One call submitted to {@link SafeCallService}.
 *
 * @param method             API method; may be omitted when {@code planId} is set
 * @param confirmWrite       caller acknowledges a write call
 * @param confirmDestructive caller acknowledges a destructive call
 * @param allowUnlisted      bypass the method allowlist for this call
 * @param idempotencyKey     explicit key; derived from params when blank
 * @param skipIdempotency    do not record or replay this write
 * @param planId             execute this previously created plan
 */
@Builder
public record CallRequest(
        String method,
        Map<String, Object> params,
        ApiVersion apiVersion,
        boolean confirmWrite,
        boolean confirmDestructive,
        boolean allowUnlisted,
        String idempotencyKey,
        boolean skipIdempotency,
        String planId
) {
}
