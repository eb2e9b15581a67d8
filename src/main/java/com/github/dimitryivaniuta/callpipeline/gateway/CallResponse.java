package com.github.dimitryivaniuta.callpipeline.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.callpipeline.policy.RiskTier;

/**
 * @param replayed true when {@code body} came from the idempotency store instead of the API
 */
public record CallResponse(
        JsonNode body,
        boolean replayed,
        RiskTier risk,
        String idempotencyKey,
        String planId
) {
}
