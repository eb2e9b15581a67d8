package com.github.dimitryivaniuta.callpipeline.plan;

import com.github.dimitryivaniuta.callpipeline.policy.RiskTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A reviewed call waiting for approval. Executed at most once, before {@code expiresAt}.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Plan {

    private String planId;
    private String tenant;
    private String method;
    private Map<String, Object> params;
    private RiskTier risk;
    private boolean allowlisted;
    private List<String> packs;
    private Instant createdAt;
    private Instant expiresAt;
    private boolean executed;
    private Instant executedAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }
}
