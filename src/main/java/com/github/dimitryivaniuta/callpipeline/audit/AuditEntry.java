package com.github.dimitryivaniuta.callpipeline.audit;

import com.github.dimitryivaniuta.callpipeline.policy.RiskTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntry {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";
    public static final String STATUS_REPLAY = "idempotent_replay";

    private Instant timestamp;
    private String requestId;
    private String tenant;
    private String method;
    private RiskTier risk;
    private String status; // ok / error / idempotent_replay
    private String errorCode;
    private String errorMessage;
    private long durationMs;
    private boolean allowlisted;
    private List<String> packs;
    private String apiVersion;
    /** Param names only; values are never written. */
    private List<String> paramKeys;
    private String planId;
    private String idempotencyKey;
    private boolean idempotentReplay;
}
