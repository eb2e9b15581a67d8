package com.github.dimitryivaniuta.callpipeline.plan;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.callpipeline.error.ApiError;
import com.github.dimitryivaniuta.callpipeline.error.ErrorCodes;
import com.github.dimitryivaniuta.callpipeline.policy.RiskTier;
import com.github.dimitryivaniuta.callpipeline.state.LockedJsonFile;
import com.github.dimitryivaniuta.callpipeline.support.CanonicalJson;
import com.github.dimitryivaniuta.callpipeline.support.Hashing;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * File-backed plans for plan-then-execute approval of risky calls.
 * Expired plans are dropped on every access; executed plans stay until they expire so a
 * second execution is reported as such.
 */
@Slf4j
public class PlanStore {

    public static final Duration MIN_TTL = Duration.ofSeconds(60);

    private final LockedJsonFile<TreeMap<String, Plan>> file;
    private final CanonicalJson canonicalJson;
    private final Duration ttl;
    private final Clock clock;

    public PlanStore(Path stateFile, ObjectMapper mapper, Duration ttl, Clock clock) {
        this.file = new LockedJsonFile<>(stateFile, mapper, new TypeReference<>() {}, TreeMap::new);
        this.canonicalJson = new CanonicalJson(mapper);
        this.ttl = (ttl.compareTo(MIN_TTL) < 0) ? MIN_TTL : ttl;
        this.clock = clock;
    }

    public Plan create(String tenant,
                       String method,
                       Map<String, ?> params,
                       RiskTier risk,
                       boolean allowlisted,
                       List<String> packs) {
        Instant now = clock.instant();
        Map<String, Object> p = (params == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(params);

        String seed = tenant + "|" + method + "|" + risk.wireName() + "|" + canonicalJson.write(p)
                + "|" + now.getEpochSecond() + "|" + UUID.randomUUID().toString().replace("-", "");

        Plan plan = Plan.builder()
                .planId(Hashing.sha256Hex(seed, 20))
                .tenant(tenant)
                .method(method)
                .params(p)
                .risk(risk)
                .allowlisted(allowlisted)
                .packs(List.copyOf(packs))
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .executed(false)
                .build();

        file.update(plans -> {
            purgeExpired(plans, now);
            plans.put(plan.getPlanId(), plan);
            return null;
        });
        log.info("Plan created planId={}, method={}, risk={}", plan.getPlanId(), method, risk);
        return plan;
    }

    /**
     * Marks the plan executed and returns it.
     *
     * @throws com.github.dimitryivaniuta.callpipeline.error.ApiCallException {@code PLAN_NOT_FOUND},
     *         {@code PLAN_TENANT_MISMATCH} or {@code PLAN_ALREADY_EXECUTED}
     */
    public Plan consume(String planId, String tenant) {
        Instant now = clock.instant();
        return file.update(plans -> {
            purgeExpired(plans, now);
            Plan plan = plans.get(planId);
            if (plan == null) {
                throw ApiError.workflow(ErrorCodes.PLAN_NOT_FOUND, "plan '" + planId + "' not found or expired").toException();
            }
            if (!plan.getTenant().equals(tenant)) {
                throw ApiError.workflow(ErrorCodes.PLAN_TENANT_MISMATCH, "plan tenant mismatch").toException();
            }
            if (plan.isExecuted()) {
                throw ApiError.workflow(ErrorCodes.PLAN_ALREADY_EXECUTED, "plan '" + planId + "' already executed").toException();
            }
            plan.setExecuted(true);
            plan.setExecutedAt(now);
            return plan.toBuilder().build();
        });
    }

    /** Read-only lookup; expired plans are not returned. */
    public Optional<Plan> find(String planId) {
        Instant now = clock.instant();
        return Optional.ofNullable(file.read().get(planId)).filter(p -> !p.isExpired(now));
    }

    private static void purgeExpired(TreeMap<String, Plan> plans, Instant now) {
        plans.values().removeIf(p -> p == null || p.isExpired(now));
    }
}
