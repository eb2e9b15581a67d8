package com.github.dimitryivaniuta.callpipeline.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.callpipeline.audit.AuditEntry;
import com.github.dimitryivaniuta.callpipeline.audit.AuditTrail;
import com.github.dimitryivaniuta.callpipeline.error.ApiCallException;
import com.github.dimitryivaniuta.callpipeline.error.ApiError;
import com.github.dimitryivaniuta.callpipeline.error.CallResult;
import com.github.dimitryivaniuta.callpipeline.error.ErrorCodes;
import com.github.dimitryivaniuta.callpipeline.executor.CallExecutor;
import com.github.dimitryivaniuta.callpipeline.idempotency.IdempotencyStore;
import com.github.dimitryivaniuta.callpipeline.metrics.PipelineMetrics;
import com.github.dimitryivaniuta.callpipeline.plan.Plan;
import com.github.dimitryivaniuta.callpipeline.plan.PlanStore;
import com.github.dimitryivaniuta.callpipeline.policy.MethodAllowlist;
import com.github.dimitryivaniuta.callpipeline.policy.RequestValidator;
import com.github.dimitryivaniuta.callpipeline.policy.RiskClassifier;
import com.github.dimitryivaniuta.callpipeline.policy.RiskTier;
import com.github.dimitryivaniuta.callpipeline.support.MdcKeys;
import com.github.dimitryivaniuta.callpipeline.tenant.ApiVersion;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Policy gate in front of {@link CallExecutor}: validation, allowlist, risk confirmation,
 * plan-then-execute, idempotent replay and audit.
 *
 * <p>Gate failures are thrown as {@link ApiCallException} with a WORKFLOW or SCHEMA kind
 * before anything is sent.
 */
@Slf4j
public class SafeCallService {

    private final CallExecutor executor;
    private final MethodAllowlist allowlist;
    private final RequestValidator validator;
    private final IdempotencyStore idempotency;
    private final PlanStore plans;
    private final AuditTrail audit;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final boolean requirePlan;

    @Builder
    public SafeCallService(CallExecutor executor,
                           MethodAllowlist allowlist,
                           RequestValidator validator,
                           IdempotencyStore idempotency,
                           PlanStore plans,
                           AuditTrail audit,
                           PipelineMetrics metrics,
                           Clock clock,
                           boolean requirePlan) {
        this.executor = executor;
        this.allowlist = allowlist;
        this.validator = validator;
        this.idempotency = idempotency;
        this.plans = plans;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = (clock == null) ? Clock.systemUTC() : clock;
        this.requirePlan = requirePlan;
    }

    /**
     * Validates the call and stores it as a plan to be executed later with {@link CallRequest#planId()}.
     */
    public Plan plan(CallRequest request) {
        String method = normalize(request.method());
        Map<String, Object> params = paramsOf(request.params());

        validator.validate(method, params);
        boolean allowed = enforceAllowlist(method, params, request.allowUnlisted());
        RiskTier risk = RiskClassifier.classify(method, params);

        return plans.create(tenantKey(), method, params, risk, allowed, allowlist.packs());
    }

    public CallResponse execute(CallRequest request) {
        String requestId = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        MDC.put(MdcKeys.REQUEST_ID, requestId);
        MDC.put(MdcKeys.TENANT, tenantKey());
        try {
            return gateAndExecute(request, requestId);
        } finally {
            MDC.remove(MdcKeys.IDEMPOTENCY_KEY);
            MDC.remove(MdcKeys.TENANT);
            MDC.remove(MdcKeys.REQUEST_ID);
        }
    }

    private CallResponse gateAndExecute(CallRequest request, String requestId) {
        String method = normalize(request.method());
        Map<String, Object> params = paramsOf(request.params());
        String planId = blankToNull(request.planId());

        if (planId != null) {
            Plan plan = plans.consume(planId, tenantKey());
            String planned = normalize(plan.getMethod());
            if (!method.isEmpty() && !method.equals(planned)) {
                throw ApiError.workflow(ErrorCodes.PLAN_METHOD_MISMATCH,
                        "method '" + method + "' does not match planned method '" + planned + "'").toException();
            }
            method = planned;
            params = paramsOf(plan.getParams());
        }

        validator.validate(method, params);
        boolean allowed = enforceAllowlist(method, params, request.allowUnlisted());
        RiskTier risk = RiskClassifier.classify(method, params);

        if (requirePlan && risk.atLeast(RiskTier.WRITE) && planId == null) {
            throw ApiError.workflow(ErrorCodes.PLAN_REQUIRED,
                    "plan is required for " + risk.wireName() + " operation '" + method + "'").toException();
        }
        if (planId == null) {
            if (risk == RiskTier.WRITE && !request.confirmWrite()) {
                throw ApiError.workflow(ErrorCodes.CONFIRMATION_REQUIRED,
                        "write method '" + method + "' requires confirmWrite").toException();
            }
            if (risk == RiskTier.DESTRUCTIVE && !request.confirmDestructive()) {
                throw ApiError.workflow(ErrorCodes.CONFIRMATION_REQUIRED,
                        "destructive method '" + method + "' requires confirmDestructive").toException();
            }
        }

        ApiVersion version = (request.apiVersion() == null) ? ApiVersion.V2 : request.apiVersion();
        AuditEntry.AuditEntryBuilder row = AuditEntry.builder()
                .requestId(requestId)
                .tenant(tenantKey())
                .method(method)
                .risk(risk)
                .allowlisted(allowed)
                .packs(allowlist.packs())
                .apiVersion(version.name())
                .paramKeys(params.keySet().stream().sorted().toList())
                .planId(planId == null ? "" : planId);

        long startNs = System.nanoTime();
        String key = "";
        boolean useIdempotency = idempotency != null && risk.atLeast(RiskTier.WRITE) && !request.skipIdempotency();
        if (useIdempotency) {
            key = idempotency.keyFor(tenantKey(), method, params, request.idempotencyKey());
            MDC.put(MdcKeys.IDEMPOTENCY_KEY, key);
            var cached = idempotency.checkReplay(key);
            if (cached.isPresent()) {
                log.info("Replaying cached response for method={}", method);
                metrics.idempotencyReplayed(method);
                audit.record(row
                        .timestamp(clock.instant())
                        .status(AuditEntry.STATUS_REPLAY)
                        .durationMs(elapsedMs(startNs))
                        .idempotencyKey(key)
                        .idempotentReplay(true)
                        .build());
                return new CallResponse(cached.get(), true, risk, key, planId);
            }
            idempotency.start(key);
        }
        row.idempotencyKey(key);

        CallResult result;
        try {
            result = executor.execute(method, params, version);
        } catch (RuntimeException ex) {
            log.warn("Call failed unexpectedly for method={}, type={}", method, ex.getClass().getSimpleName());
            if (useIdempotency) {
                try {
                    idempotency.clear(key);
                } catch (RuntimeException clearEx) {
                    ex.addSuppressed(clearEx);
                }
            }
            audit.record(row
                    .timestamp(clock.instant())
                    .status(AuditEntry.STATUS_ERROR)
                    .errorCode(ex.getClass().getSimpleName())
                    .errorMessage(String.valueOf(ex.getMessage()))
                    .durationMs(elapsedMs(startNs))
                    .build());
            throw ex;
        }
        if (!result.isSuccess()) {
            ApiError error = result.error();
            if (useIdempotency) idempotency.clear(key);
            audit.record(row
                    .timestamp(clock.instant())
                    .status(AuditEntry.STATUS_ERROR)
                    .errorCode(error.code())
                    .errorMessage(error.message())
                    .durationMs(elapsedMs(startNs))
                    .build());
            throw error.toException();
        }

        JsonNode body = result.body();
        if (useIdempotency) idempotency.done(key, body);
        audit.record(row
                .timestamp(clock.instant())
                .status(AuditEntry.STATUS_OK)
                .durationMs(elapsedMs(startNs))
                .build());
        return new CallResponse(body, false, risk, key, planId);
    }

    /**
     * @return whether the method (and every batch sub-command) is allowlisted
     */
    private boolean enforceAllowlist(String method, Map<String, Object> params, boolean allowUnlisted) {
        boolean allowed = allowlist.isAllowed(method);
        if (!allowed && !allowUnlisted) {
            throw ApiError.workflow(ErrorCodes.METHOD_NOT_ALLOWED,
                    "method '" + method + "' is outside allowlist").toException();
        }

        if ("batch".equals(method) && params.get("cmd") instanceof Map<?, ?> commands) {
            for (Map.Entry<?, ?> e : commands.entrySet()) {
                if (!(e.getValue() instanceof String command)) continue;
                String sub = RiskClassifier.batchCommandMethod(command);
                if (!allowlist.isAllowed(sub) && !allowUnlisted) {
                    throw ApiError.workflow(ErrorCodes.METHOD_NOT_ALLOWED,
                            "batch command '" + e.getKey() + "' uses non-allowlisted method '" + sub + "'").toException();
                }
            }
        }
        return allowed;
    }

    private String tenantKey() {
        return executor.getTenant().rateLimitKey();
    }

    private static Map<String, Object> paramsOf(Map<String, Object> params) {
        return (params == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
    }

    private static String normalize(String method) {
        return (method == null) ? "" : method.trim().toLowerCase(Locale.ROOT);
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    private static long elapsedMs(long startNs) {
        return (System.nanoTime() - startNs) / 1_000_000L;
    }
}
