package com.github.dimitryivaniuta.callpipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.callpipeline.audit.AuditTrail;
import com.github.dimitryivaniuta.callpipeline.auth.OAuthTokenRefreshClient;
import com.github.dimitryivaniuta.callpipeline.auth.SingleflightTokenRefresher;
import com.github.dimitryivaniuta.callpipeline.executor.BackoffPolicy;
import com.github.dimitryivaniuta.callpipeline.executor.CallExecutor;
import com.github.dimitryivaniuta.callpipeline.gateway.SafeCallService;
import com.github.dimitryivaniuta.callpipeline.idempotency.IdempotencyStore;
import com.github.dimitryivaniuta.callpipeline.metrics.PipelineMetrics;
import com.github.dimitryivaniuta.callpipeline.offline.DeadLetterQueue;
import com.github.dimitryivaniuta.callpipeline.plan.PlanStore;
import com.github.dimitryivaniuta.callpipeline.policy.MethodAllowlist;
import com.github.dimitryivaniuta.callpipeline.policy.RequestValidator;
import com.github.dimitryivaniuta.callpipeline.ratelimit.FileTokenBucketRateLimiter;
import com.github.dimitryivaniuta.callpipeline.ratelimit.LocalTenantRateLimiter;
import com.github.dimitryivaniuta.callpipeline.ratelimit.NoOpTenantRateLimiter;
import com.github.dimitryivaniuta.callpipeline.ratelimit.TenantRateLimiter;
import com.github.dimitryivaniuta.callpipeline.state.JsonLinesAppender;
import com.github.dimitryivaniuta.callpipeline.support.Sleeper;
import com.github.dimitryivaniuta.callpipeline.tenant.AuthMode;
import com.github.dimitryivaniuta.callpipeline.tenant.CredentialState;
import com.github.dimitryivaniuta.callpipeline.tenant.TenantIdentity;
import com.github.dimitryivaniuta.callpipeline.transport.ApiTransport;
import com.github.dimitryivaniuta.callpipeline.transport.RestTemplateApiTransport;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the call pipeline from {@link PipelineProperties}. State files live under
 * {@code rest-pipeline.state-dir}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    public static final String RATE_LIMITER_FILE = "rate_limiter.json";
    public static final String IDEMPOTENCY_FILE = "idempotency.json";
    public static final String PLANS_FILE = "plans.json";
    public static final String RETRY_STATE_FILE = "offline_retry_state.json";
    public static final String DLQ_FILE = "offline_dlq.jsonl";
    public static final String AUDIT_FILE = "audit.jsonl";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PipelineMetrics pipelineMetrics(MeterRegistry registry) {
        return new PipelineMetrics(registry);
    }

    /**
     * Never throws on 4xx/5xx: error bodies carry the API error code the executor classifies.
     */
    @Bean
    public RestTemplate pipelineRestTemplate(RestTemplateBuilder builder, PipelineProperties props) {
        RestTemplate restTemplate = builder
                .setConnectTimeout(props.getExecutor().getConnectTimeout())
                .setReadTimeout(props.getExecutor().getReadTimeout())
                .build();
        restTemplate.setErrorHandler(RestTemplateApiTransport.passThroughErrors());
        return restTemplate;
    }

    @Bean
    public TenantIdentity tenantIdentity(PipelineProperties props) {
        PipelineProperties.Tenant t = props.getTenant();
        TenantIdentity tenant = (t.getAuthMode() == AuthMode.OAUTH)
                ? TenantIdentity.oauth(t.getBaseUrl())
                : TenantIdentity.webhook(t.getBaseUrl(), t.getWebhookUserId(), t.getWebhookCode());
        log.info("Tenant configured baseUrl={}, authMode={}", tenant.getBaseUrl(), tenant.getAuthMode());
        return tenant;
    }

    @Bean
    public CredentialState credentialState(PipelineProperties props) {
        return new CredentialState(props.getTenant().getAccessToken(), props.getTenant().getRefreshToken());
    }

    @Bean
    public ApiTransport apiTransport(RestTemplate pipelineRestTemplate) {
        return new RestTemplateApiTransport(pipelineRestTemplate);
    }

    @Bean
    public TenantRateLimiter tenantRateLimiter(PipelineProperties props,
                                               ObjectMapper mapper,
                                               Clock clock,
                                               PipelineMetrics metrics) {
        PipelineProperties.RateLimiter rl = props.getRateLimiter();
        log.info("Rate limiter mode={}, rate={}/s, burst={}", rl.getMode(), rl.getRate(), rl.getBurst());
        return switch (rl.getMode()) {
            case NONE -> new NoOpTenantRateLimiter();
            case LOCAL -> new LocalTenantRateLimiter(rl.getRate(), rl.getBurst(), metrics);
            case SHARED -> new FileTokenBucketRateLimiter(
                    stateFile(props, RATE_LIMITER_FILE), mapper, rl.getRate(), rl.getBurst(), rl.getStateTtl(),
                    clock, Sleeper.SYSTEM, metrics);
        };
    }

    @Bean
    public CallExecutor callExecutor(PipelineProperties props,
                                     TenantIdentity tenant,
                                     CredentialState credentials,
                                     ApiTransport transport,
                                     TenantRateLimiter rateLimiter,
                                     RestTemplate pipelineRestTemplate,
                                     ObjectMapper mapper,
                                     PipelineMetrics metrics) {
        SingleflightTokenRefresher refresher = null;
        if (tenant.isOAuth() && props.getExecutor().isAutoRefresh()) {
            PipelineProperties.Tenant t = props.getTenant();
            refresher = new SingleflightTokenRefresher(
                    new OAuthTokenRefreshClient(pipelineRestTemplate, mapper, URI.create(t.getTokenEndpoint()),
                            t.getClientId(), t.getClientSecret()),
                    metrics);
        }

        return CallExecutor.builder()
                .tenant(tenant)
                .credentials(credentials)
                .transport(transport)
                .rateLimiter(rateLimiter)
                .refresher(refresher)
                .mapper(mapper)
                .backoff(BackoffPolicy.defaults())
                .sleeper(Sleeper.SYSTEM)
                .metrics(metrics)
                .maxAttempts(props.getExecutor().getMaxAttempts())
                .build();
    }

    @Bean
    public RequestValidator requestValidator(ObjectMapper mapper) {
        return new RequestValidator(mapper);
    }

    @Bean
    public MethodAllowlist methodAllowlist(PipelineProperties props) {
        MethodAllowlist allowlist = MethodAllowlist.of(
                props.getAllowlist().getBasePatterns(), props.getAllowlist().getPacks());
        log.info("Method allowlist packs={}, patterns={}", allowlist.packs(), allowlist.patterns().size());
        return allowlist;
    }

    @Bean
    public IdempotencyStore idempotencyStore(PipelineProperties props, ObjectMapper mapper, Clock clock) {
        return new IdempotencyStore(stateFile(props, IDEMPOTENCY_FILE), mapper, props.getIdempotency().getTtl(), clock);
    }

    @Bean
    public PlanStore planStore(PipelineProperties props, ObjectMapper mapper, Clock clock) {
        return new PlanStore(stateFile(props, PLANS_FILE), mapper, props.getPlans().getTtl(), clock);
    }

    @Bean
    public AuditTrail auditTrail(PipelineProperties props, ObjectMapper mapper) {
        return new AuditTrail(new JsonLinesAppender(stateFile(props, AUDIT_FILE), mapper), props.getAudit().isEnabled());
    }

    @Bean
    public DeadLetterQueue deadLetterQueue(PipelineProperties props, ObjectMapper mapper) {
        return new DeadLetterQueue(new JsonLinesAppender(stateFile(props, DLQ_FILE), mapper), mapper);
    }

    @Bean
    public SafeCallService safeCallService(PipelineProperties props,
                                           CallExecutor executor,
                                           MethodAllowlist allowlist,
                                           RequestValidator validator,
                                           IdempotencyStore idempotencyStore,
                                           PlanStore planStore,
                                           AuditTrail auditTrail,
                                           PipelineMetrics metrics,
                                           Clock clock) {
        return SafeCallService.builder()
                .executor(executor)
                .allowlist(allowlist)
                .validator(validator)
                .idempotency(props.getIdempotency().isEnabled() ? idempotencyStore : null)
                .plans(planStore)
                .audit(auditTrail)
                .metrics(metrics)
                .clock(clock)
                .requirePlan(props.getPlans().isRequirePlan())
                .build();
    }

    static Path stateFile(PipelineProperties props, String name) {
        return props.getStateDir().resolve(name);
    }
}
