package com.github.dimitryivaniuta.callpipeline.config;

import com.github.dimitryivaniuta.callpipeline.ratelimit.RateLimiterMode;
import com.github.dimitryivaniuta.callpipeline.tenant.AuthMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "rest-pipeline")
public class PipelineProperties {

    /** Directory holding every state file (rate limiter, idempotency, plans, worker, audit). */
    @NotNull
    private Path stateDir = Path.of(".runtime");

    @Valid
    private Tenant tenant = new Tenant();

    @Valid
    private Executor executor = new Executor();

    @Valid
    private RateLimiter rateLimiter = new RateLimiter();

    @Valid
    private Idempotency idempotency = new Idempotency();

    @Valid
    private Plans plans = new Plans();

    @Valid
    private Allowlist allowlist = new Allowlist();

    private Audit audit = new Audit();

    @Valid
    private Worker worker = new Worker();

    @Getter
    @Setter
    public static class Tenant {
        /** Portal address; {@code https://} is assumed when no scheme is given. */
        @NotBlank
        private String baseUrl;
        @NotNull
        private AuthMode authMode = AuthMode.WEBHOOK;
        private String webhookUserId;
        private String webhookCode;
        private String accessToken;
        private String refreshToken;
        private String clientId;
        private String clientSecret;
        private String tokenEndpoint = "https://oauth.bitrix24.tech/oauth/token/";
    }

    @Getter
    @Setter
    public static class Executor {
        @Min(1)
        private int maxAttempts = 5;
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);
        /** Refresh the OAuth token once per call on {@code expired_token}. */
        private boolean autoRefresh = false;
    }

    @Getter
    @Setter
    public static class RateLimiter {
        @NotNull
        private RateLimiterMode mode = RateLimiterMode.SHARED;
        private double rate = 2.0;
        private double burst = 10.0;
        @NotNull
        private Duration stateTtl = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class Idempotency {
        private boolean enabled = true;
        @NotNull
        private Duration ttl = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Plans {
        @NotNull
        private Duration ttl = Duration.ofMinutes(30);
        /** Write and destructive calls must go through plan-then-execute. */
        private boolean requirePlan = false;
    }

    @Getter
    @Setter
    public static class Allowlist {
        private List<String> basePatterns = new ArrayList<>(List.of("batch"));
        private List<String> packs = new ArrayList<>(List.of("core"));
    }

    @Getter
    @Setter
    public static class Audit {
        private boolean enabled = true;
    }

    @Getter
    @Setter
    public static class Worker {
        private boolean enabled = false;
        /** Run a single cycle and exit. */
        private boolean once = false;
        @NotNull
        private Duration idleSleep = Duration.ofSeconds(3);
        @Min(1)
        private int maxRetries = 5;
        @Min(1)
        private int maxConsecutiveErrors = 10;
        /** Expected {@code auth.application_token} of every event; unchecked when blank. */
        private String applicationToken;
    }
}
