package com.github.dimitryivaniuta.callpipeline.metrics;

import com.github.dimitryivaniuta.callpipeline.error.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Executor ----
    public void callAttempt(String method) {
        Counter.builder("rest_pipeline_call_attempts_total")
                .tag("method", method)
                .register(registry)
                .increment();
    }

    public void callRetry(String method, String code) {
        Counter.builder("rest_pipeline_call_retries_total")
                .tag("method", method)
                .tag("code", code)
                .register(registry)
                .increment();
    }

    public void callAborted(String method, ErrorKind kind) {
        Counter.builder("rest_pipeline_call_aborted_total")
                .tag("method", method)
                .tag("kind", kind.name())
                .register(registry)
                .increment();
    }

    public void recordCallDuration(String method, boolean success, long nanos) {
        Timer.builder("rest_pipeline_call_duration_seconds")
                .tag("method", method)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    // ---- Token refresh ----
    public void tokenRefresh(boolean success) {
        Counter.builder("rest_pipeline_token_refresh_total")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    // ---- Rate limiting ----
    public void rateLimitWait(String limiter, Duration wait) {
        Counter.builder("rest_pipeline_ratelimit_waits_total")
                .tag("limiter", limiter)
                .register(registry)
                .increment();
        Timer.builder("rest_pipeline_ratelimit_wait_seconds")
                .tag("limiter", limiter)
                .register(registry)
                .record(wait);
    }

    // ---- Idempotency ----
    public void idempotencyReplayed(String method) {
        Counter.builder("rest_pipeline_idempotency_replayed_total")
                .tag("method", method)
                .register(registry)
                .increment();
    }

    // ---- Offline worker ----
    public void offlineAcknowledged(int count) {
        Counter.builder("rest_pipeline_offline_acknowledged_total")
                .register(registry)
                .increment(count);
    }

    public void offlineProcessed(String outcome) {
        Counter.builder("rest_pipeline_offline_events_total")
                .tag("outcome", outcome) // success | failure | rejected
                .register(registry)
                .increment();
    }

    public void deadLettered(String reason) {
        Counter.builder("rest_pipeline_offline_dead_letters_total")
                .tag("reason", reason) // schema | exhausted
                .register(registry)
                .increment();
    }
}
