package com.github.dimitryivaniuta.callpipeline.testing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.callpipeline.config.JacksonConfig;
import com.github.dimitryivaniuta.callpipeline.executor.BackoffPolicy;
import com.github.dimitryivaniuta.callpipeline.metrics.PipelineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

public final class TestFixtures {

    public static final String PORTAL = "https://portal.example.com";

    private TestFixtures() {}

    public static ObjectMapper mapper() {
        return JacksonConfig.configure(new ObjectMapper());
    }

    public static PipelineMetrics metrics() {
        return new PipelineMetrics(new SimpleMeterRegistry());
    }

    public static PipelineMetrics metrics(SimpleMeterRegistry registry) {
        return new PipelineMetrics(registry);
    }

    /** Backoff without jitter so recorded sleeps are exact. */
    public static BackoffPolicy exactBackoff() {
        return new BackoffPolicy(Duration.ofMillis(500), Duration.ofSeconds(30), Duration.ZERO);
    }

    public static JsonNode json(String text) {
        try {
            return mapper().readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }
}
