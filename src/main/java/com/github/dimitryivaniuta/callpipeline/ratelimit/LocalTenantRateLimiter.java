package com.github.dimitryivaniuta.callpipeline.ratelimit;

import com.github.dimitryivaniuta.callpipeline.metrics.PipelineMetrics;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process limiter backed by one Resilience4j {@link RateLimiter} per tenant key.
 *
 * <p>Resilience4j has no real burst bucket; {@code burst} permits are released every
 * {@code burst / rate} seconds, which keeps the long-run rate and allows the same burst.
 */
public class LocalTenantRateLimiter implements TenantRateLimiter {

    private final ConcurrentHashMap<String, RateLimiter> limiters = new ConcurrentHashMap<>();
    private final RateLimiterConfig config;
    private final PipelineMetrics metrics;

    public LocalTenantRateLimiter(double ratePerSecond, double burst, PipelineMetrics metrics) {
        double rate = Math.max(ratePerSecond, FileTokenBucketRateLimiter.MIN_RATE);
        int permits = (int) Math.max(Math.floor(burst), FileTokenBucketRateLimiter.MIN_BURST);
        Duration refreshPeriod = Duration.ofMillis(Math.max(1L, Math.round(permits / rate * 1000.0)));

        this.config = RateLimiterConfig.custom()
                .limitForPeriod(permits)
                .limitRefreshPeriod(refreshPeriod)
                .timeoutDuration(refreshPeriod.multipliedBy(2))
                .build();
        this.metrics = metrics;
    }

    @Override
    public void acquire(String tenantKey) throws InterruptedException {
        RateLimiter limiter = limiters.computeIfAbsent(tenantKey, k -> RateLimiter.of("tenant:" + k, config));
        long start = System.nanoTime();
        boolean waited = false;
        while (!limiter.acquirePermission()) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted while waiting for rate limit permit");
            }
            waited = true;
        }
        if (waited || System.nanoTime() - start > 1_000_000L) {
            metrics.rateLimitWait("local", Duration.ofNanos(System.nanoTime() - start));
        }
    }
}
