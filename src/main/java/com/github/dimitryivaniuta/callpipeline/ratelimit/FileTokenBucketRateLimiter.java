package com.github.dimitryivaniuta.callpipeline.ratelimit;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.callpipeline.metrics.PipelineMetrics;
import com.github.dimitryivaniuta.callpipeline.state.LockedJsonFile;
import com.github.dimitryivaniuta.callpipeline.support.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.TreeMap;

/**
 * Token bucket whose state lives in a JSON file, so every process on the host shares one
 * budget per tenant.
 *
 * <p>Each reservation refills {@code elapsed * rate} tokens (capped at burst). One token is
 * consumed when available; otherwise the caller sleeps {@code (1 - tokens) / rate} seconds and
 * reserves again. Keys not touched for longer than the state TTL are dropped on every
 * reservation.
 */
@Slf4j
public class FileTokenBucketRateLimiter implements TenantRateLimiter {

    public static final double MIN_RATE = 0.1;
    public static final double MIN_BURST = 1.0;
    public static final Duration MIN_STATE_TTL = Duration.ofSeconds(60);

    private final LockedJsonFile<TreeMap<String, TokenBucket>> state;
    private final double ratePerSecond;
    private final double burst;
    private final long stateTtlMillis;
    private final Clock clock;
    private final Sleeper sleeper;
    private final PipelineMetrics metrics;

    public FileTokenBucketRateLimiter(Path stateFile,
                                      ObjectMapper mapper,
                                      double ratePerSecond,
                                      double burst,
                                      Duration stateTtl,
                                      Clock clock,
                                      Sleeper sleeper,
                                      PipelineMetrics metrics) {
        this.state = new LockedJsonFile<>(stateFile, mapper, new TypeReference<>() {}, TreeMap::new);
        this.ratePerSecond = Math.max(ratePerSecond, MIN_RATE);
        this.burst = Math.max(burst, MIN_BURST);
        this.stateTtlMillis = (stateTtl.compareTo(MIN_STATE_TTL) < 0 ? MIN_STATE_TTL : stateTtl).toMillis();
        this.clock = clock;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    @Override
    public void acquire(String tenantKey) throws InterruptedException {
        while (true) {
            Duration wait = reserve(tenantKey);
            if (wait.isZero()) return;
            log.debug("Rate limit reached for tenant={}, waiting {}ms", tenantKey, wait.toMillis());
            metrics.rateLimitWait("shared", wait);
            sleeper.sleep(wait);
        }
    }

    /**
     * One read-modify-write of the bucket. Returns zero when a token was consumed, otherwise
     * how long until one token becomes available.
     */
    public Duration reserve(String tenantKey) {
        return state.update(buckets -> {
            long sampled = clock.millis();
            TokenBucket bucket = buckets.get(tenantKey);
            if (bucket == null) bucket = new TokenBucket(sampled, burst);

            // last never moves backwards, so elapsed time is credited once
            long now = Math.max(sampled, bucket.getLast());
            double elapsedSec = (now - bucket.getLast()) / 1000.0;
            double tokens = Math.min(burst, bucket.getTokens() + elapsedSec * ratePerSecond);

            Duration wait = Duration.ZERO;
            if (tokens >= 1.0) {
                tokens -= 1.0;
            } else {
                long waitMillis = (long) Math.ceil((1.0 - tokens) / ratePerSecond * 1000.0);
                wait = Duration.ofMillis(Math.max(1L, waitMillis));
            }

            bucket.setLast(now);
            bucket.setTokens(tokens);
            buckets.put(tenantKey, bucket);

            buckets.values().removeIf(b -> now - b.getLast() > stateTtlMillis);
            return wait;
        });
    }

    public double ratePerSecond() {
        return ratePerSecond;
    }

    public double burst() {
        return burst;
    }
}
