package com.github.dimitryivaniuta.callpipeline.executor;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with additive jitter: {@code min(initial * 2^(attempt-1), max) + uniform(0..jitter)}.
 */
public class BackoffPolicy {

    public static final Duration DEFAULT_INITIAL = Duration.ofMillis(500);
    public static final Duration DEFAULT_MAX = Duration.ofSeconds(30);
    public static final Duration DEFAULT_JITTER = Duration.ofMillis(250);

    private final IntervalFunction interval;
    private final long maxJitterMillis;

    public BackoffPolicy(Duration initial, Duration max, Duration jitter) {
        this.interval = IntervalFunction.ofExponentialBackoff(initial, 2.0, max);
        this.maxJitterMillis = Math.max(0L, jitter.toMillis());
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(DEFAULT_INITIAL, DEFAULT_MAX, DEFAULT_JITTER);
    }

    /**
     * @param attempt 1-based number of the attempt that just failed
     */
    public Duration delay(int attempt) {
        long base = interval.apply(Math.max(1, attempt));
        long jitter = (maxJitterMillis == 0) ? 0 : ThreadLocalRandom.current().nextLong(maxJitterMillis + 1);
        return Duration.ofMillis(base + jitter);
    }
}
