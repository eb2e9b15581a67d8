package com.github.dimitryivaniuta.callpipeline.ratelimit;

/**
 * Admission control in front of every outbound attempt.
 */
public interface TenantRateLimiter {

    /**
     * Blocks until one request for {@code tenantKey} may be sent.
     */
    void acquire(String tenantKey) throws InterruptedException;
}
