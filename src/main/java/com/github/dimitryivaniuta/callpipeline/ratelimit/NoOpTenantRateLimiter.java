package com.github.dimitryivaniuta.callpipeline.ratelimit;

public final class NoOpTenantRateLimiter implements TenantRateLimiter {

    @Override
    public void acquire(String tenantKey) {
        // always admitted
    }
}
