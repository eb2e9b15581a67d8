package com.github.dimitryivaniuta.callpipeline.auth;

import com.github.dimitryivaniuta.callpipeline.metrics.PipelineMetrics;
import com.github.dimitryivaniuta.callpipeline.tenant.CredentialState;
import com.github.dimitryivaniuta.callpipeline.tenant.TenantIdentity;
import com.github.dimitryivaniuta.callpipeline.tenant.TokenPair;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Collapses concurrent token refreshes for one tenant into a single call to the OAuth server.
 *
 * <p>The caller that wins {@code tryLock} performs the refresh and writes the new pair into
 * {@link CredentialState}. Every other caller blocks until the winner releases the lock and
 * then reports success without refreshing again; the next attempt reads whatever the winner
 * stored.
 */
@Slf4j
public class SingleflightTokenRefresher {

    private final ReentrantLock lock = new ReentrantLock();
    private final TokenRefreshClient client;
    private final PipelineMetrics metrics;

    public SingleflightTokenRefresher(TokenRefreshClient client, PipelineMetrics metrics) {
        this.client = client;
        this.metrics = metrics;
    }

    /**
     * @return true when fresh credentials should now be in place
     */
    public boolean refresh(TenantIdentity tenant, CredentialState credentials) {
        if (lock.tryLock()) {
            try {
                TokenPair tokens = client.refresh(tenant, credentials.snapshot().refreshToken());
                credentials.update(tokens);
                metrics.tokenRefresh(true);
                return true;
            } catch (RuntimeException e) {
                metrics.tokenRefresh(false);
                log.warn("Token refresh failed for tenant={}, reason={}", tenant.getBaseUrl(), e.getMessage());
                return false;
            } finally {
                lock.unlock();
            }
        }

        // another caller is refreshing; wait for it to finish
        lock.lock();
        lock.unlock();
        return true;
    }

    /** Number of callers currently blocked behind an in-flight refresh. */
    public int waitingCallers() {
        return lock.getQueueLength();
    }
}
