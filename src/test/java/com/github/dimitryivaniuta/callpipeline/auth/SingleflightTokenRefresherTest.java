package com.github.dimitryivaniuta.callpipeline.auth;

import com.github.dimitryivaniuta.callpipeline.tenant.CredentialState;
import com.github.dimitryivaniuta.callpipeline.tenant.TenantIdentity;
import com.github.dimitryivaniuta.callpipeline.tenant.TokenPair;
import com.github.dimitryivaniuta.callpipeline.testing.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SingleflightTokenRefresherTest {

    private final TenantIdentity tenant = TenantIdentity.oauth(TestFixtures.PORTAL);

    @Test
    void shouldCollapseConcurrentRefreshesIntoOne() throws Exception {
        CredentialState credentials = new CredentialState("old", "refresh");
        AtomicInteger serverCalls = new AtomicInteger();
        CountDownLatch winnerEntered = new CountDownLatch(1);
        CountDownLatch releaseWinner = new CountDownLatch(1);

        SingleflightTokenRefresher refresher = new SingleflightTokenRefresher((t, refreshToken) -> {
            serverCalls.incrementAndGet();
            winnerEntered.countDown();
            try {
                releaseWinner.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new TokenPair("new", "refresh-2");
        }, TestFixtures.metrics());

        int callers = 5;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            results.add(pool.submit(() -> refresher.refresh(tenant, credentials)));
            assertThat(winnerEntered.await(5, TimeUnit.SECONDS)).isTrue();

            for (int i = 1; i < callers; i++) {
                results.add(pool.submit(() -> refresher.refresh(tenant, credentials)));
            }
            long deadline = System.currentTimeMillis() + 5_000;
            while (refresher.waitingCallers() < callers - 1 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertThat(refresher.waitingCallers()).isEqualTo(callers - 1);

            releaseWinner.countDown();
            for (Future<Boolean> f : results) {
                assertThat(f.get(5, TimeUnit.SECONDS)).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(serverCalls).hasValue(1);
        assertThat(credentials.accessToken()).isEqualTo("new");
        assertThat(credentials.snapshot().refreshToken()).isEqualTo("refresh-2");
    }

    @Test
    void shouldReportFailureAndKeepCredentials() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        CredentialState credentials = new CredentialState("old", "refresh");
        SingleflightTokenRefresher refresher = new SingleflightTokenRefresher((t, refreshToken) -> {
            throw new IllegalStateException("invalid_grant");
        }, TestFixtures.metrics(registry));

        boolean refreshed = refresher.refresh(tenant, credentials);

        assertThat(refreshed).isFalse();
        assertThat(credentials.accessToken()).isEqualTo("old");
        assertThat(registry.get("rest_pipeline_token_refresh_total").tag("outcome", "failure").counter().count())
                .isEqualTo(1.0);
    }
}
