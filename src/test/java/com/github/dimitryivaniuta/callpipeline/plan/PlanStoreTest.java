package com.github.dimitryivaniuta.callpipeline.plan;

import com.github.dimitryivaniuta.callpipeline.error.ApiCallException;
import com.github.dimitryivaniuta.callpipeline.error.ErrorCodes;
import com.github.dimitryivaniuta.callpipeline.error.ErrorKind;
import com.github.dimitryivaniuta.callpipeline.policy.RiskTier;
import com.github.dimitryivaniuta.callpipeline.testing.MutableClock;
import com.github.dimitryivaniuta.callpipeline.testing.TestFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanStoreTest {

    private static final String TENANT = "https://portal.example.com";

    @TempDir
    Path dir;

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");

    private PlanStore store() {
        return new PlanStore(dir.resolve("plans.json"), TestFixtures.mapper(), Duration.ofMinutes(10), clock);
    }

    private Plan createDealPlan(PlanStore store) {
        return store.create(TENANT, "crm.deal.delete", Map.of("id", 5), RiskTier.DESTRUCTIVE, true, List.of("core"));
    }

    @Test
    void shouldCreatePlanWithExpiry() {
        Plan plan = createDealPlan(store());

        assertThat(plan.getPlanId()).hasSize(20).matches("[0-9a-f]+");
        assertThat(plan.getExpiresAt()).isEqualTo(Instant.parse("2024-05-01T10:10:00Z"));
        assertThat(plan.isExecuted()).isFalse();
        assertThat(store().find(plan.getPlanId())).isPresent();
    }

    @Test
    void shouldGenerateDistinctIdsForIdenticalCalls() {
        PlanStore store = store();

        assertThat(createDealPlan(store).getPlanId()).isNotEqualTo(createDealPlan(store).getPlanId());
    }

    @Test
    void shouldConsumePlanExactlyOnce() {
        PlanStore store = store();
        Plan plan = createDealPlan(store);

        Plan consumed = store.consume(plan.getPlanId(), TENANT);

        assertThat(consumed.isExecuted()).isTrue();
        assertThat(consumed.getExecutedAt()).isEqualTo(clock.instant());
        assertThat(consumed.getMethod()).isEqualTo("crm.deal.delete");
        assertThat(consumed.getRisk()).isEqualTo(RiskTier.DESTRUCTIVE);
        assertThatThrownBy(() -> store.consume(plan.getPlanId(), TENANT))
                .isInstanceOf(ApiCallException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCodes.PLAN_ALREADY_EXECUTED)
                .hasFieldOrPropertyWithValue("kind", ErrorKind.WORKFLOW);
    }

    @Test
    void shouldRejectOtherTenant() {
        PlanStore store = store();
        Plan plan = createDealPlan(store);

        assertThatThrownBy(() -> store.consume(plan.getPlanId(), "https://other.example.com"))
                .hasFieldOrPropertyWithValue("code", ErrorCodes.PLAN_TENANT_MISMATCH);
        assertThat(store.consume(plan.getPlanId(), TENANT).isExecuted()).isTrue();
    }

    @Test
    void shouldTreatExpiredPlanAsNotFound() {
        PlanStore store = store();
        Plan plan = createDealPlan(store);

        clock.advance(Duration.ofMinutes(11));

        assertThat(store.find(plan.getPlanId())).isEmpty();
        assertThatThrownBy(() -> store.consume(plan.getPlanId(), TENANT))
                .hasFieldOrPropertyWithValue("code", ErrorCodes.PLAN_NOT_FOUND);
    }
}
