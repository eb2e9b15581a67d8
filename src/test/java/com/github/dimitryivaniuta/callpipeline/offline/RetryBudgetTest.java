package com.github.dimitryivaniuta.callpipeline.offline;

import com.github.dimitryivaniuta.callpipeline.testing.TestFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class RetryBudgetTest {

    @TempDir
    Path dir;

    @Test
    void shouldPersistCountsAcrossRestarts() {
        Path file = dir.resolve("retry_state.json");
        RetryBudget budget = new RetryBudget(file, TestFixtures.mapper(), 3);
        budget.fail("ONX:abc");
        budget.fail("ONX:abc");
        budget.save();

        RetryBudget reloaded = new RetryBudget(file, TestFixtures.mapper(), 3);

        assertThat(reloaded.count("ONX:abc")).isEqualTo(2);
        assertThat(reloaded.exhausted("ONX:abc")).isFalse();
        assertThat(reloaded.fail("ONX:abc")).isEqualTo(3);
        assertThat(reloaded.exhausted("ONX:abc")).isTrue();
        assertThat(Files.exists(dir.resolve("retry_state.json.tmp"))).isFalse();
    }

    @Test
    void shouldStartEmptyFromUnreadableState() throws Exception {
        Path file = dir.resolve("retry_state.json");
        Files.writeString(file, "not json");

        RetryBudget budget = new RetryBudget(file, TestFixtures.mapper(), 0);

        assertThat(budget.count("k")).isZero();
        assertThat(budget.maxRetries()).isEqualTo(1);
    }
}
