package com.github.dimitryivaniuta.callpipeline.state;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.dimitryivaniuta.callpipeline.testing.TestFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LockedJsonFileTest {

    @TempDir
    Path dir;

    private LockedJsonFile<TreeMap<String, Integer>> counters(Path path) {
        return new LockedJsonFile<>(path, TestFixtures.mapper(), new TypeReference<>() {}, TreeMap::new);
    }

    @Test
    void shouldReadMissingFileAsEmpty() {
        assertThat(counters(dir.resolve("nested/missing.json")).read()).isEmpty();
    }

    @Test
    void shouldReadCorruptFileAsEmpty() throws Exception {
        Path path = dir.resolve("state.json");
        Files.writeString(path, "{not json");

        assertThat(counters(path).read()).isEmpty();
    }

    @Test
    void shouldLeaveFileUntouchedWhenMutatorThrows() throws Exception {
        Path path = dir.resolve("state.json");
        LockedJsonFile<TreeMap<String, Integer>> file = counters(path);
        file.update(m -> m.put("a", 1));
        String before = Files.readString(path);

        assertThatThrownBy(() -> file.update(m -> {
            m.put("a", 99);
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(Files.readString(path)).isEqualTo(before);
    }

    @Test
    void shouldSerializeConcurrentUpdates() throws Exception {
        Path path = dir.resolve("state.json");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                // separate instances share the per-path lock
                LockedJsonFile<TreeMap<String, Integer>> file = counters(path);
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 25; i++) file.update(m -> m.merge("n", 1, Integer::sum));
                }));
            }
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdown();
        }

        assertThat(counters(path).read()).containsEntry("n", 200);
    }
}
