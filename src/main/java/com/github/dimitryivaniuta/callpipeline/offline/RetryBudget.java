package com.github.dimitryivaniuta.callpipeline.offline;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.callpipeline.state.StateStoreException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.TreeMap;

/**
 * Failure counters per dedup key. Held in memory by the single worker thread and saved once
 * per cycle through a temp file and an atomic rename.
 */
@Slf4j
public class RetryBudget {

    private final Path file;
    private final ObjectMapper mapper;
    private final int maxRetries;
    private final TreeMap<String, Integer> failures = new TreeMap<>();

    public RetryBudget(Path file, ObjectMapper mapper, int maxRetries) {
        this.file = file.toAbsolutePath().normalize();
        this.mapper = mapper;
        this.maxRetries = Math.max(1, maxRetries);
        load();
    }

    /** Records one more failure and returns the new count. */
    public int fail(String dedupKey) {
        return failures.merge(dedupKey, 1, Integer::sum);
    }

    public void clear(String dedupKey) {
        failures.remove(dedupKey);
    }

    public boolean exhausted(String dedupKey) {
        return count(dedupKey) >= maxRetries;
    }

    public int count(String dedupKey) {
        return failures.getOrDefault(dedupKey, 0);
    }

    public int maxRetries() {
        return maxRetries;
    }

    public void save() {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.getParent());
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), failures);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StateStoreException(file, "save", e);
        }
    }

    private void load() {
        if (!Files.exists(file)) return;
        try {
            Map<String, Integer> loaded = mapper.readValue(file.toFile(), new TypeReference<Map<String, Integer>>() {});
            if (loaded != null) failures.putAll(loaded);
        } catch (IOException e) {
            log.warn("Starting with empty retry budget, state unreadable path={}, reason={}", file, e.getMessage());
        }
    }
}
