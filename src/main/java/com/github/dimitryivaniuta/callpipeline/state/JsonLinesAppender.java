package com.github.dimitryivaniuta.callpipeline.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only JSON Lines file. Each {@link #append} writes exactly one line under a lock.
 */
@Slf4j
public class JsonLinesAppender {

    private final Path path;
    private final ObjectMapper mapper;
    private final ReentrantLock lock;

    public JsonLinesAppender(Path path, ObjectMapper mapper) {
        this.path = path.toAbsolutePath().normalize();
        this.mapper = mapper;
        this.lock = PathLocks.forPath(this.path);
    }

    public Path path() {
        return path;
    }

    public void append(Object row) {
        byte[] line;
        try {
            line = (mapper.writeValueAsString(row) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Row is not serializable to JSON", e);
        }

        lock.lock();
        try {
            Files.createDirectories(path.getParent());
            try (FileChannel channel = FileChannel.open(path,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
                 FileLock ignored = channel.lock()) {
                ByteBuffer buf = ByteBuffer.wrap(line);
                while (buf.hasRemaining()) channel.write(buf);
                channel.force(false);
            }
        } catch (IOException e) {
            throw new StateStoreException(path, "append", e);
        } finally {
            lock.unlock();
        }
    }

    /** Every parseable line in file order; blank and corrupt lines are skipped. */
    public List<JsonNode> readAll() {
        if (!Files.exists(path)) return List.of();
        List<String> lines;
        lock.lock();
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StateStoreException(path, "read", e);
        } finally {
            lock.unlock();
        }

        List<JsonNode> out = new ArrayList<>(lines.size());
        for (String l : lines) {
            if (l.isBlank()) continue;
            try {
                out.add(mapper.readTree(l));
            } catch (JsonProcessingException e) {
                log.warn("Skipping corrupt line in path={}, reason={}", path, e.getOriginalMessage());
            }
        }
        return out;
    }
}
