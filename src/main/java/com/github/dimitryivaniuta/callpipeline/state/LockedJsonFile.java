package com.github.dimitryivaniuta.callpipeline.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
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
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One JSON document on disk, read and rewritten as a whole under an exclusive lock.
 *
 * <p>Two layers of locking: an in-JVM lock per path (a {@link FileLock} is held per process,
 * so threads of one JVM cannot rely on it) and an OS advisory lock for other processes.
 * Both are held for the whole read-modify-write cycle.
 *
 * <p>Missing, empty or unparseable content reads as {@code empty.get()}.
 */
@Slf4j
public class LockedJsonFile<T> {

    private final Path path;
    private final ObjectMapper mapper;
    private final TypeReference<T> type;
    private final Supplier<T> empty;

    public LockedJsonFile(Path path, ObjectMapper mapper, TypeReference<T> type, Supplier<T> empty) {
        this.path = path.toAbsolutePath().normalize();
        this.mapper = mapper;
        this.type = type;
        this.empty = empty;
    }

    public Path path() {
        return path;
    }

    public T read() {
        return withLock(channel -> decode(readAll(channel)), false);
    }

    /**
     * Loads the document, applies {@code mutator} (which may modify it in place) and writes it back.
     * If the mutator throws, nothing is written and the exception propagates.
     */
    public <R> R update(Function<T, R> mutator) {
        return withLock(channel -> {
            T doc = decode(readAll(channel));
            R result = mutator.apply(doc);
            write(channel, doc);
            return result;
        }, true);
    }

    private <R> R withLock(ChannelWork<R> work, boolean writing) {
        ReentrantLock jvmLock = PathLocks.forPath(path);
        jvmLock.lock();
        try {
            Files.createDirectories(path.getParent());
            try (FileChannel channel = FileChannel.open(path,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return work.apply(channel);
            }
        } catch (IOException e) {
            throw new StateStoreException(path, writing ? "update" : "read", e);
        } finally {
            jvmLock.unlock();
        }
    }

    private T decode(String text) {
        if (text.isBlank()) return empty.get();
        try {
            T doc = mapper.readValue(text, type);
            return (doc == null) ? empty.get() : doc;
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable state file path={}, reason={}", path, e.getOriginalMessage());
            return empty.get();
        }
    }

    private void write(FileChannel channel, T doc) throws IOException {
        byte[] bytes = mapper.writeValueAsBytes(doc);
        channel.truncate(0);
        channel.position(0);
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        while (buf.hasRemaining()) channel.write(buf);
        channel.force(true);
    }

    private static String readAll(FileChannel channel) throws IOException {
        long size = channel.size();
        if (size == 0) return "";
        ByteBuffer buf = ByteBuffer.allocate((int) size);
        channel.position(0);
        while (buf.hasRemaining()) {
            if (channel.read(buf) < 0) break;
        }
        return new String(buf.array(), 0, buf.position(), StandardCharsets.UTF_8);
    }

    @FunctionalInterface
    private interface ChannelWork<R> {
        R apply(FileChannel channel) throws IOException;
    }
}
