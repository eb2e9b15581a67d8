package com.github.dimitryivaniuta.callpipeline.state;

import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-JVM lock per normalized path, shared by every state file object that opens that path.
 * A {@link java.nio.channels.FileLock} is held per process, so threads must serialize here first.
 */
final class PathLocks {

    private static final ConcurrentHashMap<Path, ReentrantLock> LOCKS = new ConcurrentHashMap<>();

    private PathLocks() {
    }

    static ReentrantLock forPath(Path path) {
        return LOCKS.computeIfAbsent(path.toAbsolutePath().normalize(), p -> new ReentrantLock());
    }
}
