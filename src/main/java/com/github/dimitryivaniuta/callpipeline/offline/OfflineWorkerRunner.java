package com.github.dimitryivaniuta.callpipeline.offline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.function.IntConsumer;

/**
 * Runs the {@link OfflineWorkerLoop} on its own thread for the lifetime of the application
 * context. A loop that ends on a fatal error or an error streak exits the process with status 1.
 */
@Slf4j
public class OfflineWorkerRunner implements SmartLifecycle {

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(30);

    private final OfflineWorkerLoop loop;
    private final IntConsumer exitHandler;
    private volatile Thread thread;
    private volatile boolean running;

    public OfflineWorkerRunner(OfflineWorkerLoop loop, IntConsumer exitHandler) {
        this.loop = loop;
        this.exitHandler = exitHandler;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        running = true;
        thread = new Thread(this::runLoop, "offline-worker");
        thread.start();
        log.info("Offline worker started");
    }

    @Override
    public void stop() {
        loop.stop();
        Thread t = thread;
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(STOP_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) log.warn("Offline worker did not stop within {}s", STOP_TIMEOUT.toSeconds());
        }
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void runLoop() {
        OfflineWorkerLoop.Exit exit = loop.run();
        running = false;
        log.info("Offline worker finished exit={}", exit);
        switch (exit) {
            case FATAL_ERROR, ERROR_STREAK -> exitHandler.accept(1);
            case ONCE_COMPLETED -> exitHandler.accept(0);
            default -> {
                // stopped by context shutdown
            }
        }
    }
}
