package com.github.dimitryivaniuta.callpipeline.offline;

import com.github.dimitryivaniuta.callpipeline.error.ApiCallException;
import com.github.dimitryivaniuta.callpipeline.support.MdcKeys;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Repeats {@link OfflineSyncWorker#runOnce()} until stopped.
 *
 * <p>Sleeps between cycles when the queue is empty or a cycle failed. Terminates on a fatal API
 * error or after {@code maxConsecutiveErrors} failed cycles in a row. {@link #stop()} is checked
 * before each cycle and wakes an idle sleep.
 */
@Slf4j
public class OfflineWorkerLoop {

    public enum Exit {
        STOPPED,
        ONCE_COMPLETED,
        FATAL_ERROR,
        ERROR_STREAK
    }

    private final OfflineSyncWorker worker;
    private final Duration idleSleep;
    private final int maxConsecutiveErrors;
    private final boolean once;
    private final String tenantKey;
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    public OfflineWorkerLoop(OfflineSyncWorker worker,
                             Duration idleSleep,
                             int maxConsecutiveErrors,
                             boolean once,
                             String tenantKey) {
        this.worker = worker;
        this.idleSleep = idleSleep;
        this.maxConsecutiveErrors = Math.max(1, maxConsecutiveErrors);
        this.once = once;
        this.tenantKey = tenantKey;
    }

    public Exit run() {
        int consecutiveErrors = 0;

        while (!isStopRequested()) {
            MDC.put(MdcKeys.REQUEST_ID, UUID.randomUUID().toString().replace("-", "").substring(0, 12));
            MDC.put(MdcKeys.TENANT, tenantKey);
            try {
                CycleReport report = worker.runOnce();
                consecutiveErrors = 0;

                if (once) {
                    log.info("Processed batch size: {}", report.fetched());
                    return Exit.ONCE_COMPLETED;
                }
                if (report.fetched() == 0) idle();

            } catch (ApiCallException e) {
                consecutiveErrors++;
                log.error("Offline cycle failed kind={}, code={}, status={}, message={}",
                        e.getKind(), e.getCode(), e.getError().status(), e.getError().message());

                if (e.isFatal()) {
                    log.error("FATAL: error code {} is not recoverable, stopping offline worker", e.getCode());
                    return Exit.FATAL_ERROR;
                }
                Exit exit = afterError(consecutiveErrors);
                if (exit != null) return exit;

            } catch (RuntimeException e) {
                consecutiveErrors++;
                log.error("Offline cycle failed unexpectedly", e);
                Exit exit = afterError(consecutiveErrors);
                if (exit != null) return exit;

            } finally {
                MDC.remove(MdcKeys.TENANT);
                MDC.remove(MdcKeys.REQUEST_ID);
            }
        }

        log.info("Offline worker stopped gracefully");
        return Exit.STOPPED;
    }

    public void stop() {
        stopSignal.countDown();
    }

    public boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    /** @return the exit to take, or null to keep looping */
    private Exit afterError(int consecutiveErrors) {
        if (once) return Exit.ONCE_COMPLETED;
        if (consecutiveErrors >= maxConsecutiveErrors) {
            log.error("FATAL: {} consecutive errors, stopping offline worker", consecutiveErrors);
            return Exit.ERROR_STREAK;
        }
        idle();
        return null;
    }

    /** Waits for {@code idleSleep} or until stopped. */
    private void idle() {
        try {
            if (stopSignal.await(idleSleep.toMillis(), TimeUnit.MILLISECONDS)) {
                log.debug("Idle wait cut short by stop request");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
        }
    }
}
