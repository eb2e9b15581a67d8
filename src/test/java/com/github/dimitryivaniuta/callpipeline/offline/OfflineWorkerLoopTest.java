package com.github.dimitryivaniuta.callpipeline.offline;

import com.github.dimitryivaniuta.callpipeline.error.ApiError;
import com.github.dimitryivaniuta.callpipeline.error.ErrorCodes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OfflineWorkerLoopTest {

    private static final Duration IDLE = Duration.ofMillis(1);
    private static final CycleReport ONE_ITEM = new CycleReport(1, 1, 1, 0, 0);

    @Mock
    OfflineSyncWorker worker;

    private OfflineWorkerLoop loop(int maxErrors, boolean once) {
        return new OfflineWorkerLoop(worker, IDLE, maxErrors, once, "https://portal.example.com");
    }

    @Test
    void shouldRunSingleCycleInOnceMode() {
        when(worker.runOnce()).thenReturn(ONE_ITEM);

        assertThat(loop(3, true).run()).isEqualTo(OfflineWorkerLoop.Exit.ONCE_COMPLETED);
        verify(worker, times(1)).runOnce();
    }

    @Test
    void shouldFinishOnceModeAfterError() {
        when(worker.runOnce()).thenThrow(new IllegalStateException("disk full"));

        assertThat(loop(3, true).run()).isEqualTo(OfflineWorkerLoop.Exit.ONCE_COMPLETED);
    }

    @Test
    void shouldStopOnFatalApiError() {
        when(worker.runOnce()).thenThrow(ApiError.remote("webhook revoked", 401, "INVALID_CREDENTIALS", null).toException());

        assertThat(loop(10, false).run()).isEqualTo(OfflineWorkerLoop.Exit.FATAL_ERROR);
        verify(worker, times(1)).runOnce();
    }

    @Test
    void shouldStopAfterConsecutiveErrors() {
        when(worker.runOnce()).thenThrow(ApiError.remote("busy", 503, ErrorCodes.RETRIES_EXHAUSTED, null).toException());

        assertThat(loop(3, false).run()).isEqualTo(OfflineWorkerLoop.Exit.ERROR_STREAK);
        verify(worker, times(3)).runOnce();
    }

    @Test
    void shouldResetStreakAfterSuccessfulCycle() {
        RuntimeException failure = new IllegalStateException("flaky");
        when(worker.runOnce())
                .thenThrow(failure, failure)
                .thenReturn(CycleReport.EMPTY)
                .thenThrow(failure, failure, failure);

        assertThat(loop(3, false).run()).isEqualTo(OfflineWorkerLoop.Exit.ERROR_STREAK);
        verify(worker, times(6)).runOnce();
    }

    @Test
    void shouldExitGracefullyWhenStopped() {
        AtomicReference<OfflineWorkerLoop> ref = new AtomicReference<>();
        when(worker.runOnce()).thenAnswer(invocation -> {
            ref.get().stop();
            return ONE_ITEM;
        });
        OfflineWorkerLoop loop = loop(3, false);
        ref.set(loop);

        assertThat(loop.run()).isEqualTo(OfflineWorkerLoop.Exit.STOPPED);
        assertThat(loop.isStopRequested()).isTrue();
        verify(worker, times(1)).runOnce();
    }
}
