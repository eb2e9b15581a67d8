package com.github.dimitryivaniuta.callpipeline.offline;

import com.github.dimitryivaniuta.callpipeline.metrics.PipelineMetrics;
import com.github.dimitryivaniuta.callpipeline.support.CanonicalJson;
import com.github.dimitryivaniuta.callpipeline.support.Hashing;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drains one batch of the offline event queue with at-least-once semantics.
 *
 * <p>An item is acknowledged only once it is resolved: processed, or written to the dead-letter
 * file. Failed items keep their place in the queue and are retried on later cycles until their
 * retry budget runs out. When every item of the batch is resolved the whole process is cleared;
 * otherwise only the resolved ids are.
 */
@Slf4j
public class OfflineSyncWorker {

    private final OfflineQueueClient queue;
    private final OfflineEventHandler handler;
    private final RetryBudget retryBudget;
    private final DeadLetterQueue deadLetters;
    private final CanonicalJson canonicalJson;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final String tenantKey;
    private final String applicationToken;

    public OfflineSyncWorker(OfflineQueueClient queue,
                             OfflineEventHandler handler,
                             RetryBudget retryBudget,
                             DeadLetterQueue deadLetters,
                             CanonicalJson canonicalJson,
                             PipelineMetrics metrics,
                             Clock clock,
                             String tenantKey,
                             String applicationToken) {
        this.queue = queue;
        this.handler = handler;
        this.retryBudget = retryBudget;
        this.deadLetters = deadLetters;
        this.canonicalJson = canonicalJson;
        this.metrics = metrics;
        this.clock = clock;
        this.tenantKey = tenantKey;
        this.applicationToken = (applicationToken == null || applicationToken.isBlank()) ? null : applicationToken;
    }

    /**
     * @throws com.github.dimitryivaniuta.callpipeline.error.ApiCallException when polling or
     *         acknowledging fails, or the queue response is malformed
     */
    public CycleReport runOnce() {
        OfflineBatch batch = queue.fetchPending();
        if (batch.isEmpty()) return CycleReport.EMPTY;

        List<String> clearIds = new ArrayList<>();
        List<String> errorIds = new ArrayList<>();
        boolean pendingFailures = false;
        int processed = 0;
        int deadLettered = 0;
        int pending = 0;

        for (var item : batch.items()) {
            OfflineEvent event = OfflineEvent.of(item);
            Optional<String> messageId = event.messageId();

            Optional<String> violation = event.schemaViolation();
            if (violation.isPresent()) {
                deadLetter(event, DeadLetterRecord.SCHEMA_ERROR_PREFIX + violation.get(), 0);
                metrics.deadLettered("schema");
                deadLettered++;
                if (messageId.isPresent()) {
                    clearIds.add(messageId.get());
                    errorIds.add(messageId.get());
                } else {
                    pendingFailures = true;
                    pending++;
                }
                continue;
            }

            if (applicationToken != null
                    && !Hashing.constantTimeEquals(event.auth().path("application_token").asText(null), applicationToken)) {
                log.warn("SECURITY: invalid application_token for offline event messageId={}, leaving it unacknowledged",
                        messageId.orElse("-"));
                metrics.offlineProcessed("rejected");
                pendingFailures = true;
                pending++;
                continue;
            }

            String dedup = event.dedupKey(canonicalJson);
            try {
                handler.handle(event);
                retryBudget.clear(dedup);
                metrics.offlineProcessed("success");
                processed++;
                messageId.ifPresent(clearIds::add);
            } catch (Exception e) {
                if (e instanceof InterruptedException) Thread.currentThread().interrupt();
                metrics.offlineProcessed("failure");
                int retries = retryBudget.fail(dedup);
                if (retryBudget.exhausted(dedup)) {
                    deadLetter(event, describe(e), retries);
                    metrics.deadLettered("exhausted");
                    deadLettered++;
                    retryBudget.clear(dedup);
                    if (messageId.isPresent()) {
                        clearIds.add(messageId.get());
                        errorIds.add(messageId.get());
                    }
                } else {
                    log.warn("Offline event failed dedup={}, attempt={}/{}, reason={}",
                            dedup, retries, retryBudget.maxRetries(), describe(e));
                    pendingFailures = true;
                    pending++;
                }
            }
        }

        queue.reportErrors(batch.processId(), errorIds);

        // all resolved: clear the whole process even when some items carry no id
        int acknowledged = 0;
        if (!pendingFailures || !clearIds.isEmpty()) {
            queue.clear(batch.processId(), clearIds);
            acknowledged = clearIds.size();
            metrics.offlineAcknowledged(acknowledged);
        }
        retryBudget.save();

        log.info("Offline cycle done fetched={}, processed={}, acknowledged={}, deadLettered={}, pending={}",
                batch.items().size(), processed, acknowledged, deadLettered, pending);
        return new CycleReport(batch.items().size(), processed, acknowledged, deadLettered, pending);
    }

    private void deadLetter(OfflineEvent event, String error, int retries) {
        deadLetters.append(DeadLetterRecord.builder()
                .tenant(tenantKey)
                .event(event.eventName())
                .messageId(event.messageId().orElse(null))
                .retryCount(retries)
                .error(error)
                .payload(event.raw())
                .timestamp(clock.instant())
                .build());
    }

    private static String describe(Exception e) {
        return (e.getMessage() == null || e.getMessage().isBlank()) ? e.getClass().getSimpleName() : e.getMessage();
    }
}
