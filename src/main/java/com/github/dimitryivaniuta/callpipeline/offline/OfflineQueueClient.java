package com.github.dimitryivaniuta.callpipeline.offline;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.callpipeline.error.ApiCallException;
import com.github.dimitryivaniuta.callpipeline.executor.CallExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The three offline queue methods, sent through the regular executor.
 */
@Slf4j
@RequiredArgsConstructor
public class OfflineQueueClient {

    static final String GET = "event.offline.get";
    static final String CLEAR = "event.offline.clear";
    static final String ERROR = "event.offline.error";

    private final CallExecutor executor;

    /** Peeks pending events without removing them from the queue. */
    public OfflineBatch fetchPending() {
        JsonNode response = executor.call(GET, Map.of("clear", "0"));
        return OfflineBatch.parse(response);
    }

    /**
     * Acknowledges {@code messageIds}, or the whole process when the list is empty.
     */
    public void clear(String processId, List<String> messageIds) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("process_id", processId);
        if (!messageIds.isEmpty()) params.put("message_id", messageIds);
        executor.call(CLEAR, params);
    }

    /** Best-effort: a failure is logged and not propagated. */
    public void reportErrors(String processId, List<String> messageIds) {
        if (messageIds.isEmpty()) return;
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("process_id", processId);
        params.put("message_id", messageIds);
        try {
            executor.call(ERROR, params);
        } catch (ApiCallException e) {
            log.warn("Failed to report event.offline.error code={}, reason={}", e.getCode(), e.getMessage());
        }
    }
}
