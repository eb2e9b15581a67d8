package com.github.dimitryivaniuta.callpipeline.offline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dimitryivaniuta.callpipeline.error.ApiError;
import com.github.dimitryivaniuta.callpipeline.error.ErrorCodes;
import com.github.dimitryivaniuta.callpipeline.error.ErrorKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed {@code event.offline.get} response.
 *
 * @param processId queue session to acknowledge against; null when the queue is empty
 * @param items     object items only; non-object entries are dropped
 */
public record OfflineBatch(String processId, List<ObjectNode> items) {

    private static final List<String> EVENT_CONTAINERS = List.of("events", "items", "result");

    public boolean isEmpty() {
        return processId == null || processId.isEmpty() || items.isEmpty();
    }

    /**
     * @throws com.github.dimitryivaniuta.callpipeline.error.ApiCallException
     *         {@code INVALID_OFFLINE_RESPONSE_SCHEMA} when the response shape is unusable
     */
    public static OfflineBatch parse(JsonNode response) {
        if (response == null || !response.isObject()) throw invalid("response is not an object", response);
        JsonNode result = response.get("result");
        if (result == null || result.isNull()) throw invalid("missing result field", response);
        if (!result.isObject()) throw invalid("result is not an object", response);
        JsonNode pid = result.get("process_id");
        if (pid != null && !pid.isNull() && !pid.isTextual()) {
            throw invalid("result.process_id must be string when present", response);
        }

        List<ObjectNode> items = new ArrayList<>();
        for (String container : EVENT_CONTAINERS) {
            JsonNode candidate = result.get(container);
            if (candidate == null) continue;
            if (candidate.isArray() || candidate.isObject()) {
                candidate.forEach(item -> {
                    if (item.isObject()) items.add((ObjectNode) item);
                });
                break;
            }
        }

        String processId = (pid == null || pid.isNull()) ? null : pid.asText();
        return new OfflineBatch(processId, List.copyOf(items));
    }

    private static RuntimeException invalid(String reason, JsonNode response) {
        return new ApiError("Invalid offline response schema: " + reason, 0,
                ErrorCodes.INVALID_OFFLINE_RESPONSE_SCHEMA, response, ErrorKind.SCHEMA).toException();
    }
}
