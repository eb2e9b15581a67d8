package com.github.dimitryivaniuta.callpipeline.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.callpipeline.error.ApiError;
import com.github.dimitryivaniuta.callpipeline.error.ErrorCodes;
import com.github.dimitryivaniuta.callpipeline.executor.CallExecutor;

import java.util.Iterator;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Shape checks applied before a call is planned or sent.
 */
public class RequestValidator {

    private static final Pattern METHOD_NAME = Pattern.compile("^[a-z0-9_]+(?:\\.[a-z0-9_]+)*$");
    private static final int METHOD_MIN_LENGTH = 3;

    private final ObjectMapper mapper;

    public RequestValidator(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws com.github.dimitryivaniuta.callpipeline.error.ApiCallException {@code INVALID_REQUEST_SCHEMA},
     *         or {@code BATCH_TOO_LARGE} for a batch over the command limit
     */
    public void validate(String method, Map<String, ?> params) {
        if (method == null) throw invalid("method: expected type string");
        if (method.length() < METHOD_MIN_LENGTH) {
            throw invalid("method: string shorter than minLength=" + METHOD_MIN_LENGTH);
        }
        if (!METHOD_NAME.matcher(method).matches()) {
            throw invalid("method: string does not match required pattern");
        }

        JsonNode p = (params == null) ? mapper.createObjectNode() : mapper.valueToTree(params);
        if ("batch".equals(method)) {
            validateBatch(p);
        } else if ("event.offline.get".equals(method)) {
            validateOfflineGet(p);
        }
    }

    private void validateBatch(JsonNode params) {
        JsonNode cmd = params.get("cmd");
        if (cmd == null) throw invalid("params: missing required field 'cmd'");
        if (!cmd.isObject()) throw invalid("params.cmd: expected type object");
        if (cmd.size() < 1) throw invalid("params.cmd: object has fewer fields than minProperties=1");
        if (cmd.size() > CallExecutor.MAX_BATCH_COMMANDS) {
            throw ApiError.workflow(ErrorCodes.BATCH_TOO_LARGE,
                    "params.cmd: batch is limited to " + CallExecutor.MAX_BATCH_COMMANDS + " commands").toException();
        }
        Iterator<Map.Entry<String, JsonNode>> it = cmd.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!e.getValue().isTextual()) throw invalid("params.cmd." + e.getKey() + ": expected type string");
        }

        JsonNode halt = params.get("halt");
        if (halt != null && !halt.isBoolean() && !isZeroOrOne(halt)) {
            throw invalid("params.halt: value does not match any allowed schema");
        }
    }

    private void validateOfflineGet(JsonNode params) {
        JsonNode clear = params.get("clear");
        if (clear == null) return;
        boolean ok = isZeroOrOne(clear)
                || (clear.isTextual() && ("0".equals(clear.asText()) || "1".equals(clear.asText())));
        if (!ok) throw invalid("params.clear: value does not match any allowed schema");
    }

    private static boolean isZeroOrOne(JsonNode n) {
        return n.isIntegralNumber() && (n.asLong() == 0 || n.asLong() == 1) && n.canConvertToLong();
    }

    private static RuntimeException invalid(String message) {
        return ApiError.schema(ErrorCodes.INVALID_REQUEST_SCHEMA, message).toException();
    }
}
