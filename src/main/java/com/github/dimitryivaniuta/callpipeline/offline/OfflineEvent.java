package com.github.dimitryivaniuta.callpipeline.offline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dimitryivaniuta.callpipeline.support.CanonicalJson;
import com.github.dimitryivaniuta.callpipeline.support.Hashing;

import java.util.List;
import java.util.Optional;

/**
 * One item of an offline batch, read leniently: fields may arrive in lower or upper case and
 * an empty value counts as absent.
 */
public final class OfflineEvent {

    private static final List<String> MESSAGE_ID_FIELDS = List.of("message_id", "MESSAGE_ID", "id", "ID");

    private final ObjectNode raw;
    private final JsonNode event;
    private final JsonNode data;
    private final JsonNode auth;
    private final String messageId;

    private OfflineEvent(ObjectNode raw) {
        this.raw = raw;
        this.event = field(raw, "event", "EVENT");
        this.data = field(raw, "data", "DATA");
        this.auth = field(raw, "auth", "AUTH");
        this.messageId = readMessageId(raw);
    }

    public static OfflineEvent of(ObjectNode item) {
        return new OfflineEvent(item);
    }

    /**
     * @return why the item cannot be processed, or empty when its shape is acceptable
     */
    public Optional<String> schemaViolation() {
        if (event != null && !event.isTextual()) return Optional.of("event field must be a string");
        if (data != null && !data.isObject()) return Optional.of("data field must be an object");
        if (auth != null && !auth.isObject()) return Optional.of("auth field must be an object");
        return Optional.empty();
    }

    /** {@code <event name>:<16 hex of sha256(canonical data)>}; stable across redeliveries. */
    public String dedupKey(CanonicalJson canonicalJson) {
        String name = (event == null) ? "unknown" : event.asText();
        JsonNode payload = (data == null) ? JsonNodeFactory.instance.objectNode() : data;
        return name + ":" + Hashing.sha256Hex(canonicalJson.write(payload), 16);
    }

    /** Raw event field as text, for dead-letter rows. */
    public String eventName() {
        if (event == null) return null;
        return event.isTextual() ? event.asText() : event.toString();
    }

    public Optional<String> messageId() {
        return Optional.ofNullable(messageId);
    }

    public JsonNode data() {
        return (data == null) ? JsonNodeFactory.instance.objectNode() : data;
    }

    /** Auth block, or an empty object when absent. */
    public JsonNode auth() {
        return (auth == null) ? JsonNodeFactory.instance.objectNode() : auth;
    }

    public ObjectNode raw() {
        return raw;
    }

    private static String readMessageId(ObjectNode item) {
        for (String f : MESSAGE_ID_FIELDS) {
            JsonNode v = item.get(f);
            if (v != null && !v.isNull()) return v.isValueNode() ? v.asText() : v.toString();
        }
        return null;
    }

    private static JsonNode field(ObjectNode item, String lower, String upper) {
        JsonNode v = item.get(lower);
        if (isPresent(v)) return v;
        v = item.get(upper);
        return isPresent(v) ? v : null;
    }

    private static boolean isPresent(JsonNode v) {
        if (v == null || v.isNull()) return false;
        if (v.isTextual()) return !v.asText().isEmpty();
        if (v.isContainerNode()) return v.size() > 0;
        if (v.isBoolean()) return v.asBoolean();
        if (v.isNumber()) return v.decimalValue().signum() != 0;
        return true;
    }
}
