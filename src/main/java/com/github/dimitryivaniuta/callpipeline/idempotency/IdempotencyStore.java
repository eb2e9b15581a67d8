package com.github.dimitryivaniuta.callpipeline.idempotency;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.callpipeline.state.LockedJsonFile;
import com.github.dimitryivaniuta.callpipeline.support.CanonicalJson;
import com.github.dimitryivaniuta.callpipeline.support.Hashing;

import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * File-backed record of write calls, keyed by idempotency key, so a retried write returns the
 * first response instead of running twice.
 *
 * <p>Every mutation rewrites the whole file under an exclusive lock and drops expired records.
 */
public class IdempotencyStore {

    public static final Duration MIN_TTL = Duration.ofSeconds(60);

    /** Params fields that carry a caller-supplied key, in lookup order. */
    public static final List<String> KEY_FIELDS = List.of(
            "idempotency_key",
            "IDEMPOTENCY_KEY",
            "origin_id",
            "ORIGIN_ID",
            "external_id",
            "EXTERNAL_ID"
    );

    private final LockedJsonFile<TreeMap<String, IdempotencyRecord>> file;
    private final CanonicalJson canonicalJson;
    private final Duration ttl;
    private final Clock clock;

    public IdempotencyStore(Path stateFile, ObjectMapper mapper, Duration ttl, Clock clock) {
        this.file = new LockedJsonFile<>(stateFile, mapper, new TypeReference<>() {}, TreeMap::new);
        this.canonicalJson = new CanonicalJson(mapper);
        this.ttl = (ttl.compareTo(MIN_TTL) < 0) ? MIN_TTL : ttl;
        this.clock = clock;
    }

    /**
     * Derives the key for one call: explicit key first, then a well-known params field, then a
     * hash of the canonical params.
     */
    public String keyFor(String tenant, String method, Map<String, ?> params, String explicitKey) {
        String prefix = tenant + "|" + method + "|";
        if (explicitKey != null && !explicitKey.isBlank()) {
            return prefix + explicitKey.trim();
        }

        Map<String, ?> p = (params == null) ? Map.of() : params;
        for (String field : KEY_FIELDS) {
            Object value = p.get(field);
            if (value instanceof String || value instanceof Integer || value instanceof Long || value instanceof BigInteger) {
                return prefix + field + ":" + value;
            }
        }

        String digest = Hashing.sha256Hex(tenant + "|" + method + "|" + canonicalJson.write(p), 24);
        return prefix + "auto:" + digest;
    }

    /**
     * @return the cached response when the key has an unexpired DONE record
     */
    public Optional<JsonNode> checkReplay(String key) {
        Instant now = clock.instant();
        IdempotencyRecord rec = file.read().get(key);
        if (rec == null || rec.isExpired(now) || rec.getStatus() != IdempotencyStatus.DONE) {
            return Optional.empty();
        }
        return Optional.ofNullable(rec.getResponse());
    }

    public void start(String key) {
        put(key, IdempotencyStatus.IN_PROGRESS, null);
    }

    public void done(String key, JsonNode response) {
        put(key, IdempotencyStatus.DONE, response);
    }

    public void clear(String key) {
        Instant now = clock.instant();
        file.update(records -> {
            purgeExpired(records, now);
            records.remove(key);
            return null;
        });
    }

    public Optional<IdempotencyRecord> find(String key) {
        Instant now = clock.instant();
        return Optional.ofNullable(file.read().get(key)).filter(r -> !r.isExpired(now));
    }

    private void put(String key, IdempotencyStatus status, JsonNode response) {
        Instant now = clock.instant();
        IdempotencyRecord rec = IdempotencyRecord.builder()
                .key(key)
                .status(status)
                .response(response)
                .updatedAt(now)
                .expiresAt(now.plus(ttl))
                .build();

        file.update(records -> {
            purgeExpired(records, now);
            records.put(key, rec);
            return null;
        });
    }

    private static void purgeExpired(TreeMap<String, IdempotencyRecord> records, Instant now) {
        records.values().removeIf(r -> r == null || r.isExpired(now));
    }
}
