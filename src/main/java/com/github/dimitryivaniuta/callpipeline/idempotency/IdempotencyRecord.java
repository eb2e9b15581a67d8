package com.github.dimitryivaniuta.callpipeline.idempotency;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdempotencyRecord {

    private String key;

    private IdempotencyStatus status;

    /** Response body cached for replay; only set once DONE. */
    private JsonNode response;

    private Instant updatedAt;

    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt == null || expiresAt.isBefore(now);
    }
}
