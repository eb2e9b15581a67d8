package com.github.dimitryivaniuta.callpipeline.offline;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An offline event given up on, kept with its original payload for manual replay.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterRecord {

    public static final String SCHEMA_ERROR_PREFIX = "INVALID_EVENT_SCHEMA: ";

    private String tenant;
    private String event;
    private String messageId;
    private int retryCount;
    private String error;
    /** The item exactly as received. */
    private JsonNode payload;
    private Instant timestamp;
}
