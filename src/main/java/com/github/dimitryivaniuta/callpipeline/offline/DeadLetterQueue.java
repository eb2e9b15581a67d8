package com.github.dimitryivaniuta.callpipeline.offline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.callpipeline.state.JsonLinesAppender;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON Lines dead-letter file, one {@link DeadLetterRecord} per line.
 */
@Slf4j
public class DeadLetterQueue {

    private final JsonLinesAppender appender;
    private final ObjectMapper mapper;

    public DeadLetterQueue(JsonLinesAppender appender, ObjectMapper mapper) {
        this.appender = appender;
        this.mapper = mapper;
    }

    public void append(DeadLetterRecord record) {
        appender.append(record);
        log.warn("Dead-lettered offline event messageId={}, event={}, retries={}, error={}",
                record.getMessageId(), record.getEvent(), record.getRetryCount(), record.getError());
    }

    public List<DeadLetterRecord> readAll() {
        List<DeadLetterRecord> out = new ArrayList<>();
        for (JsonNode line : appender.readAll()) {
            try {
                out.add(mapper.treeToValue(line, DeadLetterRecord.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable dead-letter row, reason={}", e.getOriginalMessage());
            }
        }
        return out;
    }
}
