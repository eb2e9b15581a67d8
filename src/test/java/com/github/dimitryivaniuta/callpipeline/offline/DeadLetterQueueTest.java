package com.github.dimitryivaniuta.callpipeline.offline;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.callpipeline.state.JsonLinesAppender;
import com.github.dimitryivaniuta.callpipeline.testing.TestFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static com.github.dimitryivaniuta.callpipeline.testing.TestFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;

class DeadLetterQueueTest {

    @TempDir
    Path dir;

    @Test
    void shouldKeepOriginalPayloadForReplay() {
        DeadLetterQueue dlq = new DeadLetterQueue(new JsonLinesAppender(dir.resolve("dlq.jsonl"), TestFixtures.mapper()),
                TestFixtures.mapper());

        dlq.append(DeadLetterRecord.builder()
                .tenant(TestFixtures.PORTAL)
                .event("ONCRMDEALADD")
                .messageId("m1")
                .retryCount(5)
                .error("timeout")
                .payload(json("{\"message_id\":\"m1\",\"data\":{\"FIELDS\":{\"ID\":\"42\"}}}"))
                .timestamp(Instant.parse("2024-05-01T10:00:00Z"))
                .build());

        DeadLetterRecord row = dlq.readAll().get(0);
        assertThat(row.getEvent()).isEqualTo("ONCRMDEALADD");
        assertThat(row.getRetryCount()).isEqualTo(5);
        assertThat(row.getPayload().path("data").path("FIELDS").path("ID").asText()).isEqualTo("42");
        assertThat(row.getTimestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    void shouldReadBackPayloadExactlyAsAppended() throws Exception {
        Path file = dir.resolve("dlq.jsonl");
        DeadLetterQueue dlq = new DeadLetterQueue(new JsonLinesAppender(file, TestFixtures.mapper()), TestFixtures.mapper());
        JsonNode payload = json("{\"a\":1.1,\"b\":null,\"c\":\"\u041f\u0440\u0438\u0432\u0435\u0442 \u2026\","
                + "\"d\":[1,2.5E+3,{\"x\":12345678901234567890}],\"e\":true}");

        dlq.append(DeadLetterRecord.builder()
                .tenant(TestFixtures.PORTAL)
                .event("ONCRMDEALUPDATE")
                .messageId("m7")
                .retryCount(3)
                .error("handler failed")
                .payload(payload)
                .timestamp(Instant.parse("2024-05-01T10:00:00Z"))
                .build());

        assertThat(dlq.readAll().get(0).getPayload()).isEqualTo(payload);
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(1);
        assertThat(lines.get(0))
                .contains("\"payload\":" + TestFixtures.mapper().writeValueAsString(payload))
                .contains("\u041f\u0440\u0438\u0432\u0435\u0442")
                .contains("12345678901234567890");
    }
}
