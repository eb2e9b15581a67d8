package com.github.dimitryivaniuta.callpipeline.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.callpipeline.state.JsonLinesAppender;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Append-only audit log of gated calls, one JSON document per line.
 * Storage failures are logged and never fail the call being audited.
 */
@Slf4j
public class AuditTrail {

    private final JsonLinesAppender appender;
    private final boolean enabled;

    public AuditTrail(JsonLinesAppender appender, boolean enabled) {
        this.appender = appender;
        this.enabled = enabled;
    }

    public void record(AuditEntry entry) {
        if (!enabled) return;
        try {
            appender.append(entry);
        } catch (Exception auditEx) {
            log.warn("Audit persistence failed for method={}, requestId={}, reason={}",
                    entry.getMethod(), entry.getRequestId(), auditEx.toString());
        }
    }

    public List<JsonNode> readAll() {
        return appender.readAll();
    }

    public boolean isEnabled() {
        return enabled;
    }
}
