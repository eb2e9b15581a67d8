package com.github.dimitryivaniuta.callpipeline.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordered by severity: {@code READ < WRITE < DESTRUCTIVE}.
 */
public enum RiskTier {
    READ,
    WRITE,
    DESTRUCTIVE;

    public boolean atLeast(RiskTier other) {
        return compareTo(other) >= 0;
    }

    public static RiskTier max(RiskTier a, RiskTier b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RiskTier fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
