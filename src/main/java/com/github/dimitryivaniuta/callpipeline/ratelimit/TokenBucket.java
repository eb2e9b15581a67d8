package com.github.dimitryivaniuta.callpipeline.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Persisted bucket state for one tenant key.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class TokenBucket {

    /** Epoch millis of the last reservation. */
    private long last;

    /** Tokens left after the last reservation, in [0, burst]. */
    private double tokens;
}
