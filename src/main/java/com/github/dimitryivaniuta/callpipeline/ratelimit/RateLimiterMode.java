package com.github.dimitryivaniuta.callpipeline.ratelimit;

public enum RateLimiterMode {
    /** No limiting. */
    NONE,
    /** In-process only. */
    LOCAL,
    /** File-backed bucket shared by every process on the host. */
    SHARED
}
