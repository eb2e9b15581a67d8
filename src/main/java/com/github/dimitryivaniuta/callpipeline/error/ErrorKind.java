package com.github.dimitryivaniuta.callpipeline.error;

/**
 * Coarse error taxonomy. Callers branch on the kind to decide whether to retry,
 * fix configuration or escalate.
 */
public enum ErrorKind {
    /** Auth/scope/bad-request class. Never retried. */
    FATAL,
    /** Rate limit or server-side 5xx. Retried with backoff. */
    TRANSIENT,
    /** Transport-level failure (connect, DNS, I/O). */
    NETWORK,
    /** Malformed request or response shape. */
    SCHEMA,
    /** Plan, allowlist, confirmation and batch-size errors raised before any call. */
    WORKFLOW,
    /** Remote error that is neither fatal nor retryable. */
    REJECTED
}
