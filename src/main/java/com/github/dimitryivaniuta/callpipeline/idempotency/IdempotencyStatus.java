package com.github.dimitryivaniuta.callpipeline.idempotency;

public enum IdempotencyStatus {
    IN_PROGRESS,
    DONE
}
