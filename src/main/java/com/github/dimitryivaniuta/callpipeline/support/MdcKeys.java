package com.github.dimitryivaniuta.callpipeline.support;

public final class MdcKeys {
    private MdcKeys() {}

    public static final String REQUEST_ID = "requestId";
    public static final String TENANT = "tenant";
    public static final String IDEMPOTENCY_KEY = "idempotencyKey";
}
