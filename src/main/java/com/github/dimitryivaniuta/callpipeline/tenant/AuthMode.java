package com.github.dimitryivaniuta.callpipeline.tenant;

public enum AuthMode {
    WEBHOOK,
    OAUTH
}
