package com.github.dimitryivaniuta.callpipeline.tenant;

public enum ApiVersion {
    V2,
    V3
}
