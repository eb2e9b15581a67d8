package com.github.dimitryivaniuta.callpipeline.auth;

import com.github.dimitryivaniuta.callpipeline.error.ApiCallException;
import com.github.dimitryivaniuta.callpipeline.tenant.TenantIdentity;
import com.github.dimitryivaniuta.callpipeline.tenant.TokenPair;

/**
 * Exchanges the current refresh token for a new token pair.
 */
@FunctionalInterface
public interface TokenRefreshClient {

    /**
     * @param refreshToken current refresh token, may be null
     * @throws ApiCallException when the refresh was refused or the response is unusable
     */
    TokenPair refresh(TenantIdentity tenant, String refreshToken);
}
