package com.github.dimitryivaniuta.callpipeline.tenant;

/**
 * Result of a token refresh. {@code refreshToken} may be null when the server did not rotate it.
 */
public record TokenPair(String accessToken, String refreshToken) {

    @Override
    public String toString() {
        return "TokenPair[***]";
    }
}
