package com.github.dimitryivaniuta.callpipeline.tenant;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Access/refresh token pair shared by every in-flight call of one tenant.
 * Reads and writes go through the lock so callers never observe a half-updated pair.
 */
public class CredentialState {

    private final ReentrantLock lock = new ReentrantLock();
    private String accessToken;
    private String refreshToken;

    public CredentialState(String accessToken, String refreshToken) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
    }

    public static CredentialState empty() {
        return new CredentialState(null, null);
    }

    public TokenPair snapshot() {
        lock.lock();
        try {
            return new TokenPair(accessToken, refreshToken);
        } finally {
            lock.unlock();
        }
    }

    public String accessToken() {
        return snapshot().accessToken();
    }

    /** Keeps the previous refresh token when {@code tokens} carries none. */
    public void update(TokenPair tokens) {
        lock.lock();
        try {
            this.accessToken = tokens.accessToken();
            if (tokens.refreshToken() != null && !tokens.refreshToken().isBlank()) {
                this.refreshToken = tokens.refreshToken();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "CredentialState[***]";
    }
}
