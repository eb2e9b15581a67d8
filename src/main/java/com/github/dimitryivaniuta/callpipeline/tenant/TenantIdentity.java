package com.github.dimitryivaniuta.callpipeline.tenant;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.net.URI;
import java.util.Locale;

/**
 * Who we talk to and how requests are addressed. Immutable; built once from configuration.
 */
@Getter
@EqualsAndHashCode
public final class TenantIdentity {

    private final String baseUrl;
    private final AuthMode authMode;
    private final String webhookUserId;
    @Getter(AccessLevel.NONE)
    private final String webhookCode;

    private TenantIdentity(String baseUrl, AuthMode authMode, String webhookUserId, String webhookCode) {
        this.baseUrl = normalize(baseUrl);
        this.authMode = authMode;
        this.webhookUserId = webhookUserId;
        this.webhookCode = webhookCode;
    }

    public static TenantIdentity webhook(String baseUrl, String userId, String code) {
        if (userId == null || userId.isBlank() || code == null || code.isBlank()) {
            throw new IllegalArgumentException("webhook user id and code are required for webhook mode");
        }
        return new TenantIdentity(baseUrl, AuthMode.WEBHOOK, userId.trim(), code.trim());
    }

    public static TenantIdentity oauth(String baseUrl) {
        return new TenantIdentity(baseUrl, AuthMode.OAUTH, null, null);
    }

    public boolean isOAuth() {
        return authMode == AuthMode.OAUTH;
    }

    /** Key shared by every process talking to the same portal. */
    public String rateLimitKey() {
        return baseUrl;
    }

    public URI methodUri(String method, ApiVersion version) {
        if (authMode == AuthMode.WEBHOOK) {
            // v3 has no separate webhook path
            return URI.create(baseUrl + "/rest/" + webhookUserId + "/" + webhookCode + "/" + method);
        }
        if (version == ApiVersion.V3) {
            return URI.create(baseUrl + "/rest/api/" + method);
        }
        return URI.create(baseUrl + "/rest/" + method);
    }

    private static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("tenant base url must not be blank");
        }
        String s = raw.trim();
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        String lower = s.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            s = "https://" + s;
        }
        return s;
    }

    @Override
    public String toString() {
        return "TenantIdentity{" + baseUrl + ", " + authMode + "}";
    }
}
