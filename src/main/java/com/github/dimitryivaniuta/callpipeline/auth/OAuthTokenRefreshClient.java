package com.github.dimitryivaniuta.callpipeline.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.callpipeline.error.ApiCallException;
import com.github.dimitryivaniuta.callpipeline.error.ApiError;
import com.github.dimitryivaniuta.callpipeline.error.ErrorCodes;
import com.github.dimitryivaniuta.callpipeline.error.ErrorKind;
import com.github.dimitryivaniuta.callpipeline.tenant.TenantIdentity;
import com.github.dimitryivaniuta.callpipeline.tenant.TokenPair;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Refresh-token grant against the OAuth server:
 * {@code GET {endpoint}?grant_type=refresh_token&client_id=..&client_secret=..&refresh_token=..}.
 */
@Slf4j
public class OAuthTokenRefreshClient implements TokenRefreshClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final URI tokenEndpoint;
    private final String clientId;
    private final String clientSecret;

    public OAuthTokenRefreshClient(RestTemplate restTemplate,
                                   ObjectMapper mapper,
                                   URI tokenEndpoint,
                                   String clientId,
                                   String clientSecret) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.tokenEndpoint = tokenEndpoint;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    @Override
    public TokenPair refresh(TenantIdentity tenant, String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw ApiError.of(ErrorKind.FATAL, ErrorCodes.MISSING_REFRESH_TOKEN, "refresh token missing").toException();
        }
        if (isBlank(clientId) || isBlank(clientSecret)) {
            throw ApiError.of(ErrorKind.FATAL, ErrorCodes.MISSING_CLIENT_CREDENTIALS,
                    "client id and client secret are required for refresh").toException();
        }

        URI uri = UriComponentsBuilder.fromUri(tokenEndpoint)
                .queryParam("grant_type", "refresh_token")
                .queryParam("client_id", clientId)
                .queryParam("client_secret", clientSecret)
                .queryParam("refresh_token", refreshToken)
                .encode()
                .build()
                .toUri();

        ResponseEntity<String> response;
        try {
            response = restTemplate.getForEntity(uri, String.class);
        } catch (ResourceAccessException e) {
            throw new ApiCallException(ApiError.of(ErrorKind.NETWORK, ErrorCodes.NETWORK_ERROR,
                    "token endpoint unreachable: " + e.getMostSpecificCause()), e);
        }

        int status = response.getStatusCode().value();
        JsonNode body = parse(response.getBody());

        JsonNode error = body.get("error");
        if (error != null && !error.isNull()) {
            String code = error.asText();
            String message = body.path("error_description").asText(code);
            throw ApiError.remote(message, status, code, body).toException();
        }

        String accessToken = body.path("access_token").asText("");
        if (accessToken.isBlank()) {
            throw new ApiError("refresh returned no access_token", status,
                    ErrorCodes.INVALID_REFRESH_RESPONSE, body, ErrorKind.SCHEMA).toException();
        }
        String newRefresh = body.path("refresh_token").asText(null);

        log.info("Access token refreshed for tenant={}", tenant.getBaseUrl());
        return new TokenPair(accessToken, newRefresh);
    }

    private JsonNode parse(String raw) {
        try {
            JsonNode node = (raw == null || raw.isBlank()) ? null : mapper.readTree(raw);
            if (node != null && node.isObject()) return node;
        } catch (JsonProcessingException e) {
            log.debug("Token endpoint returned non-JSON body: {}", e.getOriginalMessage());
        }
        throw ApiError.of(ErrorKind.SCHEMA, ErrorCodes.INVALID_REFRESH_RESPONSE,
                "token endpoint returned a non-object body").toException();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
