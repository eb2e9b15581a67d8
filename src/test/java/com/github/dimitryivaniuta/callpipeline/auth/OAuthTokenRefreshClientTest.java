package com.github.dimitryivaniuta.callpipeline.auth;

import com.github.dimitryivaniuta.callpipeline.error.ApiCallException;
import com.github.dimitryivaniuta.callpipeline.error.ErrorCodes;
import com.github.dimitryivaniuta.callpipeline.error.ErrorKind;
import com.github.dimitryivaniuta.callpipeline.tenant.TenantIdentity;
import com.github.dimitryivaniuta.callpipeline.tenant.TokenPair;
import com.github.dimitryivaniuta.callpipeline.testing.TestFixtures;
import com.github.dimitryivaniuta.callpipeline.transport.RestTemplateApiTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.hamcrest.Matchers.startsWith;

class OAuthTokenRefreshClientTest {

    private static final URI ENDPOINT = URI.create("https://oauth.example.com/oauth/token/");

    private final TenantIdentity tenant = TenantIdentity.oauth(TestFixtures.PORTAL);
    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        restTemplate.setErrorHandler(RestTemplateApiTransport.passThroughErrors());
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    private OAuthTokenRefreshClient client(String clientId, String clientSecret) {
        return new OAuthTokenRefreshClient(restTemplate, TestFixtures.mapper(), ENDPOINT, clientId, clientSecret);
    }

    @Test
    void shouldExchangeRefreshTokenForNewPair() {
        server.expect(requestTo(startsWith(ENDPOINT.toString())))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("grant_type", "refresh_token"))
                .andExpect(queryParam("client_id", "app.1"))
                .andExpect(queryParam("refresh_token", "r-1"))
                .andRespond(withSuccess("{\"access_token\":\"a-2\",\"refresh_token\":\"r-2\",\"expires_in\":3600}",
                        MediaType.APPLICATION_JSON));

        TokenPair tokens = client("app.1", "s3cret").refresh(tenant, "r-1");

        assertThat(tokens.accessToken()).isEqualTo("a-2");
        assertThat(tokens.refreshToken()).isEqualTo("r-2");
        server.verify();
    }

    @Test
    void shouldReturnNullRefreshTokenWhenNotRotated() {
        server.expect(requestTo(startsWith(ENDPOINT.toString())))
                .andRespond(withSuccess("{\"access_token\":\"a-2\"}", MediaType.APPLICATION_JSON));

        TokenPair tokens = client("app.1", "s3cret").refresh(tenant, "r-1");

        assertThat(tokens.refreshToken()).isNull();
    }

    @Test
    void shouldRaiseRemoteErrorFromErrorBody() {
        server.expect(requestTo(startsWith(ENDPOINT.toString())))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"invalid_grant\",\"error_description\":\"refresh token revoked\"}"));

        assertThatThrownBy(() -> client("app.1", "s3cret").refresh(tenant, "r-1"))
                .isInstanceOf(ApiCallException.class)
                .hasFieldOrPropertyWithValue("code", "invalid_grant")
                .hasMessageContaining("refresh token revoked");
    }

    @Test
    void shouldRejectResponseWithoutAccessToken() {
        server.expect(requestTo(startsWith(ENDPOINT.toString())))
                .andRespond(withSuccess("{\"expires_in\":3600}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client("app.1", "s3cret").refresh(tenant, "r-1"))
                .isInstanceOf(ApiCallException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCodes.INVALID_REFRESH_RESPONSE)
                .hasFieldOrPropertyWithValue("kind", ErrorKind.SCHEMA);
    }

    @Test
    void shouldRefuseWithoutRefreshTokenOrClientCredentials() {
        assertThatThrownBy(() -> client("app.1", "s3cret").refresh(tenant, " "))
                .hasFieldOrPropertyWithValue("code", ErrorCodes.MISSING_REFRESH_TOKEN);
        assertThatThrownBy(() -> client("app.1", null).refresh(tenant, "r-1"))
                .hasFieldOrPropertyWithValue("code", ErrorCodes.MISSING_CLIENT_CREDENTIALS);
        server.verify();
    }
}
