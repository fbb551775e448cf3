package com.delinea.tss.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.delinea.tss.auth.AuthMethod;
import com.delinea.tss.auth.AuthStage;
import com.delinea.tss.auth.TssException;
import com.delinea.tss.auth.TssHttpClient;
import com.delinea.tss.auth.UnsupportedCapabilityException;
import com.delinea.tss.auth.ntlm.UnsupportedChallengeResponseProvider;
import java.io.IOException;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for SecretServerClient with password authentication against a mock server.
 */
class SecretServerClientTest {

    private MockWebServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        baseUrl = server.url("/SecretServer").toString();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private SecretServerClient passwordClient() {
        return SecretServerClient.builder(baseUrl)
                .httpClient(new TssHttpClient())
                .withPasswordAuth("svc-reader", "pw")
                .build();
    }

    @Test
    void secret_fetchesTokenThenSecret() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"access_token\":\"t1\",\"token_type\":\"bearer\",\"expires_in\":1200}"));
        server.enqueue(new MockResponse().setBody("{\"id\":42,\"name\":\"db-password\"}"));

        Map<String, Object> secret = passwordClient().secret(42);

        assertThat(secret).containsEntry("id", 42).containsEntry("name", "db-password");
        RecordedRequest grant = server.takeRequest();
        assertThat(grant.getPath()).isEqualTo("/SecretServer/oauth2/token");
        assertThat(grant.getBody().readUtf8()).contains("grant_type=password");
        RecordedRequest get = server.takeRequest();
        assertThat(get.getPath()).isEqualTo("/SecretServer/api/v1/secrets/42");
        assertThat(get.getHeader("Authorization")).isEqualTo("Bearer t1");
    }

    @Test
    void get_reusesTokenAcrossRequests() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"access_token\":\"t1\",\"expires_in\":1200}"));
        server.enqueue(new MockResponse().setBody("{\"id\":1}"));
        server.enqueue(new MockResponse().setBody("{\"id\":2}"));

        SecretServerClient client = passwordClient();
        client.secret(1);
        client.get("secrets/2");

        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void get_withErrorStatus_throwsApiRequestException() {
        server.enqueue(new MockResponse().setBody("{\"access_token\":\"t1\",\"expires_in\":1200}"));
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"message\":\"Secret not found\"}"));

        assertThatThrownBy(() -> passwordClient().secret(9))
                .isInstanceOf(TssException.class)
                .hasMessage("Secret not found")
                .satisfies(e -> assertThat(((TssException) e).getStage()).isEqualTo(AuthStage.API_REQUEST));
    }

    @Test
    void get_withNonJsonBody_throwsException() {
        server.enqueue(new MockResponse().setBody("{\"access_token\":\"t1\",\"expires_in\":1200}"));
        server.enqueue(new MockResponse().setBody("<html/>"));

        assertThatThrownBy(() -> passwordClient().secret(1))
                .isInstanceOf(TssException.class)
                .hasMessageContaining("not a JSON object");
    }

    @Test
    void build_withoutAuthMethod_throwsException() {
        assertThatThrownBy(() -> SecretServerClient.builder(baseUrl).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("withPasswordAuth");
    }

    @Test
    void ntlmClient_onUnsupportedPlatform_failsWithoutNetworkCall() {
        SecretServerClient client = SecretServerClient.builder(baseUrl)
                .withNtlmAuth(new UnsupportedChallengeResponseProvider("Linux"))
                .build();

        assertThat(client.getAuthMethod()).isEqualTo(AuthMethod.NTLM);
        assertThatThrownBy(() -> client.secret(1)).isInstanceOf(UnsupportedCapabilityException.class);
        assertThat(server.getRequestCount()).isZero();
    }
}
