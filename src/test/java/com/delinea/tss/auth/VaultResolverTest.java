package com.delinea.tss.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for VaultResolver.
 */
class VaultResolverTest {

    private MockWebServer server;
    private VaultResolver resolver;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        baseUrl = server.url("/").toString();
        resolver = new VaultResolver(new TssHttpClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void resolveVault_selectsFirstDefaultAndActiveVault() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {
                    "vaults": [
                        {"vaultId": "a", "name": "inactive", "isDefault": true, "isActive": false,
                         "connection": {"url": "https://a.example.com"}},
                        {"vaultId": "b", "name": "primary", "isDefault": true, "isActive": true,
                         "connection": {"url": "https://b.example.com", "oAuthProfileId": "p-1"}},
                        {"vaultId": "c", "name": "other", "isDefault": true, "isActive": true,
                         "connection": {"url": "https://c.example.com"}}
                    ]
                }
                """));

        String url = resolver.resolveVault("platform-token", baseUrl);

        assertThat(url).isEqualTo("https://b.example.com");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/vaultbroker/api/vaults");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer platform-token");
    }

    @Test
    void resolveVault_withNoDefaultActiveVault_throwsNoVaultFound() {
        server.enqueue(new MockResponse().setBody("""
                {"vaults": [
                    {"vaultId": "a", "isDefault": false, "isActive": true, "connection": {"url": "https://a"}}
                ]}
                """));

        assertThatThrownBy(() -> resolver.resolveVault("t", baseUrl))
                .isInstanceOf(NoVaultFoundException.class)
                .hasMessageContaining("No configured vault found");
    }

    @Test
    void resolveVault_withEmptyList_throwsNoVaultFound() {
        server.enqueue(new MockResponse().setBody("{\"vaults\":[]}"));

        assertThatThrownBy(() -> resolver.resolveVault("t", baseUrl))
                .isInstanceOf(NoVaultFoundException.class);
    }

    @Test
    void resolveVault_withRejectedToken_throwsWithStatus() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"message\":\"Unauthorized\"}"));

        assertThatThrownBy(() -> resolver.resolveVault("t", baseUrl))
                .isInstanceOf(TssException.class)
                .satisfies(e -> {
                    TssException ex = (TssException) e;
                    assertThat(ex.getHttpStatusCode()).isEqualTo(401);
                    assertThat(ex.getStage()).isEqualTo(AuthStage.VAULT_DISCOVERY);
                });
    }

    @Test
    void resolveVault_withNonJsonBody_throwsTssException() {
        server.enqueue(new MockResponse().setBody("<html>maintenance</html>"));

        assertThatThrownBy(() -> resolver.resolveVault("t", baseUrl))
                .isInstanceOf(TssException.class)
                .isNotInstanceOf(NoVaultFoundException.class)
                .hasMessageContaining("not a JSON object");
    }

    @Test
    void selectDefault_skipsVaultWithoutUrl() {
        Vault noUrl = new Vault("a", "a", "t", true, false, true, null, null);
        Vault withUrl = new Vault("b", "b", "t", true, false, true, "https://b", null);

        assertThat(VaultResolver.selectDefault(List.of(noUrl, withUrl))).hasValue(withUrl);
        assertThat(VaultResolver.selectDefault(List.of())).isEmpty();
    }
}
