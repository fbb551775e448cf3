package com.delinea.tss.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.delinea.tss.auth.AuthStage;
import com.delinea.tss.auth.Credentials;
import com.delinea.tss.auth.InMemoryTokenCache;
import com.delinea.tss.auth.InvalidDeploymentException;
import com.delinea.tss.auth.TokenCache;
import com.delinea.tss.auth.TssException;
import com.delinea.tss.auth.TssHttpClient;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for SecretServer request dispatch against a mock on-premises server.
 */
class SecretServerTest {

    private MockWebServer server;
    private InMemoryTokenCache cache;
    private AtomicInteger grants;
    private volatile int secretStatus;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        grants = new AtomicInteger();
        secretStatus = 200;
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath();
                if (path.endsWith("/healthcheck.aspx")) {
                    return new MockResponse().setBody("{\"healthy\":true}");
                }
                if (path.endsWith("/oauth2/token")) {
                    int n = grants.incrementAndGet();
                    return new MockResponse().setBody("{\"access_token\":\"token-" + n + "\",\"expires_in\":1200}");
                }
                if (path.startsWith("/SecretServer/api/v1/secrets/")) {
                    if (secretStatus != 200) {
                        return new MockResponse().setResponseCode(secretStatus)
                                .setBody("{\"message\":\"Authentication failed or expired token\"}");
                    }
                    return new MockResponse().setBody("{\"id\":7,\"name\":\"db\",\"method\":\""
                            + request.getMethod() + "\"}");
                }
                if (path.equals("/SecretServer/api/v1/secret-templates/3")) {
                    return new MockResponse().setBody("{\"id\":3,\"name\":\"Password\"}");
                }
                return new MockResponse().setResponseCode(404);
            }
        });
        server.start();
        baseUrl = server.url("/SecretServer").toString();
        cache = new InMemoryTokenCache();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private SecretServer secretServer() {
        Configuration config = Configuration.builder()
                .serverUrl(baseUrl)
                .credentials(Credentials.password("svc", "pw"))
                .build();
        return new SecretServer(config, new TssHttpClient(), cache);
    }

    @Test
    void constructor_withInvalidConfiguration_throwsException() {
        Configuration config = Configuration.builder().credentials(Credentials.password("u", "p")).build();

        assertThatThrownBy(() -> new SecretServer(config, new TssHttpClient(), cache))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void secret_authenticatesAndFetches() throws Exception {
        Map<String, Object> secret = secretServer().secret(7);

        assertThat(secret).containsEntry("name", "db");
        assertThat(grants.get()).isEqualTo(1);
        assertThat(cache.get(TokenCache.keyFor(baseUrl))).isPresent();
    }

    @Test
    void secretTemplate_fetchesTemplate() throws Exception {
        assertThat(secretServer().secretTemplate(3)).containsEntry("name", "Password");
    }

    @Test
    void secret_reusesCachedTokenAcrossInstances() throws Exception {
        secretServer().secret(7);
        secretServer().secret(7);

        assertThat(grants.get()).isEqualTo(1);
    }

    @Test
    void secret_againstPlatform_secondInstanceUsesPinnedVault() throws Exception {
        MockWebServer vault = new MockWebServer();
        vault.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if (request.getPath().equals("/api/v1/secrets/7")) {
                    return new MockResponse().setBody("{\"id\":7}");
                }
                return new MockResponse().setResponseCode(404);
            }
        });
        vault.start();
        String vaultUrl = vault.url("/").toString();

        MockWebServer platform = new MockWebServer();
        platform.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath();
                if (path.equals("/health")) {
                    return new MockResponse().setBody("{\"healthy\":true}");
                }
                if (path.equals("/identity/api/oauth2/token/xpmplatform")) {
                    grants.incrementAndGet();
                    return new MockResponse().setBody("{\"access_token\":\"platform-token\",\"expires_in\":3600}");
                }
                if (path.equals("/vaultbroker/api/vaults")) {
                    return new MockResponse().setBody("{\"vaults\":[{\"isDefault\":true,\"isActive\":true,"
                            + "\"connection\":{\"url\":\"" + vaultUrl + "\"}}]}");
                }
                return new MockResponse().setResponseCode(404)
                        .setBody("{\"message\":\"platform host has no secrets\"}");
            }
        });
        platform.start();
        try {
            Configuration config = Configuration.builder()
                    .serverUrl(platform.url("/").toString())
                    .credentials(Credentials.password("app-id", "app-secret"))
                    .build();

            assertThat(new SecretServer(config, new TssHttpClient(), cache).secret(7)).containsEntry("id", 7);
            assertThat(new SecretServer(config, new TssHttpClient(), cache).secret(7)).containsEntry("id", 7);

            assertThat(grants.get()).isEqualTo(1);
            assertThat(vault.getRequestCount()).isEqualTo(2);
        } finally {
            platform.shutdown();
            vault.shutdown();
        }
    }

    @Test
    void secret_withStaticToken_skipsDetectionAndGrant() throws Exception {
        Configuration config = Configuration.builder()
                .serverUrl(baseUrl)
                .credentials(Credentials.token("static"))
                .build();

        new SecretServer(config, new TssHttpClient(), cache).secret(7);

        RecordedRequest only = server.takeRequest();
        assertThat(only.getPath()).isEqualTo("/SecretServer/api/v1/secrets/7");
        assertThat(only.getHeader("Authorization")).isEqualTo("Bearer static");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void accessResource_on401_clearsTokenAndNextCallGrantsAgain() throws Exception {
        SecretServer secretServer = secretServer();
        secretServer.secret(7);

        secretStatus = 401;
        assertThatThrownBy(() -> secretServer.secret(7))
                .isInstanceOf(TssException.class)
                .satisfies(e -> {
                    TssException ex = (TssException) e;
                    assertThat(ex.getHttpStatusCode()).isEqualTo(401);
                    assertThat(ex.getStage()).isEqualTo(AuthStage.API_REQUEST);
                    assertThat(ex.isAuthorizationFailure()).isTrue();
                });
        assertThat(cache.get(TokenCache.keyFor(baseUrl))).isEmpty();

        secretStatus = 200;
        secretServer.secret(7);
        assertThat(grants.get()).isEqualTo(2);
    }

    @Test
    void accessResource_on403_clearsCachedToken() throws Exception {
        SecretServer secretServer = secretServer();
        secretServer.secret(7);

        secretStatus = 403;
        assertThatThrownBy(() -> secretServer.secret(7))
                .isInstanceOf(TssException.class)
                .hasMessageContaining("Authentication failed");

        assertThat(cache.get(TokenCache.keyFor(baseUrl))).isEmpty();
    }

    @Test
    void accessResource_on500_keepsCachedToken() throws Exception {
        SecretServer secretServer = secretServer();
        secretServer.secret(7);

        secretStatus = 500;
        assertThatThrownBy(() -> secretServer.secret(7)).isInstanceOf(TssException.class);

        assertThat(cache.get(TokenCache.keyFor(baseUrl))).isPresent();
    }

    @Test
    void accessResource_withBody_sendsJson() throws Exception {
        Map<String, Object> result = secretServer().accessResource("PUT", "secrets", "7",
                Map.of("name", "db"));

        assertThat(result).containsEntry("method", "PUT");
    }

    @Test
    void accessResource_withUnknownResource_throwsException() {
        assertThatThrownBy(() -> secretServer().accessResource("GET", "folders", "1", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("folders");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void urlFor_joinsBaseApiPathResourceAndPath() {
        assertThat(secretServer().urlFor("secrets", "/42/"))
                .isEqualTo(baseUrl + "/api/v1/secrets/42");
        assertThat(secretServer().urlFor("secrets", ""))
                .isEqualTo(baseUrl + "/api/v1/secrets");
    }

    @Test
    void accessToken_withUnhealthyBackend_throwsInvalidDeployment() throws IOException {
        server.shutdown();

        assertThatThrownBy(() -> secretServer().accessToken())
                .isInstanceOf(InvalidDeploymentException.class);
    }
}
