package com.delinea.tss.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for DeploymentModeDetector against a mock backend.
 */
class DeploymentModeDetectorTest {

    private MockWebServer server;
    private DeploymentModeDetector detector;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        baseUrl = server.url("/SecretServer").toString();
        detector = new DeploymentModeDetector(new TssHttpClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void detect_withHealthySecretServer_skipsPlatformProbe() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"healthy\":true}"));

        DeploymentModeDetector.Detection detection = detector.inspect(baseUrl);

        assertThat(detection.getMode()).isEqualTo(DeploymentMode.ON_PREM_OR_CLOUD);
        assertThat(detection.getSecretServerHealth()).isEqualTo(HealthStatus.HEALTHY_STRUCTURED);
        assertThat(detection.getPlatformHealth()).isNull();
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(server.takeRequest().getPath()).isEqualTo("/SecretServer/healthcheck.aspx");
    }

    @Test
    void detect_withLegacyTextHealthPage_isOnPrem() {
        server.enqueue(new MockResponse().setBody("Healthy"));

        assertThat(detector.detect(baseUrl)).isEqualTo(DeploymentMode.ON_PREM_OR_CLOUD);
    }

    @Test
    void detect_ignoresHttpStatusOfProbe() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("{\"healthy\":true}"));

        assertThat(detector.detect(baseUrl)).isEqualTo(DeploymentMode.ON_PREM_OR_CLOUD);
    }

    @Test
    void detect_withUnhealthySecretServerAndHealthyPlatform_isPlatform() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("Not Found"));
        server.enqueue(new MockResponse().setBody("{\"healthy\":true}"));

        DeploymentModeDetector.Detection detection = detector.inspect(baseUrl);

        assertThat(detection.getMode()).isEqualTo(DeploymentMode.PLATFORM);
        assertThat(detection.getSecretServerHealth()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(detection.getPlatformHealth()).isEqualTo(HealthStatus.HEALTHY_STRUCTURED);

        server.takeRequest();
        RecordedRequest platformProbe = server.takeRequest();
        assertThat(platformProbe.getPath()).isEqualTo("/SecretServer/health");
        assertThat(platformProbe.getHeader("Authorization")).isNull();
    }

    @Test
    void detect_withNeitherHealthy_isUnknown() {
        server.enqueue(new MockResponse().setBody("{\"healthy\":false}"));
        server.enqueue(new MockResponse().setBody("{\"healthy\":false}"));

        assertThat(detector.detect(baseUrl)).isEqualTo(DeploymentMode.UNKNOWN);
    }

    @Test
    void detect_isDeterministicForSameResponses() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setBody("nope"));
            server.enqueue(new MockResponse().setBody("{\"healthy\":true}"));
        }

        assertThat(detector.detect(baseUrl)).isEqualTo(DeploymentMode.PLATFORM);
        assertThat(detector.detect(baseUrl)).isEqualTo(DeploymentMode.PLATFORM);
        assertThat(detector.detect(baseUrl)).isEqualTo(DeploymentMode.PLATFORM);
    }

    @Test
    void require_withNeitherHealthy_throwsInvalidDeployment() {
        server.enqueue(new MockResponse().setBody("down"));
        server.enqueue(new MockResponse().setBody("down"));

        assertThatThrownBy(() -> detector.require(baseUrl))
                .isInstanceOf(InvalidDeploymentException.class)
                .hasMessageContaining(baseUrl);
    }

    @Test
    void probe_withUnreachableHost_returnsUnreachable() throws IOException {
        String deadUrl = server.url("/health").toString();
        server.shutdown();

        assertThat(detector.probe(deadUrl)).isEqualTo(HealthStatus.UNREACHABLE);
    }

    @Test
    void require_withUnreachableHost_throwsInvalidDeployment() throws IOException {
        server.shutdown();

        assertThatThrownBy(() -> detector.require(baseUrl))
                .isInstanceOf(InvalidDeploymentException.class);
    }
}
