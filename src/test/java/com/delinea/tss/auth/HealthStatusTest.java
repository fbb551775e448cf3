package com.delinea.tss.auth;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for health probe body classification.
 */
class HealthStatusTest {

    @Test
    void fromBody_withHealthyTrue_isStructured() {
        assertThat(HealthStatus.fromBody("{\"healthy\":true}")).isEqualTo(HealthStatus.HEALTHY_STRUCTURED);
    }

    @Test
    void fromBody_withHealthyFalse_isUnhealthy() {
        assertThat(HealthStatus.fromBody("{\"healthy\":false}")).isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    void fromBody_withJsonWithoutHealthyField_isUnhealthy() {
        // JSON is authoritative even if the text mentions Healthy
        assertThat(HealthStatus.fromBody("{\"status\":\"Healthy\"}")).isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    void fromBody_withLegacyText_isHealthyLegacy() {
        assertThat(HealthStatus.fromBody("<html><body>Healthy</body></html>"))
                .isEqualTo(HealthStatus.HEALTHY_LEGACY_TEXT);
    }

    @Test
    void fromBody_withLowercaseText_isUnhealthy() {
        assertThat(HealthStatus.fromBody("healthy")).isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    void fromBody_withEmptyOrNull_isUnhealthy() {
        assertThat(HealthStatus.fromBody("")).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(HealthStatus.fromBody(null)).isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    void isHealthy_onlyForHealthyOutcomes() {
        assertThat(HealthStatus.HEALTHY_STRUCTURED.isHealthy()).isTrue();
        assertThat(HealthStatus.HEALTHY_LEGACY_TEXT.isHealthy()).isTrue();
        assertThat(HealthStatus.UNHEALTHY.isHealthy()).isFalse();
        assertThat(HealthStatus.UNREACHABLE.isHealthy()).isFalse();
    }
}
