package com.delinea.tss.auth;

import java.util.Map;

/**
 * Outcome of a single health probe.
 *
 * <p>Legacy Secret Server health pages are plain text, so a body that is not JSON is
 * accepted as healthy when it contains the word {@code Healthy}. The two healthy outcomes
 * are kept apart so tests and logs can tell which rule matched.
 */
public enum HealthStatus {

    /** JSON body with {@code "healthy": true}. */
    HEALTHY_STRUCTURED,

    /** Non-JSON body containing the text {@code Healthy}. */
    HEALTHY_LEGACY_TEXT,

    /** A response was received but did not report the deployment as healthy. */
    UNHEALTHY,

    /** No response: connection refused, TLS failure, timeout. */
    UNREACHABLE;

    public boolean isHealthy() {
        return this == HEALTHY_STRUCTURED || this == HEALTHY_LEGACY_TEXT;
    }

    /**
     * Classifies a probe response body.
     *
     * @param body the response body, possibly empty
     * @return {@link #HEALTHY_STRUCTURED}, {@link #HEALTHY_LEGACY_TEXT} or {@link #UNHEALTHY}
     */
    public static HealthStatus fromBody(String body) {
        Map<String, Object> json = JsonUtil.parseObject(body);
        if (json != null) {
            return JsonUtil.getBoolean(json, "healthy") ? HEALTHY_STRUCTURED : UNHEALTHY;
        }
        return body != null && body.contains("Healthy") ? HEALTHY_LEGACY_TEXT : UNHEALTHY;
    }
}
