package com.delinea.tss.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a base URL hosts Secret Server or the Platform by probing their health
 * endpoints.
 *
 * <p>The Secret Server probe ({@code healthcheck.aspx}) is sent first; the Platform probe
 * ({@code health}) only when the first one is not healthy. Probes are unauthenticated and
 * their HTTP status is ignored: only the body counts. Transport failures make a probe
 * {@link HealthStatus#UNREACHABLE} and are never thrown.
 *
 * <p>The result is not cached; it is derived again every time a grant is needed.
 */
public class DeploymentModeDetector {

    private static final Logger logger = LoggerFactory.getLogger(DeploymentModeDetector.class);

    static final String SECRET_SERVER_HEALTH_PATH = "healthcheck.aspx";
    static final String PLATFORM_HEALTH_PATH = "health";

    private final TssHttpClient client;

    public DeploymentModeDetector(TssHttpClient client) {
        this.client = client;
    }

    /**
     * Probes {@code baseUrl} and reports the deployment mode.
     *
     * @param baseUrl the backend base URL
     * @return the mode, {@link DeploymentMode#UNKNOWN} if neither probe is healthy
     */
    public DeploymentMode detect(String baseUrl) {
        return inspect(baseUrl).getMode();
    }

    /**
     * Like {@link #detect(String)}, but fails instead of returning UNKNOWN.
     *
     * @throws InvalidDeploymentException if neither probe reports healthy
     */
    public DeploymentMode require(String baseUrl) throws InvalidDeploymentException {
        Detection detection = inspect(baseUrl);
        if (detection.getMode() == DeploymentMode.UNKNOWN) {
            throw new InvalidDeploymentException(baseUrl,
                    detection.getSecretServerHealth(), detection.getPlatformHealth());
        }
        return detection.getMode();
    }

    /**
     * Runs the probes and returns the mode together with each probe's outcome.
     */
    public Detection inspect(String baseUrl) {
        HealthStatus secretServer = probe(TssHttpClient.join(baseUrl, SECRET_SERVER_HEALTH_PATH));
        if (secretServer.isHealthy()) {
            logger.debug("{} is Secret Server ({})", baseUrl, secretServer);
            return new Detection(DeploymentMode.ON_PREM_OR_CLOUD, secretServer, null);
        }

        HealthStatus platform = probe(TssHttpClient.join(baseUrl, PLATFORM_HEALTH_PATH));
        if (platform.isHealthy()) {
            logger.debug("{} is the Platform ({})", baseUrl, platform);
            return new Detection(DeploymentMode.PLATFORM, secretServer, platform);
        }

        logger.warn("No healthy deployment at {} (healthcheck.aspx: {}, health: {})",
                baseUrl, secretServer, platform);
        return new Detection(DeploymentMode.UNKNOWN, secretServer, platform);
    }

    /**
     * Sends one health probe.
     *
     * @param url absolute URL of the health endpoint
     * @return the classified outcome
     */
    public HealthStatus probe(String url) {
        try {
            TssResponse response = client.fetch(url, AuthStage.HEALTH_PROBE);
            return HealthStatus.fromBody(response.getBody());
        } catch (TssConnectionException e) {
            logger.warn("Health probe {} unreachable: {}", url, e.getMessage());
            return HealthStatus.UNREACHABLE;
        }
    }

    /**
     * Result of {@link #inspect(String)}.
     */
    public static final class Detection {
        private final DeploymentMode mode;
        private final HealthStatus secretServerHealth;
        private final HealthStatus platformHealth;

        Detection(DeploymentMode mode, HealthStatus secretServerHealth, HealthStatus platformHealth) {
            this.mode = mode;
            this.secretServerHealth = secretServerHealth;
            this.platformHealth = platformHealth;
        }

        public DeploymentMode getMode() {
            return mode;
        }

        public HealthStatus getSecretServerHealth() {
            return secretServerHealth;
        }

        /**
         * Outcome of the Platform probe, or null if it was not sent.
         */
        public HealthStatus getPlatformHealth() {
            return platformHealth;
        }
    }
}
