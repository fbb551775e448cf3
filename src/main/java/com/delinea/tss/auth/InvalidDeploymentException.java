package com.delinea.tss.auth;

/**
 * Neither the Secret Server nor the Platform health probe reported a healthy backend.
 */
public class InvalidDeploymentException extends TssException {

    private final String baseUrl;

    public InvalidDeploymentException(String baseUrl, HealthStatus secretServerHealth,
                                      HealthStatus platformHealth) {
        super("No healthy Secret Server or Platform found at " + baseUrl
                        + " (healthcheck.aspx: " + secretServerHealth
                        + ", health: " + platformHealth + ")",
                0, AuthStage.HEALTH_PROBE);
        this.baseUrl = baseUrl;
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
