package com.delinea.tss.auth;

/**
 * Which product answers at a base URL, and therefore which grant flow applies.
 */
public enum DeploymentMode {

    /** Self-hosted Secret Server or Secret Server Cloud: password grant. */
    ON_PREM_OR_CLOUD,

    /** Identity Platform in front of one or more vaults: client-credentials grant. */
    PLATFORM,

    /** Neither health probe succeeded. */
    UNKNOWN
}
