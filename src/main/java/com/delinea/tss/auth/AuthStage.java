package com.delinea.tss.auth;

/**
 * The step of token acquisition or request dispatch during which a failure occurred.
 *
 * <p>Carried by every {@link TssException} so callers can tell configuration mistakes,
 * transient network trouble and backend-side rejection apart.
 */
public enum AuthStage {

    /** Unauthenticated health probes used to detect the deployment mode. */
    HEALTH_PROBE,

    /** Password or client-credentials grant against a token endpoint. */
    TOKEN_GRANT,

    /** Platform vault listing and default vault selection. */
    VAULT_DISCOVERY,

    /** Any leg of the NTLM negotiate/challenge/authenticate exchange. */
    NTLM_HANDSHAKE,

    /** A bearer-authenticated resource call made after a token was obtained. */
    API_REQUEST
}
