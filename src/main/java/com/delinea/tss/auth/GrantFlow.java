package com.delinea.tss.auth;

/**
 * A way of exchanging username/password credentials for a bearer token.
 *
 * <p>{@link TokenSource} picks the flow that matches the detected {@link DeploymentMode}:
 * <ul>
 *   <li>{@link DeploymentMode#ON_PREM_OR_CLOUD}: {@link PasswordGrantFlow}</li>
 *   <li>{@link DeploymentMode#PLATFORM}: {@link ClientCredentialsGrantFlow}</li>
 * </ul>
 *
 * <p>Implementations perform network calls on the caller's thread and do not cache; caching
 * and single-flight coordination belong to {@link TokenSource}.
 */
public interface GrantFlow {

    /**
     * Returns the authentication method implemented by this flow.
     *
     * <p>Used for logging.
     *
     * @return the auth method
     */
    AuthMethod getAuthMethod();

    /**
     * Obtains a fresh token.
     *
     * @param baseUrl     the backend base URL (the backend identity)
     * @param credentials username and password
     * @return the grant; {@link TokenGrant#getServerUrl()} is set when later requests must go
     *         to a different backend
     * @throws AuthenticationException if the token endpoint refuses the credentials
     * @throws TssException            for any other failure of the flow
     */
    TokenGrant requestToken(String baseUrl, Credentials credentials) throws TssException;
}
