package com.delinea.tss.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resource-owner password grant against Secret Server or Secret Server Cloud.
 *
 * <p>Posts {@code grant_type=password}, {@code username}, {@code password} and, for domain
 * accounts, {@code domain} to {@code {baseUrl}/{tokenPath}}.
 */
public class PasswordGrantFlow implements GrantFlow {

    private static final Logger logger = LoggerFactory.getLogger(PasswordGrantFlow.class);

    public static final String DEFAULT_TOKEN_PATH = "/oauth2/token";

    private final TssHttpClient client;
    private final String tokenPath;

    public PasswordGrantFlow(TssHttpClient client) {
        this(client, DEFAULT_TOKEN_PATH);
    }

    /**
     * @param client    HTTP client
     * @param tokenPath token endpoint path relative to the base URL (the tokenPathURI option)
     */
    public PasswordGrantFlow(TssHttpClient client, String tokenPath) {
        this.client = client;
        this.tokenPath = Preconditions.isBlank(tokenPath) ? DEFAULT_TOKEN_PATH : tokenPath;
    }

    @Override
    public AuthMethod getAuthMethod() {
        return AuthMethod.PASSWORD;
    }

    @Override
    public TokenGrant requestToken(String baseUrl, Credentials credentials) throws TssException {
        requireUsernamePassword(credentials);
        TokenGrant grant = client.passwordGrant(TssHttpClient.join(baseUrl, tokenPath), credentials);
        logger.info("Password grant for user '{}' succeeded (expires in {}s)",
                credentials.getUsername(), grant.getExpiresIn());
        return grant;
    }

    static void requireUsernamePassword(Credentials credentials) throws AuthenticationException {
        if (Preconditions.isBlank(credentials.getUsername())
                || Preconditions.isBlank(credentials.getPassword())) {
            throw new AuthenticationException("Username and password are required for a token grant", 0);
        }
    }
}
