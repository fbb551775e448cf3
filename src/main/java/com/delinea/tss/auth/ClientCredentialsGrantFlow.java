package com.delinea.tss.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client-credentials grant against the Platform identity service, followed by vault
 * discovery.
 *
 * <p>The username and password are sent as {@code client_id} and {@code client_secret} with
 * the fixed scope {@code xpmheadless}. The vault is resolved again on every grant, even if an
 * earlier grant already selected one, so a vault that was deactivated is noticed.
 */
public class ClientCredentialsGrantFlow implements GrantFlow {

    private static final Logger logger = LoggerFactory.getLogger(ClientCredentialsGrantFlow.class);

    static final String PLATFORM_TOKEN_PATH = "identity/api/oauth2/token/xpmplatform";
    static final String SCOPE = "xpmheadless";

    private final TssHttpClient client;
    private final VaultResolver vaultResolver;

    public ClientCredentialsGrantFlow(TssHttpClient client) {
        this(client, new VaultResolver(client));
    }

    public ClientCredentialsGrantFlow(TssHttpClient client, VaultResolver vaultResolver) {
        this.client = client;
        this.vaultResolver = vaultResolver;
    }

    @Override
    public AuthMethod getAuthMethod() {
        return AuthMethod.CLIENT_CREDENTIALS;
    }

    @Override
    public TokenGrant requestToken(String baseUrl, Credentials credentials) throws TssException {
        PasswordGrantFlow.requireUsernamePassword(credentials);
        TokenGrant grant = client.clientCredentialsGrant(
                TssHttpClient.join(baseUrl, PLATFORM_TOKEN_PATH),
                credentials.getUsername(), credentials.getPassword(), SCOPE);
        logger.info("Platform client-credentials grant for '{}' succeeded (expires in {}s)",
                credentials.getUsername(), grant.getExpiresIn());

        String vaultUrl = vaultResolver.resolveVault(grant.getAccessToken(), baseUrl);
        return grant.withServerUrl(vaultUrl);
    }
}
