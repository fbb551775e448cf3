package com.delinea.tss.client;

import com.delinea.tss.auth.Credentials;
import com.delinea.tss.auth.PasswordGrantFlow;
import com.delinea.tss.auth.TokenGrant;
import com.delinea.tss.auth.TssException;
import com.delinea.tss.auth.TssHttpClient;
import java.time.Clock;
import java.time.Instant;

/**
 * Fetches a new token with a password grant on every call.
 *
 * <p>Always targets {@code {baseUrl}/oauth2/token}: no deployment detection and no vault
 * discovery. Wrap in a {@link ReusingTokenSource} to avoid a grant per request.
 */
public class PasswordTokenSource implements TokenSupplier {

    private final TssHttpClient client;
    private final String tokenUrl;
    private final Credentials credentials;
    private final Clock clock;

    public PasswordTokenSource(TssHttpClient client, String baseUrl, Credentials credentials) {
        this(client, baseUrl, PasswordGrantFlow.DEFAULT_TOKEN_PATH, credentials, Clock.systemUTC());
    }

    public PasswordTokenSource(TssHttpClient client, String baseUrl, String tokenPath,
                               Credentials credentials, Clock clock) {
        this.client = client;
        this.tokenUrl = TssHttpClient.join(baseUrl, tokenPath);
        this.credentials = credentials;
        this.clock = clock;
    }

    @Override
    public IssuedToken token() throws TssException {
        Instant issuedAt = clock.instant();
        TokenGrant grant = client.passwordGrant(tokenUrl, credentials);
        return new IssuedToken(grant.getAccessToken(), grant.getTokenType(), grant.getRefreshToken(),
                issuedAt.plusSeconds(Math.max(grant.getExpiresIn(), 0)));
    }
}
