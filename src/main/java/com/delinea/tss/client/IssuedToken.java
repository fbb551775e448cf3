package com.delinea.tss.client;

import java.time.Duration;
import java.time.Instant;

/**
 * A token held by the single-slot {@link ReusingTokenSource}.
 */
public final class IssuedToken {

    private final String accessToken;
    private final String tokenType;
    private final String refreshToken;
    private final Instant expiry;

    public IssuedToken(String accessToken, String tokenType, String refreshToken, Instant expiry) {
        this.accessToken = accessToken;
        this.tokenType = tokenType;
        this.refreshToken = refreshToken;
        this.expiry = expiry;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getTokenType() {
        return tokenType;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public Instant getExpiry() {
        return expiry;
    }

    /**
     * Whether the token expires within {@code margin} of {@code now}.
     */
    public boolean expiresWithin(Duration margin, Instant now) {
        return !now.plus(margin).isBefore(expiry);
    }
}
