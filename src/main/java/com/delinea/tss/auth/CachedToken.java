package com.delinea.tss.auth;

import java.time.Instant;

/**
 * A bearer token held by a {@link TokenCache} together with its early-refresh expiry.
 *
 * <p>The expiry is pulled forward by 10% of the granted lifetime (rounded down), so a token
 * granted for 100 seconds is treated as expired after 90.
 *
 * <p>A token granted by the Platform also carries the URL of the vault it was pinned to, so
 * every client that shares the cache sends its requests to the same vault.
 */
public final class CachedToken {

    private final String accessToken;
    private final Instant issuedAt;
    private final Instant expiresAt;
    private final String serverUrl;

    private CachedToken(String accessToken, Instant issuedAt, Instant expiresAt, String serverUrl) {
        this.accessToken = accessToken;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
        this.serverUrl = serverUrl;
    }

    /**
     * Creates a cached token issued at {@code issuedAt} and valid for {@code expiresInSeconds}.
     *
     * @param accessToken      the bearer token
     * @param expiresInSeconds the {@code expires_in} value of the grant
     * @param issuedAt         when the grant was received
     * @return the cached token
     */
    public static CachedToken issue(String accessToken, long expiresInSeconds, Instant issuedAt) {
        return issue(accessToken, expiresInSeconds, null, issuedAt);
    }

    /**
     * Creates a cached token bound to the vault at {@code serverUrl}.
     *
     * @param serverUrl the pinned vault URL, or null when requests go to the configured backend
     */
    public static CachedToken issue(String accessToken, long expiresInSeconds, String serverUrl,
                                    Instant issuedAt) {
        Preconditions.requireNonBlank(accessToken, "Access token");
        return new CachedToken(accessToken, issuedAt,
                issuedAt.plusSeconds(effectiveLifetime(expiresInSeconds)), serverUrl);
    }

    /**
     * Lifetime after the early-refresh margin: {@code expiresIn - floor(expiresIn * 0.1)}.
     */
    static long effectiveLifetime(long expiresInSeconds) {
        if (expiresInSeconds <= 0) {
            return 0;
        }
        return expiresInSeconds - (long) Math.floor(expiresInSeconds * 0.1);
    }

    public String getAccessToken() {
        return accessToken;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * The vault this token was pinned to, or null.
     */
    public String getServerUrl() {
        return serverUrl;
    }

    /**
     * Whether the token must no longer be handed out at {@code now}.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        // never print the token itself
        return "CachedToken{issuedAt=" + issuedAt + ", expiresAt=" + expiresAt
                + (serverUrl != null ? ", serverUrl=" + serverUrl : "") + '}';
    }
}
