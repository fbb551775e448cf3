package com.delinea.tss.auth;

/**
 * The parsed body of a successful OAuth2 token response.
 *
 * <pre>{@code
 * {
 *   "access_token": "...",
 *   "refresh_token": "...",
 *   "token_type": "bearer",
 *   "expires_in": 1199
 * }
 * }</pre>
 *
 * <p>Grants obtained from the Platform also carry the URL of the vault selected for them.
 */
public final class TokenGrant {

    private final String accessToken;
    private final String refreshToken;
    private final String tokenType;
    private final long expiresIn;
    private final String serverUrl;

    public TokenGrant(String accessToken, String refreshToken, String tokenType, long expiresIn) {
        this(accessToken, refreshToken, tokenType, expiresIn, null);
    }

    private TokenGrant(String accessToken, String refreshToken, String tokenType, long expiresIn,
                       String serverUrl) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.tokenType = tokenType;
        this.expiresIn = expiresIn;
        this.serverUrl = serverUrl;
    }

    /**
     * Reads a grant from a token endpoint response.
     *
     * <p>Non-2xx responses are reported with the OAuth {@code error} field when the body has
     * one. A 2xx body without {@code access_token} is rejected as malformed.
     *
     * @param response the token endpoint response
     * @return the grant
     * @throws AuthenticationException if the grant was refused or cannot be read
     */
    public static TokenGrant fromResponse(TssResponse response) throws AuthenticationException {
        int status = response.getStatus();
        if (!response.isSuccess()) {
            String error = response.getString("error");
            if (error == null) {
                throw new AuthenticationException(
                        "Received non-200 response during token grant (status " + status + ")", status);
            }
            throw new AuthenticationException("Error getting token: " + error, status);
        }

        if (response.getJson() == null) {
            throw new AuthenticationException("Token response is not a JSON object", status);
        }
        String accessToken = response.getString("access_token");
        if (Preconditions.isBlank(accessToken)) {
            throw new AuthenticationException("Token response missing 'access_token'", status);
        }

        return new TokenGrant(accessToken,
                response.getString("refresh_token"),
                response.getString("token_type"),
                response.getLong("expires_in", 0));
    }

    /**
     * Returns a copy of this grant bound to the given backend URL.
     */
    public TokenGrant withServerUrl(String url) {
        return new TokenGrant(accessToken, refreshToken, tokenType, expiresIn, url);
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public String getTokenType() {
        return tokenType;
    }

    public long getExpiresIn() {
        return expiresIn;
    }

    /**
     * The vault URL that subsequent requests must target, or null when the grant was issued
     * by the backend that will also serve the requests.
     */
    public String getServerUrl() {
        return serverUrl;
    }
}
