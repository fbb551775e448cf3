package com.delinea.tss.auth;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The secret material used to obtain a bearer token.
 *
 * <p>Either a username and password (with an optional Active Directory domain) or a
 * pre-issued static token. A static token bypasses deployment detection, grants and caching.
 *
 * <p>On the Platform the username and password are used as the client ID and client secret
 * of an application account.
 */
public final class Credentials {

    private final String domain;
    private final String username;
    private final String password;
    private final String token;
    private final String tokenSource;

    private Credentials(String domain, String username, String password, String token,
                        String tokenSource) {
        this.domain = domain;
        this.username = username;
        this.password = password;
        this.token = token;
        this.tokenSource = tokenSource;
    }

    /**
     * Creates username/password credentials.
     *
     * @param username the user name or application client ID
     * @param password the password or client secret
     * @return the credentials
     * @throws IllegalArgumentException if either value is null or blank
     */
    public static Credentials password(String username, String password) {
        return password(null, username, password);
    }

    /**
     * Creates username/password credentials for a domain account.
     *
     * @param domain   the Active Directory domain, or null for a local account
     * @param username the user name
     * @param password the password
     * @return the credentials
     */
    public static Credentials password(String domain, String username, String password) {
        Preconditions.requireNonBlank(username, "Username");
        Preconditions.requireNonBlank(password, "Password");
        return new Credentials(Preconditions.isBlank(domain) ? null : domain,
                username, password, null, null);
    }

    /**
     * Creates credentials that present a pre-issued bearer token.
     *
     * @param token the bearer token
     * @return the credentials
     */
    public static Credentials token(String token) {
        return token(token, "configured value");
    }

    private static Credentials token(String token, String source) {
        Preconditions.requireNonBlank(token, "Token");
        return new Credentials(null, null, null, token, source);
    }

    /**
     * Creates static token credentials from an environment variable or a token file.
     *
     * <p>Resolution order:
     * <ol>
     *   <li>Environment variable (if envVarName is provided and set)</li>
     *   <li>Token file at the specified path, trimmed</li>
     * </ol>
     *
     * @param envVarName    environment variable name (e.g., "TSS_TOKEN"), or null to skip
     * @param tokenFilePath token file path, or null
     * @return the credentials
     * @throws SecurityException if no token source is available or the file is unusable
     */
    public static Credentials tokenFrom(String envVarName, String tokenFilePath) {
        if (!Preconditions.isBlank(envVarName)) {
            String envToken = System.getenv(envVarName);
            if (!Preconditions.isBlank(envToken)) {
                return token(envToken, envVarName + " environment variable");
            }
        }

        if (!Preconditions.isBlank(tokenFilePath)) {
            String fileToken;
            try {
                fileToken = Files.readString(Path.of(tokenFilePath)).trim();
            } catch (IOException e) {
                throw new SecurityException("Cannot read token file: " + tokenFilePath, e);
            }
            if (fileToken.isBlank()) {
                throw new SecurityException("Token file is empty: " + tokenFilePath);
            }
            return token(fileToken, "token file: " + tokenFilePath);
        }

        if (!Preconditions.isBlank(envVarName)) {
            throw new SecurityException("No token found. Set " + envVarName
                    + " environment variable or provide a token file path.");
        }
        throw new SecurityException("No token found. Provide a token file path.");
    }

    public boolean hasStaticToken() {
        return token != null;
    }

    public String getDomain() {
        return domain;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getToken() {
        return token;
    }

    /**
     * Where a static token came from (for logging), or null for username/password credentials.
     */
    public String getTokenSource() {
        return tokenSource;
    }

    @Override
    public String toString() {
        if (hasStaticToken()) {
            return "Credentials{token from " + tokenSource + '}';
        }
        return "Credentials{username='" + username + '\''
                + (domain != null ? ", domain='" + domain + '\'' : "") + '}';
    }
}
