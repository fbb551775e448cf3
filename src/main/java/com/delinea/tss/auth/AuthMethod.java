package com.delinea.tss.auth;

/**
 * Supported ways of authenticating to Secret Server. A static token is not a method of its
 * own: it bypasses the grant flows entirely.
 *
 * @see GrantFlow
 */
public enum AuthMethod {

    /**
     * OAuth2 resource-owner password grant against Secret Server or Secret Server Cloud.
     */
    PASSWORD("password"),

    /**
     * OAuth2 client-credentials grant against the Platform, followed by vault discovery.
     */
    CLIENT_CREDENTIALS("client_credentials"),

    /**
     * Windows-integrated authentication with the current user's logon session.
     */
    NTLM("ntlm");

    private final String value;

    AuthMethod(String value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return value;
    }
}
