package com.delinea.tss.auth;

/**
 * A token endpoint rejected the grant or answered with a body that is not a usable grant.
 */
public class AuthenticationException extends TssException {

    public AuthenticationException(String message, int httpStatusCode) {
        super(message, httpStatusCode, AuthStage.TOKEN_GRANT);
    }

    public AuthenticationException(String message, int httpStatusCode, Throwable cause) {
        super(message, httpStatusCode, AuthStage.TOKEN_GRANT, cause);
    }
}
