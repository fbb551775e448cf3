package com.delinea.tss.auth;

/**
 * Transport-level failure: connection refused, TLS failure, timeout or interruption.
 *
 * <p>Always carries status code 0.
 */
public class TssConnectionException extends TssException {

    public TssConnectionException(String message, AuthStage stage, Throwable cause) {
        super(message, 0, stage, cause);
    }
}
