package com.delinea.tss.auth;

/**
 * The current platform lacks an operating system service that the requested
 * authentication mechanism depends on.
 */
public class UnsupportedCapabilityException extends TssException {

    public UnsupportedCapabilityException(String message) {
        super(message, 0, AuthStage.NTLM_HANDSHAKE);
    }

    public UnsupportedCapabilityException(String message, Throwable cause) {
        super(message, 0, AuthStage.NTLM_HANDSHAKE, cause);
    }
}
