package com.delinea.tss.auth.ntlm;

import com.delinea.tss.auth.AuthStage;
import com.delinea.tss.auth.TssException;

/**
 * The server's answer to an NTLM handshake leg did not have the required shape.
 *
 * <p>The handshake is abandoned; nothing from it is reused by a later attempt.
 */
public class NtlmProtocolException extends TssException {

    public NtlmProtocolException(String message, int httpStatusCode) {
        super(message, httpStatusCode, AuthStage.NTLM_HANDSHAKE);
    }

    public NtlmProtocolException(String message, int httpStatusCode, Throwable cause) {
        super(message, httpStatusCode, AuthStage.NTLM_HANDSHAKE, cause);
    }
}
