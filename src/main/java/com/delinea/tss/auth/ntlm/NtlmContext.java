package com.delinea.tss.auth.ntlm;

import com.delinea.tss.auth.TssException;

/**
 * Client side of one NTLM exchange: produces the Type-1 negotiate message, then the Type-3
 * authenticate message for the server's Type-2 challenge.
 *
 * <p>A context serves a single request and must be closed afterwards.
 */
public interface NtlmContext extends AutoCloseable {

    /**
     * @return the Type-1 negotiate message
     * @throws TssException if the security service cannot produce it
     */
    byte[] negotiateMessage() throws TssException;

    /**
     * @param challenge the decoded Type-2 challenge
     * @return the Type-3 authenticate message
     * @throws TssException if the challenge is rejected by the security service
     */
    byte[] authenticateMessage(byte[] challenge) throws TssException;

    /**
     * Releases the security context and credentials handle.
     */
    @Override
    void close();
}
