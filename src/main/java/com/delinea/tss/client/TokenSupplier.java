package com.delinea.tss.client;

import com.delinea.tss.auth.TssException;

/**
 * Source of bearer tokens for {@link BearerAuthSender}.
 */
@FunctionalInterface
public interface TokenSupplier {

    /**
     * @return a token that is valid now
     * @throws TssException if no token can be obtained
     */
    IssuedToken token() throws TssException;
}
