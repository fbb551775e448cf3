package com.delinea.tss.auth;

import java.net.http.HttpRequest;

/**
 * Sends a prepared request and returns the response whatever its status.
 *
 * <p>Authentication decorators (bearer token, NTLM) implement this interface around another
 * sender, ending with {@link #of(TssHttpClient)}.
 */
@FunctionalInterface
public interface RequestSender {

    /**
     * Sends {@code request}.
     *
     * @param request the request
     * @param stage   the stage reported if the call fails
     * @return the response
     * @throws TssException if no usable response was obtained
     */
    TssResponse send(HttpRequest request, AuthStage stage) throws TssException;

    /**
     * The plain transport: sends through {@code client} without adding credentials.
     */
    static RequestSender of(TssHttpClient client) {
        return client::send;
    }
}
