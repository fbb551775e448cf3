package com.delinea.tss.client;

import com.delinea.tss.auth.AuthStage;
import com.delinea.tss.auth.RequestSender;
import com.delinea.tss.auth.TssException;
import com.delinea.tss.auth.TssResponse;
import java.net.http.HttpRequest;

/**
 * Sets {@code Authorization: Bearer <token>} on each request and forwards it.
 */
public class BearerAuthSender implements RequestSender {

    private final TokenSupplier tokens;
    private final RequestSender transport;

    public BearerAuthSender(TokenSupplier tokens, RequestSender transport) {
        this.tokens = tokens;
        this.transport = transport;
    }

    @Override
    public TssResponse send(HttpRequest request, AuthStage stage) throws TssException {
        IssuedToken token = tokens.token();
        HttpRequest authenticated = HttpRequest.newBuilder(request,
                        (name, value) -> !"Authorization".equalsIgnoreCase(name))
                .header("Authorization", "Bearer " + token.getAccessToken())
                .build();
        return transport.send(authenticated, stage);
    }
}
