package com.delinea.tss.auth;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AuthMethodTest {

    @Test
    void toString_returnsLoggedName() {
        assertThat(AuthMethod.PASSWORD.toString()).isEqualTo("password");
        assertThat(AuthMethod.CLIENT_CREDENTIALS.toString()).isEqualTo("client_credentials");
        assertThat(AuthMethod.NTLM.toString()).isEqualTo("ntlm");
    }

    @Test
    void grantFlows_reportTheirMethod() {
        TssHttpClient client = new TssHttpClient();

        assertThat(new PasswordGrantFlow(client, null).getAuthMethod()).isEqualTo(AuthMethod.PASSWORD);
        assertThat(new ClientCredentialsGrantFlow(client).getAuthMethod())
                .isEqualTo(AuthMethod.CLIENT_CREDENTIALS);
    }
}
