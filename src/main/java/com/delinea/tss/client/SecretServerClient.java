package com.delinea.tss.client;

import com.delinea.tss.auth.AuthMethod;
import com.delinea.tss.auth.AuthStage;
import com.delinea.tss.auth.Credentials;
import com.delinea.tss.auth.PasswordGrantFlow;
import com.delinea.tss.auth.Preconditions;
import com.delinea.tss.auth.RequestSender;
import com.delinea.tss.auth.TssException;
import com.delinea.tss.auth.TssHttpClient;
import com.delinea.tss.auth.TssResponse;
import com.delinea.tss.auth.ntlm.ChallengeResponseProvider;
import com.delinea.tss.auth.ntlm.NtlmAuthenticator;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST client for a single Secret Server instance whose topology is known up front.
 *
 * <p>Unlike {@link com.delinea.tss.server.SecretServer} it never probes the deployment: requests
 * go to {@code {baseUrl}/api/v1}, authenticated either with a password grant whose token is
 * reused until shortly before it expires, or with NTLM as the current Windows user.
 *
 * <pre>{@code
 * SecretServerClient client = SecretServerClient.builder("https://ss.example.com/SecretServer")
 *     .withPasswordAuth("svc-reader", password)
 *     .build();
 * Map<String, Object> secret = client.secret(42);
 * }</pre>
 */
public class SecretServerClient {

    private static final Logger logger = LoggerFactory.getLogger(SecretServerClient.class);

    static final String API_PATH = "api/v1";
    static final String SECRETS_RESOURCE = "secrets";

    private final String baseUrl;
    private final TssHttpClient http;
    private final RequestSender sender;
    private final AuthMethod authMethod;

    private SecretServerClient(String baseUrl, TssHttpClient http, RequestSender sender,
                               AuthMethod authMethod) {
        this.baseUrl = baseUrl;
        this.http = http;
        this.sender = sender;
        this.authMethod = authMethod;
    }

    public static Builder builder(String baseUrl) {
        return new Builder(baseUrl);
    }

    /**
     * Fetches a secret by ID.
     */
    public Map<String, Object> secret(int id) throws TssException {
        return get(SECRETS_RESOURCE + "/" + id);
    }

    /**
     * GETs a path under {@code /api/v1} and parses the JSON object it returns.
     *
     * @param resourcePath path relative to the REST root, e.g. {@code secrets/42}
     * @return the response object
     * @throws TssException if the request fails, is rejected or does not return a JSON object
     */
    public Map<String, Object> get(String resourcePath) throws TssException {
        String url = TssHttpClient.join(TssHttpClient.join(baseUrl, API_PATH), resourcePath);
        HttpRequest request = http.newRequest(url)
                .header("Accept", "application/json")
                .GET()
                .build();

        TssResponse response = sender.send(request, AuthStage.API_REQUEST);
        if (!response.isSuccess()) {
            throw TssException.fromResponse(response.getStatus(), response.getBody(), AuthStage.API_REQUEST);
        }

        Map<String, Object> json = response.getJson();
        if (json == null) {
            throw new TssException("Response from " + url + " is not a JSON object",
                    response.getStatus(), AuthStage.API_REQUEST);
        }
        return json;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public AuthMethod getAuthMethod() {
        return authMethod;
    }

    public static final class Builder {
        private final String baseUrl;
        private TssHttpClient http;
        private String tokenPath = PasswordGrantFlow.DEFAULT_TOKEN_PATH;
        private Credentials credentials;
        private ChallengeResponseProvider ntlmProvider;
        private AuthMethod authMethod;

        private Builder(String baseUrl) {
            this.baseUrl = Preconditions.requireNonBlank(baseUrl, "Base URL");
        }

        public Builder httpClient(TssHttpClient http) {
            this.http = http;
            return this;
        }

        public Builder tokenPath(String tokenPath) {
            this.tokenPath = tokenPath;
            return this;
        }

        public Builder withPasswordAuth(String username, String password) {
            this.credentials = Credentials.password(username, password);
            this.authMethod = AuthMethod.PASSWORD;
            return this;
        }

        /**
         * Authenticates as the current Windows user.
         */
        public Builder withNtlmAuth() {
            return withNtlmAuth(ChallengeResponseProvider.forCurrentPlatform());
        }

        public Builder withNtlmAuth(ChallengeResponseProvider provider) {
            this.ntlmProvider = provider;
            this.authMethod = AuthMethod.NTLM;
            return this;
        }

        /**
         * @throws IllegalArgumentException if no authentication method was chosen
         */
        public SecretServerClient build() {
            if (authMethod == null) {
                throw new IllegalArgumentException(
                        "Choose an authentication method: withPasswordAuth or withNtlmAuth");
            }
            TssHttpClient client = http != null ? http : new TssHttpClient();
            RequestSender transport = RequestSender.of(client);

            RequestSender sender;
            if (authMethod == AuthMethod.NTLM) {
                sender = new NtlmAuthenticator(transport, ntlmProvider);
            } else {
                TokenSupplier tokens = new ReusingTokenSource(
                        new PasswordTokenSource(client, baseUrl, tokenPath, credentials,
                                Clock.systemUTC()));
                sender = new BearerAuthSender(tokens, transport);
            }
            logger.debug("Created Secret Server client for {} using {} authentication", baseUrl, authMethod);
            return new SecretServerClient(baseUrl, client, sender, authMethod);
        }
    }
}
