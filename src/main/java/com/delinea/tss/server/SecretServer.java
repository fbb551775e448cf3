package com.delinea.tss.server;

import com.delinea.tss.auth.AuthStage;
import com.delinea.tss.auth.InMemoryTokenCache;
import com.delinea.tss.auth.JsonUtil;
import com.delinea.tss.auth.Preconditions;
import com.delinea.tss.auth.TokenCache;
import com.delinea.tss.auth.TokenSource;
import com.delinea.tss.auth.TssException;
import com.delinea.tss.auth.TssHttpClient;
import com.delinea.tss.auth.TssResponse;
import java.io.IOException;
import java.net.http.HttpRequest;
import java.security.GeneralSecurityException;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticated access to the REST resources of Secret Server, Secret Server Cloud or a vault
 * behind the Platform.
 *
 * <p>Every call obtains a bearer token from a {@link TokenSource}, which detects the deployment
 * and caches tokens per backend. When the Platform pins a vault, resource URLs follow it. A
 * 401 or 403 response clears the token that was rejected so the next call authenticates again;
 * the failed call itself is not retried.
 */
public class SecretServer {

    private static final Logger logger = LoggerFactory.getLogger(SecretServer.class);

    static final String SECRETS_RESOURCE = "secrets";
    static final String TEMPLATES_RESOURCE = "secret-templates";
    static final Set<String> RESOURCES = Set.of(SECRETS_RESOURCE, TEMPLATES_RESOURCE);

    private final Configuration config;
    private final TssHttpClient http;
    private final TokenSource tokenSource;
    private final String identity;

    /**
     * Creates a client with its own HTTP client and the process-wide token cache.
     *
     * @throws IllegalArgumentException if the configuration is invalid
     * @throws GeneralSecurityException if the TLS configuration cannot be loaded
     * @throws IOException              if a certificate file cannot be read
     */
    public SecretServer(Configuration config) throws GeneralSecurityException, IOException {
        this(validated(config), new TssHttpClient(config.sslContext(), config.getRequestTimeout()),
                InMemoryTokenCache.shared());
    }

    /**
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public SecretServer(Configuration config, TssHttpClient http, TokenCache cache) {
        this(validated(config), http, TokenSource.create(http, cache, config.getTokenPath()));
    }

    SecretServer(Configuration config, TssHttpClient http, TokenSource tokenSource) {
        this.config = config;
        this.http = http;
        this.tokenSource = tokenSource;
        this.identity = config.backendIdentity();
    }

    private static Configuration validated(Configuration config) {
        config.validate();
        return config;
    }

    /**
     * Fetches a secret by ID.
     */
    public Map<String, Object> secret(int id) throws TssException {
        return accessResource("GET", SECRETS_RESOURCE, String.valueOf(id), null);
    }

    /**
     * Fetches a secret template by ID.
     */
    public Map<String, Object> secretTemplate(int id) throws TssException {
        return accessResource("GET", TEMPLATES_RESOURCE, String.valueOf(id), null);
    }

    /**
     * A bearer token for the configured backend, from the cache when possible.
     */
    public String accessToken() throws TssException {
        return tokenSource.acquireToken(config.getCredentials(), identity);
    }

    /**
     * The URL of {@code resource/path} on the effective backend.
     */
    public String urlFor(String resource, String path) {
        String root = TssHttpClient.join(tokenSource.effectiveBaseUrl(identity), config.getApiPath());
        String target = TssHttpClient.join(root, resource);
        String trimmed = Preconditions.trimSlashes(path);
        return trimmed.isEmpty() ? target : TssHttpClient.join(target, trimmed);
    }

    /**
     * Sends an authenticated request to a resource.
     *
     * @param method   HTTP method
     * @param resource {@code secrets} or {@code secret-templates}
     * @param path     path below the resource, e.g. the ID
     * @param body     JSON request body, or null for none
     * @return the parsed response object; empty if the response has no body
     * @throws IllegalArgumentException if the resource is unknown
     * @throws TssException             if authentication or the request fails
     */
    public Map<String, Object> accessResource(String method, String resource, String path,
                                              Map<String, ?> body) throws TssException {
        if (!RESOURCES.contains(resource)) {
            throw new IllegalArgumentException("Unknown resource '" + resource + "', expected one of "
                    + RESOURCES);
        }

        String token = accessToken();
        String url = urlFor(resource, path);

        HttpRequest.Builder builder = http.newRequest(url)
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/json");
        if (body != null) {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(JsonUtil.toJson(body)));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        TssResponse response = http.send(builder.build(), AuthStage.API_REQUEST);
        int status = response.getStatus();

        if (!response.isSuccess()) {
            TssException failure = TssException.fromResponse(status, response.getBody(),
                    AuthStage.API_REQUEST);
            if (failure.isAuthorizationFailure()) {
                tokenSource.invalidate(identity, token);
                logger.error("{} {} was rejected with status {}; cleared the cached token for {}",
                        method, url, status, identity);
            }
            throw failure;
        }

        if (Preconditions.isBlank(response.getBody())) {
            return Collections.emptyMap();
        }
        Map<String, Object> json = response.getJson();
        if (json == null) {
            throw new TssException("Response from " + url + " is not a JSON object", status,
                    AuthStage.API_REQUEST);
        }
        return json;
    }

    public Configuration getConfiguration() {
        return config;
    }

    TokenSource getTokenSource() {
        return tokenSource;
    }
}
