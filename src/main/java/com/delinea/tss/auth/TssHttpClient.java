package com.delinea.tss.auth;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.net.ssl.SSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around {@link HttpClient} for the Secret Server and Platform endpoints used
 * during authentication.
 *
 * <p>This class handles:
 * <ul>
 *   <li>Unauthenticated GETs (health probes) and bearer-authenticated GETs</li>
 *   <li>Form-encoded token grants (password and client credentials)</li>
 *   <li>A bounded request timeout on every call</li>
 *   <li>Mapping transport failures to {@link TssConnectionException}</li>
 * </ul>
 *
 * <p>URLs are absolute because the target backend may change once a Platform vault is pinned.
 * The client is designed to be injectable/mockable for unit testing.
 */
public class TssHttpClient {

    private static final Logger logger = LoggerFactory.getLogger(TssHttpClient.class);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    static final String HEADER_AUTHORIZATION = "Authorization";
    static final String CONTENT_TYPE_FORM = "application/x-www-form-urlencoded";

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    /**
     * Creates a client with default timeouts and the default trust store.
     */
    public TssHttpClient() {
        this((SSLContext) null, DEFAULT_REQUEST_TIMEOUT);
    }

    /**
     * Creates a client with custom TLS configuration.
     *
     * @param sslContext     custom SSL context, or null for the JVM default
     * @param requestTimeout timeout for individual requests, or null for the default
     */
    public TssHttpClient(SSLContext sslContext, Duration requestTimeout) {
        this(buildHttpClient(sslContext), requestTimeout);
    }

    /**
     * Creates a client around an injected HttpClient (for testing).
     *
     * @param httpClient     the HTTP client to use
     * @param requestTimeout timeout for individual requests, or null for the default
     */
    public TssHttpClient(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT;
    }

    /**
     * Builds the JDK client used by default: HTTP/1.1 so NTLM legs can share a connection.
     */
    public static HttpClient buildHttpClient(SSLContext sslContext) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL);

        if (sslContext != null) {
            builder.sslContext(sslContext);
        }

        return builder.build();
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * Starts a request to {@code url} with the request timeout applied.
     */
    public HttpRequest.Builder newRequest(String url) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout);
    }

    /**
     * Unauthenticated GET. The response is returned whatever its status.
     */
    public TssResponse fetch(String url, AuthStage stage) throws TssConnectionException {
        return send(newRequest(url).GET().build(), stage);
    }

    /**
     * Bearer-authenticated GET.
     *
     * @throws TssException with the response status if the backend answers 4xx or 5xx
     */
    public TssResponse get(String url, String bearerToken, AuthStage stage) throws TssException {
        HttpRequest request = newRequest(url)
                .header(HEADER_AUTHORIZATION, "Bearer " + bearerToken)
                .GET()
                .build();
        TssResponse response = send(request, stage);
        if (response.getStatus() >= 400) {
            throw TssException.fromResponse(response.getStatus(), response.getBody(), stage);
        }
        return response;
    }

    /**
     * Form-encoded POST. The response is returned whatever its status.
     */
    public TssResponse postForm(String url, Map<String, String> form, AuthStage stage)
            throws TssConnectionException {
        HttpRequest request = newRequest(url)
                .header("Content-Type", CONTENT_TYPE_FORM)
                .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form)))
                .build();
        return send(request, stage);
    }

    /**
     * Sends a prepared request. The response is returned whatever its status.
     *
     * @throws TssConnectionException if no response was received
     */
    public TssResponse send(HttpRequest request, AuthStage stage) throws TssConnectionException {
        logger.debug("Request: {} {}", request.method(), request.uri());

        try {
            HttpResponse<String> response = httpClient.send(
                    request, HttpResponse.BodyHandlers.ofString());

            String body = response.body();
            logger.debug("Response: {} ({})", response.statusCode(),
                    body != null ? body.length() + " bytes" : "empty");

            return new TssResponse(response.statusCode(), body, response.headers());

        } catch (IOException e) {
            throw new TssConnectionException("Connection to " + request.uri() + " failed: "
                    + e.getMessage(), stage, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TssConnectionException("Request to " + request.uri() + " interrupted",
                    stage, e);
        }
    }

    /**
     * Resource-owner password grant against {@code tokenUrl}.
     *
     * @param tokenUrl    absolute token endpoint URL
     * @param credentials username, password and optional domain
     * @return the grant
     * @throws AuthenticationException if the grant is refused or malformed
     */
    public TokenGrant passwordGrant(String tokenUrl, Credentials credentials) throws TssException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("username", credentials.getUsername());
        form.put("password", credentials.getPassword());
        form.put("grant_type", "password");
        if (credentials.getDomain() != null) {
            form.put("domain", credentials.getDomain());
        }
        return TokenGrant.fromResponse(postForm(tokenUrl, form, AuthStage.TOKEN_GRANT));
    }

    /**
     * Client-credentials grant against {@code tokenUrl}.
     *
     * @return the grant
     * @throws AuthenticationException if the grant is refused or malformed
     */
    public TokenGrant clientCredentialsGrant(String tokenUrl, String clientId, String clientSecret,
                                             String scope) throws TssException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "client_credentials");
        form.put("client_id", clientId);
        form.put("client_secret", clientSecret);
        form.put("scope", scope);
        return TokenGrant.fromResponse(postForm(tokenUrl, form, AuthStage.TOKEN_GRANT));
    }

    static String encodeForm(Map<String, String> form) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : form.entrySet()) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    /**
     * Joins a base URL and a path with exactly one slash between them.
     */
    public static String join(String baseUrl, String path) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/" + Preconditions.trimSlashes(path);
    }
}
