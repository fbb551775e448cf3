package com.delinea.tss.auth.ntlm;

import com.delinea.tss.auth.AuthStage;
import com.delinea.tss.auth.RequestSender;
import com.delinea.tss.auth.TssException;
import com.delinea.tss.auth.TssHttpClient;
import com.delinea.tss.auth.TssResponse;
import com.delinea.tss.auth.UnsupportedCapabilityException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpRequest;
import java.util.Base64;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request sender that authenticates every request with the current Windows user through an
 * NTLM handshake.
 *
 * <h2>Handshake</h2>
 * <ol>
 *   <li><b>Probe</b>: unauthenticated GET of the target URL. The server must answer 401 and
 *       offer {@code WWW-Authenticate: NTLM}.</li>
 *   <li><b>Negotiate</b>: GET with {@code Authorization: NTLM <type-1>}. The answer must carry
 *       exactly one {@code WWW-Authenticate: NTLM <type-2>} header.</li>
 *   <li><b>Authenticate</b>: the original request is sent with
 *       {@code Authorization: NTLM <type-3>}; its response is returned.</li>
 * </ol>
 *
 * <p>The legs run in order on the caller's thread. A shape violation in any leg raises
 * {@link NtlmProtocolException}; the context is discarded and the next request starts over.
 *
 * <p>Windows-authenticated REST calls are served under {@code /winauthwebservices/api/v1}
 * instead of {@code /api/v1}; request paths are rewritten before the probe.
 */
public class NtlmAuthenticator implements RequestSender {

    private static final Logger logger = LoggerFactory.getLogger(NtlmAuthenticator.class);

    static final String HEADER_WWW_AUTHENTICATE = "WWW-Authenticate";
    static final String HEADER_AUTHORIZATION = "Authorization";
    static final String SCHEME = "NTLM";
    static final String SCHEME_PREFIX = SCHEME + " ";

    static final String REST_PATH_PREFIX = "/api/v1";
    static final String NTLM_PATH_PREFIX = "/winauthwebservices/api/v1";

    private final RequestSender transport;
    private final ChallengeResponseProvider provider;

    /**
     * Creates an authenticator for the running platform.
     */
    public NtlmAuthenticator(TssHttpClient client) {
        this(RequestSender.of(client), ChallengeResponseProvider.forCurrentPlatform());
    }

    /**
     * @param transport sender used for all three legs
     * @param provider  source of NTLM messages
     */
    public NtlmAuthenticator(RequestSender transport, ChallengeResponseProvider provider) {
        this.transport = transport;
        this.provider = provider;
    }

    /**
     * Sends {@code original} after authenticating with NTLM.
     *
     * @param original the request to authenticate; its path is rewritten to the Windows
     *                 authentication surface
     * @param stage    stage reported for failures of the final request
     * @return the response to the authenticated request
     * @throws UnsupportedCapabilityException if the platform cannot compute NTLM messages
     * @throws NtlmProtocolException          if the server deviates from the handshake
     */
    @Override
    public TssResponse send(HttpRequest original, AuthStage stage) throws TssException {
        if (!provider.isSupported()) {
            throw new UnsupportedCapabilityException("NTLM authentication requires the Windows "
                    + "security service, which is not available on " + System.getProperty("os.name"));
        }

        URI target = rewritePath(original.uri());
        HttpRequest request = HttpRequest.newBuilder(original, (name, value) -> true)
                .uri(target)
                .build();

        probe(request);

        try (NtlmContext context = provider.newContext()) {
            byte[] negotiate = context.negotiateMessage();
            byte[] challenge = requestChallenge(request, negotiate);
            byte[] authenticate = context.authenticateMessage(challenge);

            HttpRequest authenticated = HttpRequest.newBuilder(request,
                            (name, value) -> !HEADER_AUTHORIZATION.equalsIgnoreCase(name))
                    .header(HEADER_AUTHORIZATION, SCHEME_PREFIX + encode(authenticate))
                    .build();

            logger.debug("NTLM handshake complete, sending {} {}", request.method(), target);
            return transport.send(authenticated, stage);
        }
    }

    private void probe(HttpRequest request) throws TssException {
        TssResponse response = transport.send(handshakeRequest(request).build(), AuthStage.NTLM_HANDSHAKE);
        if (response.getStatus() != 401) {
            throw new NtlmProtocolException("Expected 401 from NTLM probe of " + request.uri()
                    + " but got " + response.getStatus(), response.getStatus());
        }
        if (!offersNtlm(response.getHeaders(HEADER_WWW_AUTHENTICATE))) {
            throw new NtlmProtocolException("Server at " + request.uri()
                    + " does not offer NTLM authentication", response.getStatus());
        }
    }

    private byte[] requestChallenge(HttpRequest request, byte[] negotiate) throws TssException {
        HttpRequest negotiateRequest = handshakeRequest(request)
                .header(HEADER_AUTHORIZATION, SCHEME_PREFIX + encode(negotiate))
                .build();
        TssResponse response = transport.send(negotiateRequest, AuthStage.NTLM_HANDSHAKE);
        return parseChallenge(response.getHeaders(HEADER_WWW_AUTHENTICATE), response.getStatus());
    }

    private static HttpRequest.Builder handshakeRequest(HttpRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri()).GET();
        request.timeout().ifPresent(builder::timeout);
        return builder;
    }

    /**
     * Whether any {@code WWW-Authenticate} value of the probe response names the NTLM scheme.
     */
    static boolean offersNtlm(List<String> challenges) {
        for (String challenge : challenges) {
            if (challenge != null && challenge.trim().equalsIgnoreCase(SCHEME)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Extracts the Type-2 message from the negotiate leg's {@code WWW-Authenticate} headers.
     *
     * @throws NtlmProtocolException unless there is exactly one header of the form
     *                               {@code NTLM <base64>}
     */
    static byte[] parseChallenge(List<String> headers, int status) throws NtlmProtocolException {
        if (headers.size() != 1) {
            throw new NtlmProtocolException("Expected exactly one " + HEADER_WWW_AUTHENTICATE
                    + " header with the NTLM challenge, got " + headers.size(), status);
        }
        String header = headers.get(0);
        if (header.length() < 6 || !header.startsWith(SCHEME_PREFIX)) {
            throw new NtlmProtocolException("Malformed NTLM challenge header: '" + header + "'", status);
        }
        byte[] challenge;
        try {
            challenge = Base64.getDecoder().decode(header.substring(SCHEME_PREFIX.length()).trim());
        } catch (IllegalArgumentException e) {
            throw new NtlmProtocolException("NTLM challenge is not valid base64", status, e);
        }
        if (challenge.length == 0) {
            throw new NtlmProtocolException("NTLM challenge is empty", status);
        }
        return challenge;
    }

    /**
     * Moves a REST path onto the Windows authentication surface:
     * {@code /SecretServer/api/v1/secrets/1} becomes
     * {@code /SecretServer/winauthwebservices/api/v1/secrets/1}. Other paths are unchanged.
     */
    static URI rewritePath(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.contains(NTLM_PATH_PREFIX)) {
            return uri;
        }
        int index = path.indexOf(REST_PATH_PREFIX);
        while (index >= 0) {
            int end = index + REST_PATH_PREFIX.length();
            if (end == path.length() || path.charAt(end) == '/') {
                String rewritten = path.substring(0, index) + NTLM_PATH_PREFIX + path.substring(end);
                return withRawPath(uri, rewritten);
            }
            index = path.indexOf(REST_PATH_PREFIX, index + 1);
        }
        return uri;
    }

    private static URI withRawPath(URI uri, String rawPath) {
        StringBuilder sb = new StringBuilder();
        sb.append(uri.getScheme()).append("://").append(uri.getRawAuthority()).append(rawPath);
        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        try {
            return new URI(sb.toString());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Cannot rewrite " + uri + " for NTLM", e);
        }
    }

    private static String encode(byte[] message) {
        return Base64.getEncoder().encodeToString(message);
    }
}
