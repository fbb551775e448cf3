package com.delinea.tss.auth;

import java.util.Optional;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces bearer tokens for a backend whose deployment mode is not known in advance.
 *
 * <h2>Acquisition</h2>
 * <ol>
 *   <li>A static token is returned as is: no network call, no caching.</li>
 *   <li>A cached, unexpired token for the backend identity is returned.</li>
 *   <li>Otherwise the deployment mode is detected and the matching {@link GrantFlow} runs.
 *       A Platform grant also pins the resolved vault URL as the effective backend.</li>
 *   <li>The new token is cached under the backend identity, together with the pinned vault,
 *       and returned.</li>
 * </ol>
 *
 * <h2>Concurrency</h2>
 * <p>Steps 3 and 4 run under the cache's lock for the key, and the cache is checked again once
 * the lock is held, so concurrent misses for one backend produce a single grant request, also
 * across token sources that share the cache.
 * Invalidation after a 401/403 is compare-and-clear: a token stored by another caller after
 * the failing call was issued is kept.
 */
public class TokenSource {

    private static final Logger logger = LoggerFactory.getLogger(TokenSource.class);

    private final TokenCache cache;
    private final DeploymentModeDetector detector;
    private final GrantFlow secretServerFlow;
    private final GrantFlow platformFlow;

    /**
     * Creates a token source from explicit collaborators.
     *
     * @param cache            token store shared with whoever invalidates tokens
     * @param detector         deployment mode detector
     * @param secretServerFlow flow used for {@link DeploymentMode#ON_PREM_OR_CLOUD}
     * @param platformFlow     flow used for {@link DeploymentMode#PLATFORM}
     */
    public TokenSource(TokenCache cache, DeploymentModeDetector detector,
                       GrantFlow secretServerFlow, GrantFlow platformFlow) {
        this.cache = cache;
        this.detector = detector;
        this.secretServerFlow = secretServerFlow;
        this.platformFlow = platformFlow;
    }

    /**
     * Creates a token source with the standard detector and grant flows.
     *
     * @param client    HTTP client used for probes, grants and vault discovery
     * @param cache     token store
     * @param tokenPath Secret Server token endpoint path
     * @return the token source
     */
    public static TokenSource create(TssHttpClient client, TokenCache cache, String tokenPath) {
        return new TokenSource(cache,
                new DeploymentModeDetector(client),
                new PasswordGrantFlow(client, tokenPath),
                new ClientCredentialsGrantFlow(client));
    }

    /**
     * Returns a bearer token for {@code backendIdentity}.
     *
     * @param credentials     static token or username/password
     * @param backendIdentity the configured base URL, used as the cache key
     * @return the bearer token
     * @throws InvalidDeploymentException if neither health probe is healthy
     * @throws AuthenticationException    if the grant is refused or malformed
     * @throws NoVaultFoundException      if the Platform has no default active vault
     * @throws TssConnectionException     if a grant or discovery call gets no response
     */
    public String acquireToken(Credentials credentials, String backendIdentity) throws TssException {
        if (credentials.hasStaticToken()) {
            return credentials.getToken();
        }

        String key = TokenCache.keyFor(backendIdentity);
        Optional<CachedToken> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get().getAccessToken();
        }

        Lock lock = cache.lockFor(key);
        lock.lock();
        try {
            // another caller may have completed a grant while we waited
            cached = cache.get(key);
            if (cached.isPresent()) {
                logger.debug("Token for {} obtained by a concurrent caller", backendIdentity);
                return cached.get().getAccessToken();
            }
            return grant(credentials, backendIdentity, key);
        } finally {
            lock.unlock();
        }
    }

    private String grant(Credentials credentials, String backendIdentity, String key)
            throws TssException {
        DeploymentMode mode = detector.require(backendIdentity);
        GrantFlow flow = mode == DeploymentMode.PLATFORM ? platformFlow : secretServerFlow;
        logger.debug("Requesting {} grant from {} ({})", flow.getAuthMethod(), backendIdentity, mode);

        TokenGrant grant = flow.requestToken(backendIdentity, credentials);

        if (grant.getServerUrl() != null) {
            logger.info("Requests for {} now go to vault {}", backendIdentity, grant.getServerUrl());
        }

        cache.put(key, grant.getAccessToken(), grant.getExpiresIn(), grant.getServerUrl());
        return grant.getAccessToken();
    }

    /**
     * The base URL that resource requests for {@code backendIdentity} must target: the vault
     * pinned to the cached token, or the identity itself.
     */
    public String effectiveBaseUrl(String backendIdentity) {
        return cache.get(TokenCache.keyFor(backendIdentity))
                .map(CachedToken::getServerUrl)
                .orElse(backendIdentity);
    }

    /**
     * Drops {@code rejectedToken} from the cache after a 401 or 403, unless the entry has
     * already been replaced. The next {@link #acquireToken} then performs a fresh grant.
     *
     * @return true if the cached entry was removed
     */
    public boolean invalidate(String backendIdentity, String rejectedToken) {
        boolean cleared = cache.clearIfMatches(TokenCache.keyFor(backendIdentity), rejectedToken);
        if (cleared) {
            logger.debug("Cleared cached token for {}", backendIdentity);
        }
        return cleared;
    }

    /**
     * Unconditionally removes any cached token for {@code backendIdentity}.
     */
    public void clear(String backendIdentity) {
        cache.clear(TokenCache.keyFor(backendIdentity));
    }

    public TokenCache getCache() {
        return cache;
    }
}
