package com.delinea.tss.auth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * Store of bearer tokens keyed by backend identity.
 *
 * <p>Implementations must be safe for concurrent use. Entries whose expiry has passed are
 * never returned: a read that finds one removes it and reports a miss.
 *
 * <p>Invalidation is lazy. A 401 or 403 from an authenticated call clears the entry so that
 * the <em>next</em> acquisition performs a fresh grant; the failed call is not retried.
 *
 * @see InMemoryTokenCache
 */
public interface TokenCache {

    /**
     * Builds the cache key for a backend base URL.
     *
     * @param backendIdentity the configured server URL or the cloud tenant URL
     * @return the URL-escaped key
     */
    static String keyFor(String backendIdentity) {
        return "SS_AT_" + URLEncoder.encode(backendIdentity, StandardCharsets.UTF_8);
    }

    /**
     * Returns the unexpired token stored under {@code key}.
     *
     * @param key the cache key
     * @return the token, or empty if absent or expired (an expired entry is also removed)
     */
    Optional<CachedToken> get(String key);

    /**
     * Stores a token, replacing any existing entry, with expiry computed by
     * {@link CachedToken#issue(String, long, java.time.Instant)}.
     *
     * @param key              the cache key
     * @param accessToken      the bearer token
     * @param expiresInSeconds the granted lifetime
     * @return the stored entry
     */
    default CachedToken put(String key, String accessToken, long expiresInSeconds) {
        return put(key, accessToken, expiresInSeconds, null);
    }

    /**
     * Stores a token together with the vault it was pinned to, replacing any existing entry.
     *
     * @param serverUrl the pinned vault URL, or null
     * @return the stored entry
     */
    CachedToken put(String key, String accessToken, long expiresInSeconds, String serverUrl);

    /**
     * The lock that serializes grants for {@code key}. Every caller sharing this cache gets
     * the same lock for the same key.
     */
    Lock lockFor(String key);

    /**
     * Removes the entry for {@code key} unconditionally.
     */
    void clear(String key);

    /**
     * Removes the entry for {@code key} only if it still holds {@code accessToken}.
     *
     * <p>Used after an authorization failure: if another caller has already stored a fresh
     * token, that token is kept.
     *
     * @return true if an entry was removed
     */
    boolean clearIfMatches(String key, String accessToken);
}
