package com.delinea.tss.auth;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TokenCache} backed by a {@link ConcurrentHashMap}.
 *
 * <p>Each instance is independent. {@link #shared()} returns a process-wide instance for
 * callers that want several clients of the same backend to reuse one token.
 */
public class InMemoryTokenCache implements TokenCache {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTokenCache.class);

    private static final InMemoryTokenCache SHARED = new InMemoryTokenCache();

    private final ConcurrentHashMap<String, CachedToken> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTokenCache() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a cache that reads time from {@code clock} (for testing).
     */
    public InMemoryTokenCache(Clock clock) {
        this.clock = clock;
    }

    public static InMemoryTokenCache shared() {
        return SHARED;
    }

    @Override
    public Optional<CachedToken> get(String key) {
        CachedToken entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            // only remove the entry we looked at, a concurrent put may have replaced it
            if (entries.remove(key, entry)) {
                logger.debug("Cached token for {} expired at {}, removed", key, entry.getExpiresAt());
            }
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public CachedToken put(String key, String accessToken, long expiresInSeconds, String serverUrl) {
        Instant now = clock.instant();
        CachedToken entry = CachedToken.issue(accessToken, expiresInSeconds, serverUrl, now);
        entries.put(key, entry);
        logger.debug("Cached token for {} until {}", key, entry.getExpiresAt());
        return entry;
    }

    @Override
    public Lock lockFor(String key) {
        return locks.computeIfAbsent(key, k -> new ReentrantLock());
    }

    @Override
    public void clear(String key) {
        entries.remove(key);
    }

    @Override
    public boolean clearIfMatches(String key, String accessToken) {
        CachedToken entry = entries.get(key);
        if (entry == null || !entry.getAccessToken().equals(accessToken)) {
            return false;
        }
        return entries.remove(key, entry);
    }

    /**
     * Number of stored entries, expired ones included.
     */
    public int size() {
        return entries.size();
    }
}
