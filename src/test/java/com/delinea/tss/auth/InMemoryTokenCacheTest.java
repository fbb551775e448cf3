package com.delinea.tss.auth;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for InMemoryTokenCache.
 */
class InMemoryTokenCacheTest {

    private static final String KEY = TokenCache.keyFor("https://ss.example.com/SecretServer");

    private MutableClock clock;
    private InMemoryTokenCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        cache = new InMemoryTokenCache(clock);
    }

    @Test
    void keyFor_urlEncodesIdentity() {
        assertThat(TokenCache.keyFor("https://acme.secretservercloud.com/"))
                .isEqualTo("SS_AT_https%3A%2F%2Facme.secretservercloud.com%2F");
    }

    @Test
    void get_withNoEntry_returnsEmpty() {
        assertThat(cache.get(KEY)).isEmpty();
    }

    @Test
    void put_thenGet_returnsToken() {
        cache.put(KEY, "token-1", 1200);

        assertThat(cache.get(KEY)).hasValueSatisfying(
                t -> assertThat(t.getAccessToken()).isEqualTo("token-1"));
    }

    @Test
    void get_beforeEarlyExpiry_returnsToken() {
        cache.put(KEY, "token-1", 100);
        clock.advance(Duration.ofSeconds(89));

        assertThat(cache.get(KEY)).isPresent();
    }

    @Test
    void get_atEarlyExpiry_returnsEmptyAndPurges() {
        cache.put(KEY, "token-1", 100);
        clock.advance(Duration.ofSeconds(90));

        assertThat(cache.get(KEY)).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void put_overwritesExistingEntry() {
        cache.put(KEY, "token-1", 1200);
        cache.put(KEY, "token-2", 1200);

        assertThat(cache.get(KEY).map(CachedToken::getAccessToken)).hasValue("token-2");
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void put_withServerUrl_keepsPinnedVault() {
        cache.put(KEY, "t1", 1200, "https://vault.example.com/");

        assertThat(cache.get(KEY)).get()
                .extracting(CachedToken::getServerUrl)
                .isEqualTo("https://vault.example.com/");
        cache.put(KEY, "t2", 1200);
        assertThat(cache.get(KEY).get().getServerUrl()).isNull();
    }

    @Test
    void lockFor_returnsSameLockPerKey() {
        assertThat(cache.lockFor(KEY)).isSameAs(cache.lockFor(KEY));
        assertThat(cache.lockFor(KEY)).isNotSameAs(cache.lockFor(TokenCache.keyFor("https://other")));
    }

    @Test
    void clear_removesEntry() {
        cache.put(KEY, "token-1", 1200);

        cache.clear(KEY);

        assertThat(cache.get(KEY)).isEmpty();
    }

    @Test
    void clearIfMatches_withSameToken_removesEntry() {
        cache.put(KEY, "token-1", 1200);

        assertThat(cache.clearIfMatches(KEY, "token-1")).isTrue();
        assertThat(cache.get(KEY)).isEmpty();
    }

    @Test
    void clearIfMatches_withReplacedToken_keepsNewEntry() {
        cache.put(KEY, "token-1", 1200);
        cache.put(KEY, "token-2", 1200);

        assertThat(cache.clearIfMatches(KEY, "token-1")).isFalse();
        assertThat(cache.get(KEY).map(CachedToken::getAccessToken)).hasValue("token-2");
    }

    @Test
    void entries_withDifferentKeys_areIndependent() {
        String other = TokenCache.keyFor("https://other.example.com");
        cache.put(KEY, "token-1", 1200);
        cache.put(other, "token-2", 100);
        clock.advance(Duration.ofSeconds(95));

        assertThat(cache.get(KEY)).isPresent();
        assertThat(cache.get(other)).isEmpty();
    }
}
