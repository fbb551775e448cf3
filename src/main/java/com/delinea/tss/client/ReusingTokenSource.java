package com.delinea.tss.client;

import com.delinea.tss.auth.TssException;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one token and asks the delegate for a new one only when it is about to expire.
 *
 * <p>Calls are serialized, so concurrent callers that find the token expired trigger a single
 * refresh.
 */
public class ReusingTokenSource implements TokenSupplier {

    private static final Logger logger = LoggerFactory.getLogger(ReusingTokenSource.class);

    /** Tokens this close to expiry are refreshed before use. */
    public static final Duration EXPIRY_MARGIN = Duration.ofSeconds(10);

    private final TokenSupplier delegate;
    private final Clock clock;
    private IssuedToken current;

    public ReusingTokenSource(TokenSupplier delegate) {
        this(delegate, Clock.systemUTC());
    }

    public ReusingTokenSource(TokenSupplier delegate, Clock clock) {
        this.delegate = delegate;
        this.clock = clock;
    }

    @Override
    public synchronized IssuedToken token() throws TssException {
        if (current != null && !current.expiresWithin(EXPIRY_MARGIN, clock.instant())) {
            return current;
        }
        logger.debug("Refreshing token (previous expiry: {})",
                current != null ? current.getExpiry() : "none");
        current = delegate.token();
        return current;
    }
}
