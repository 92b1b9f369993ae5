package in.indicatorhub.infrastructure.provider.common;

import java.time.Instant;

/**
 * Thrown by {@link RateLimiter#reserve()} while the provider has us throttled.
 */
public class RateLimitedException extends RuntimeException {

    private final Instant rateLimitedUntil;

    public RateLimitedException(Instant rateLimitedUntil) {
        super("Provider rate limited until " + rateLimitedUntil);
        this.rateLimitedUntil = rateLimitedUntil;
    }

    public Instant getRateLimitedUntil() {
        return rateLimitedUntil;
    }
}
