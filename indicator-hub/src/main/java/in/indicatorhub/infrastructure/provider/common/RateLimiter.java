package in.indicatorhub.infrastructure.provider.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Spacing-based rate limiter for outbound provider calls.
 *
 * Features:
 * - Minimum delay between granted calls
 * - Fail-fast while the provider has signalled throttling (HTTP 429)
 * - Throttle cool-down grows with repeated 429s (x2, capped at x8)
 *   and relaxes on success (x0.8)
 *
 * {@link #reserve()} never blocks: it books the next slot and returns how long
 * the caller must wait before using it.
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private static final double MAX_BACKOFF_MULTIPLIER = 8.0;
    private static final double BACKOFF_RELAX_FACTOR = 0.8;

    private final Duration cooldown;
    private final Duration maxCooldown;
    private final Clock clock;

    private Duration minDelay;
    private Instant lastCallAt;
    private boolean rateLimited = false;
    private Instant rateLimitedUntil;
    private double backoffMultiplier = 1.0;

    private RateLimiter(Duration minDelay, Duration cooldown, Duration maxCooldown, Clock clock) {
        this.minDelay = minDelay;
        this.cooldown = cooldown;
        this.maxCooldown = maxCooldown;
        this.clock = clock;
    }

    /**
     * Book the next call slot.
     *
     * @return how long to wait before issuing the call (zero if immediately)
     * @throws RateLimitedException while throttled
     */
    public synchronized Duration reserve() {
        Instant now = clock.instant();
        if (checkRateLimited(now)) {
            throw new RateLimitedException(rateLimitedUntil);
        }
        Instant slot = now;
        if (lastCallAt != null) {
            Instant earliest = lastCallAt.plus(minDelay);
            if (earliest.isAfter(now)) {
                slot = earliest;
            }
        }
        lastCallAt = slot;
        Duration wait = Duration.between(now, slot);
        if (!wait.isZero()) {
            log.debug("[RateLimiter] Next slot in {}ms", wait.toMillis());
        }
        return wait;
    }

    /**
     * Provider answered 429: refuse calls for cooldown x backoff multiplier.
     *
     * @return time until which calls are refused
     */
    public synchronized Instant engage() {
        Instant now = clock.instant();
        long millis = Math.min((long) (cooldown.toMillis() * backoffMultiplier), maxCooldown.toMillis());
        rateLimited = true;
        rateLimitedUntil = now.plusMillis(millis);
        log.warn("[RateLimiter] Provider throttled us, backing off {}s (multiplier {})",
            millis / 1000, backoffMultiplier);
        // next 429 without an intervening success waits longer
        backoffMultiplier = Math.min(backoffMultiplier * 2, MAX_BACKOFF_MULTIPLIER);
        return rateLimitedUntil;
    }

    /**
     * A provider call succeeded; relax the throttle backoff.
     */
    public synchronized void recordSuccess() {
        backoffMultiplier = Math.max(backoffMultiplier * BACKOFF_RELAX_FACTOR, 1.0);
    }

    public synchronized boolean isRateLimited() {
        return checkRateLimited(clock.instant());
    }

    private boolean checkRateLimited(Instant now) {
        if (rateLimited && !now.isBefore(rateLimitedUntil)) {
            rateLimited = false;
            rateLimitedUntil = null;
            log.info("[RateLimiter] Throttle period ended, resuming requests");
        }
        return rateLimited;
    }

    /**
     * Clear throttle state and backoff (operator reset).
     */
    public synchronized void reset() {
        rateLimited = false;
        rateLimitedUntil = null;
        backoffMultiplier = 1.0;
        lastCallAt = null;
    }

    /**
     * Adjust spacing when the detected plan tier changes.
     */
    public synchronized void setMinDelay(Duration minDelay) {
        if (minDelay.isNegative()) {
            throw new IllegalArgumentException("Min delay cannot be negative");
        }
        if (!minDelay.equals(this.minDelay)) {
            log.info("[RateLimiter] Min delay {}ms -> {}ms", this.minDelay.toMillis(), minDelay.toMillis());
            this.minDelay = minDelay;
        }
    }

    public synchronized Duration getMinDelay() {
        return minDelay;
    }

    public synchronized Instant getRateLimitedUntil() {
        return rateLimitedUntil;
    }

    public synchronized double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public synchronized Instant getLastCallAt() {
        return lastCallAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for RateLimiter.
     */
    public static class Builder {
        private Duration minDelay = Duration.ofSeconds(18);
        private Duration cooldown = Duration.ofMinutes(1);
        private Duration maxCooldown = Duration.ofMinutes(5);
        private Clock clock = Clock.systemUTC();

        public Builder minDelay(Duration minDelay) {
            if (minDelay.isNegative()) {
                throw new IllegalArgumentException("Min delay cannot be negative");
            }
            this.minDelay = minDelay;
            return this;
        }

        public Builder cooldown(Duration cooldown) {
            if (cooldown.isNegative() || cooldown.isZero()) {
                throw new IllegalArgumentException("Cooldown must be positive");
            }
            this.cooldown = cooldown;
            return this;
        }

        public Builder maxCooldown(Duration maxCooldown) {
            if (maxCooldown.isNegative() || maxCooldown.isZero()) {
                throw new IllegalArgumentException("Max cooldown must be positive");
            }
            this.maxCooldown = maxCooldown;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public RateLimiter build() {
            if (cooldown.compareTo(maxCooldown) > 0) {
                throw new IllegalArgumentException("Cooldown cannot exceed max cooldown");
            }
            return new RateLimiter(minDelay, cooldown, maxCooldown, clock);
        }
    }
}
