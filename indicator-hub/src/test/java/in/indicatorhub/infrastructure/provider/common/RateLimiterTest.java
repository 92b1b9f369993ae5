package in.indicatorhub.infrastructure.provider.common;

import in.indicatorhub.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RateLimiter.
 *
 * Tests:
 * - Call spacing
 * - Fail-fast while throttled
 * - Backoff growth and relaxation
 * - Reset
 */
class RateLimiterTest {

    private MutableClock clock;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        limiter = RateLimiter.builder()
            .minDelay(Duration.ofSeconds(18))
            .cooldown(Duration.ofMinutes(1))
            .maxCooldown(Duration.ofMinutes(5))
            .clock(clock)
            .build();
    }

    @Test
    void testFirstCallIsImmediate() {
        assertEquals(Duration.ZERO, limiter.reserve());
        assertEquals(clock.instant(), limiter.getLastCallAt());
    }

    @Test
    void testSpacingBetweenCalls() {
        limiter.reserve();
        assertEquals(Duration.ofSeconds(18), limiter.reserve(), "Second call waits the full delay");
        assertEquals(Duration.ofSeconds(36), limiter.reserve(), "Third call is booked after the second");

        clock.advance(Duration.ofSeconds(60));
        assertEquals(Duration.ZERO, limiter.reserve(), "Idle long enough: no wait");
    }

    @Test
    void testPartialWait() {
        limiter.reserve();
        clock.advance(Duration.ofSeconds(10));
        assertEquals(Duration.ofSeconds(8), limiter.reserve());
    }

    @Test
    void testFailFastWhileThrottled() {
        Instant until = limiter.engage();
        assertEquals(clock.instant().plus(Duration.ofMinutes(1)), until);
        assertTrue(limiter.isRateLimited());

        RateLimitedException e = assertThrows(RateLimitedException.class, limiter::reserve);
        assertEquals(until, e.getRateLimitedUntil());

        clock.advance(Duration.ofMinutes(1));
        assertFalse(limiter.isRateLimited(), "Throttle clears once the cooldown has passed");
        assertEquals(Duration.ZERO, limiter.reserve());
    }

    @Test
    void testBackoffGrowsAndCaps() {
        Instant first = clock.instant();
        assertEquals(first.plus(Duration.ofMinutes(1)), limiter.engage());

        clock.advance(Duration.ofMinutes(1));
        assertEquals(clock.instant().plus(Duration.ofMinutes(2)), limiter.engage(), "Second 429 doubles");

        clock.advance(Duration.ofMinutes(2));
        assertEquals(clock.instant().plus(Duration.ofMinutes(4)), limiter.engage());

        clock.advance(Duration.ofMinutes(4));
        assertEquals(clock.instant().plus(Duration.ofMinutes(5)), limiter.engage(), "Capped at max cooldown");
        assertEquals(8.0, limiter.getBackoffMultiplier(), 1e-9, "Multiplier capped at 8");
    }

    @Test
    void testSuccessRelaxesBackoff() {
        limiter.engage();
        limiter.engage();
        assertEquals(4.0, limiter.getBackoffMultiplier(), 1e-9);

        limiter.recordSuccess();
        assertEquals(3.2, limiter.getBackoffMultiplier(), 1e-9);

        for (int i = 0; i < 20; i++) {
            limiter.recordSuccess();
        }
        assertEquals(1.0, limiter.getBackoffMultiplier(), 1e-9, "Never relaxes below 1");
    }

    @Test
    void testSetMinDelay() {
        limiter.reserve();
        limiter.setMinDelay(Duration.ofMillis(600));
        assertEquals(Duration.ofMillis(600), limiter.reserve());
        assertThrows(IllegalArgumentException.class, () -> limiter.setMinDelay(Duration.ofSeconds(-1)));
    }

    @Test
    void testReset() {
        limiter.reserve();
        limiter.engage();
        limiter.reset();

        assertFalse(limiter.isRateLimited());
        assertEquals(1.0, limiter.getBackoffMultiplier(), 1e-9);
        assertEquals(Duration.ZERO, limiter.reserve());
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> RateLimiter.builder().minDelay(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class,
            () -> RateLimiter.builder().cooldown(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> RateLimiter.builder().cooldown(Duration.ofMinutes(10)).maxCooldown(Duration.ofMinutes(5)).build());
    }
}
