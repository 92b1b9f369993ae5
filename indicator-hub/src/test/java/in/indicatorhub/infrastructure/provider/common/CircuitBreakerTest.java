package in.indicatorhub.infrastructure.provider.common;

import in.indicatorhub.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CircuitBreaker.
 *
 * Tests:
 * - Opening at the error threshold
 * - Automatic close after the reset window
 * - Weighted failures
 * - Success decay
 * - State listener
 */
class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        breaker = CircuitBreaker.builder()
            .maxConsecutiveErrors(3)
            .resetWindow(Duration.ofMinutes(5))
            .decayFactor(0.5)
            .clock(clock)
            .build();
    }

    @Test
    void testInitialState() {
        assertFalse(breaker.isOpen(), "Breaker should start closed");
        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
        assertEquals(0, breaker.getConsecutiveErrors());
        assertNull(breaker.getReopenAt(), "No reopen time while closed");
    }

    @Test
    void testOpensAtThreshold() {
        assertFalse(breaker.recordFailure(1.0));
        assertFalse(breaker.recordFailure(1.0));
        assertFalse(breaker.isOpen(), "Two errors should not open the breaker");

        assertTrue(breaker.recordFailure(1.0), "Third error should open the breaker");
        assertTrue(breaker.isOpen());
        assertEquals(clock.instant().plus(Duration.ofMinutes(5)), breaker.getReopenAt());
    }

    @Test
    void testClosesAfterResetWindow() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure(1.0);
        }
        assertTrue(breaker.isOpen());

        clock.advance(Duration.ofMinutes(4).plusSeconds(59));
        assertTrue(breaker.isOpen(), "Still open before the reset window elapses");

        clock.advance(Duration.ofSeconds(1));
        assertFalse(breaker.isOpen(), "Closed once the reset window has elapsed");
        assertEquals(0, breaker.getConsecutiveErrors(), "Errors cleared on close");
    }

    @Test
    void testAuthFailureWeighsDouble() {
        breaker.recordFailure(2.0);
        assertFalse(breaker.isOpen());
        assertEquals(2, breaker.getConsecutiveErrors());

        assertTrue(breaker.recordFailure(1.0), "2 + 1 reaches the threshold of 3");
    }

    @Test
    void testZeroWeightIgnored() {
        for (int i = 0; i < 10; i++) {
            assertFalse(breaker.recordFailure(0.0));
        }
        assertFalse(breaker.isOpen());
        assertEquals(0, breaker.getConsecutiveErrors());
    }

    @Test
    void testSuccessDecaysScore() {
        breaker.recordFailure(1.0);
        breaker.recordFailure(1.0);
        assertEquals(2.0, breaker.getErrorScore(), 1e-9);

        breaker.recordSuccess();
        assertEquals(1.0, breaker.getErrorScore(), 1e-9, "2 x 0.5 = 1");

        breaker.recordSuccess();
        assertEquals(0.0, breaker.getErrorScore(), 1e-9, "Score below 1 snaps to 0");
    }

    @Test
    void testFailuresIgnoredWhileOpen() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure(1.0);
        }
        assertFalse(breaker.recordFailure(1.0), "Already open: no second open transition");
        assertEquals(3, breaker.getConsecutiveErrors());
    }

    @Test
    void testResetClosesImmediately() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure(1.0);
        }
        breaker.reset();

        assertFalse(breaker.isOpen());
        assertEquals(0, breaker.getConsecutiveErrors());
    }

    @Test
    void testListenerNotifiedOnTransitions() {
        List<CircuitBreaker.State> transitions = new ArrayList<>();
        breaker.onStateChange(transitions::add);

        for (int i = 0; i < 3; i++) {
            breaker.recordFailure(1.0);
        }
        clock.advance(Duration.ofMinutes(5));
        breaker.isOpen();

        assertEquals(List.of(CircuitBreaker.State.OPEN, CircuitBreaker.State.CLOSED), transitions);
    }

    @Test
    void testListenerFailureDoesNotBreakBreaker() {
        breaker.onStateChange(state -> {
            throw new IllegalStateException("listener bug");
        });

        for (int i = 0; i < 3; i++) {
            breaker.recordFailure(1.0);
        }
        assertTrue(breaker.isOpen());
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> CircuitBreaker.builder().maxConsecutiveErrors(0));
        assertThrows(IllegalArgumentException.class,
            () -> CircuitBreaker.builder().resetWindow(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> CircuitBreaker.builder().decayFactor(1.0));
        assertThrows(IllegalArgumentException.class,
            () -> CircuitBreaker.builder().decayFactor(-0.1));
    }
}
