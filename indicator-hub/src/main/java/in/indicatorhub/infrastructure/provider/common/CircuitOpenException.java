package in.indicatorhub.infrastructure.provider.common;

import java.time.Instant;

/**
 * Raised instead of calling the provider while the circuit breaker is open.
 */
public class CircuitOpenException extends RuntimeException {

    private final Instant reopenAt;

    public CircuitOpenException(Instant reopenAt) {
        super("Circuit breaker open until " + reopenAt);
        this.reopenAt = reopenAt;
    }

    public Instant getReopenAt() {
        return reopenAt;
    }
}
