package in.indicatorhub.domain.plan;

import java.time.Duration;

/**
 * Limits of a provider subscription plan.
 * A negative value means unlimited.
 */
public record PlanLimits(
    int maxSymbols,
    int requestsPerMinute,
    int requestsPerMonth,
    int bulkBatchSize
) {
    private static final double SAFETY_FACTOR = 1.2;

    public boolean supportsBulk() {
        return bulkBatchSize > 1;
    }

    /**
     * Minimum spacing between calls that keeps us under the per-minute quota,
     * with a safety margin. 4 req/min gives 18s.
     */
    public Duration minCallSpacing() {
        if (requestsPerMinute <= 0) {
            return Duration.ZERO;
        }
        long millis = Math.round(60_000.0 / requestsPerMinute * SAFETY_FACTOR);
        return Duration.ofMillis(millis);
    }
}
