package in.indicatorhub.infrastructure.provider.metrics;

import java.time.Duration;

/**
 * Indicator pipeline metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Provider call outcomes and latency
 * - Fallback snapshots by reason
 * - Cache hit ratio
 * - Request de-duplication
 * - Rate limit hits and breaker state
 */
public interface IndicatorMetrics {

    /**
     * Record a provider call.
     *
     * @param callType SINGLE, BULK or SYMBOLS
     * @param outcome success, or the failure class name
     * @param latency Time to response or failure
     */
    void recordProviderCall(String callType, String outcome, Duration latency);

    /**
     * Record a fallback snapshot handed to a caller.
     *
     * @param reason Fallback reason code
     */
    void recordFallback(String reason);

    /**
     * Record a result-cache lookup.
     */
    void recordCacheLookup(boolean hit);

    /**
     * Record a caller that joined an in-flight request instead of queueing its own.
     */
    void recordDeduplicated();

    /**
     * Record a provider throttling signal.
     */
    void recordRateLimitHit();

    /**
     * Record circuit breaker state (true = open).
     */
    void recordBreakerState(boolean open);

    /**
     * Record current queue length.
     */
    void recordQueueLength(int length);

    /**
     * Record the number of blacklisted symbols.
     */
    void recordBlacklistSize(int size);
}
