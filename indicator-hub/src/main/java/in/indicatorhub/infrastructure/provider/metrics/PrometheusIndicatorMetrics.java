package in.indicatorhub.infrastructure.provider.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of IndicatorMetrics.
 *
 * Key Metrics:
 * - indicator_provider_calls_total{call_type, outcome}
 * - indicator_provider_latency_seconds{call_type}
 * - indicator_fallbacks_total{reason}
 * - indicator_cache_lookups_total{result}
 * - indicator_deduplicated_requests_total
 * - indicator_rate_limit_hits_total
 * - indicator_circuit_breaker_open (1=open, 0=closed)
 * - indicator_queue_length
 * - indicator_blacklisted_symbols
 */
public class PrometheusIndicatorMetrics implements IndicatorMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusIndicatorMetrics.class);

    private final CollectorRegistry registry;

    private final Counter providerCalls;
    private final Histogram providerLatency;
    private final Counter fallbacks;
    private final Counter cacheLookups;
    private final Counter deduplicated;
    private final Counter rateLimitHits;
    private final Gauge breakerOpen;
    private final Gauge queueLength;
    private final Gauge blacklistSize;

    public PrometheusIndicatorMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusIndicatorMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.providerCalls = Counter.build()
            .name("indicator_provider_calls_total")
            .help("Total number of indicator provider calls")
            .labelNames("call_type", "outcome")
            .register(registry);

        this.providerLatency = Histogram.build()
            .name("indicator_provider_latency_seconds")
            .help("Indicator provider call latency in seconds")
            .labelNames("call_type")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0, 30.0)
            .register(registry);

        this.fallbacks = Counter.build()
            .name("indicator_fallbacks_total")
            .help("Total number of fallback snapshots returned")
            .labelNames("reason")
            .register(registry);

        this.cacheLookups = Counter.build()
            .name("indicator_cache_lookups_total")
            .help("Total number of result cache lookups")
            .labelNames("result")
            .register(registry);

        this.deduplicated = Counter.build()
            .name("indicator_deduplicated_requests_total")
            .help("Requests attached to an already in-flight request")
            .register(registry);

        this.rateLimitHits = Counter.build()
            .name("indicator_rate_limit_hits_total")
            .help("Total number of provider throttling responses")
            .register(registry);

        this.breakerOpen = Gauge.build()
            .name("indicator_circuit_breaker_open")
            .help("Circuit breaker state (1=open, 0=closed)")
            .register(registry);

        this.queueLength = Gauge.build()
            .name("indicator_queue_length")
            .help("Requests waiting for a provider call")
            .register(registry);

        this.blacklistSize = Gauge.build()
            .name("indicator_blacklisted_symbols")
            .help("Symbols confirmed unserviceable under the current plan")
            .register(registry);

        log.info("[PrometheusIndicatorMetrics] Initialized");
    }

    @Override
    public void recordProviderCall(String callType, String outcome, Duration latency) {
        providerCalls.labels(callType, outcome).inc();
        providerLatency.labels(callType).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordFallback(String reason) {
        fallbacks.labels(reason).inc();
    }

    @Override
    public void recordCacheLookup(boolean hit) {
        cacheLookups.labels(hit ? "hit" : "miss").inc();
    }

    @Override
    public void recordDeduplicated() {
        deduplicated.inc();
    }

    @Override
    public void recordRateLimitHit() {
        rateLimitHits.inc();
    }

    @Override
    public void recordBreakerState(boolean open) {
        breakerOpen.set(open ? 1 : 0);
    }

    @Override
    public void recordQueueLength(int length) {
        queueLength.set(length);
    }

    @Override
    public void recordBlacklistSize(int size) {
        blacklistSize.set(size);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
