package in.indicatorhub.bootstrap;

import in.indicatorhub.application.service.BatchAggregator;
import in.indicatorhub.application.service.FallbackProvider;
import in.indicatorhub.application.service.IndicatorRequestScheduler;
import in.indicatorhub.application.service.ResultCache;
import in.indicatorhub.application.service.SymbolCapabilityManager;
import in.indicatorhub.config.IndicatorHubConfig;
import in.indicatorhub.domain.plan.PlanTier;
import in.indicatorhub.infrastructure.provider.IndicatorProvider;
import in.indicatorhub.infrastructure.provider.TaapiIndicatorProvider;
import in.indicatorhub.infrastructure.provider.common.CircuitBreaker;
import in.indicatorhub.infrastructure.provider.common.RateLimiter;
import in.indicatorhub.infrastructure.provider.metrics.PrometheusIndicatorMetrics;
import in.indicatorhub.infrastructure.provider.metrics.PrometheusMetricsHandler;
import in.indicatorhub.transport.http.IndicatorHandlers;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== indicator-hub Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        IndicatorHubConfig config = IndicatorHubConfig.fromEnv();
        StartupConfigValidator.validate(config);

        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusIndicatorMetrics metrics = new PrometheusIndicatorMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Provider + orchestration
        // ═══════════════════════════════════════════════════════════════
        IndicatorProvider provider = new TaapiIndicatorProvider(
            config.taapiBaseUrl(), config.taapiSecret(), config.providerTimeout(), config.bulkTimeout());
        log.info("✓ Indicator provider: {} at {} (secret {})",
            provider.getProviderCode(), config.taapiBaseUrl(), config.maskedSecret());

        CircuitBreaker breaker = CircuitBreaker.builder()
            .maxConsecutiveErrors(config.circuitMaxErrors())
            .resetWindow(config.circuitResetWindow())
            .decayFactor(config.circuitDecayFactor())
            .clock(clock)
            .build();

        Duration minDelay = config.hasExplicitMinDelay()
            ? config.rateLimitMinDelay()
            : PlanTier.UNKNOWN.limits().minCallSpacing();
        Duration cooldown = config.rateLimitCooldown();
        RateLimiter rateLimiter = RateLimiter.builder()
            .minDelay(minDelay)
            .cooldown(cooldown)
            .maxCooldown(cooldown.compareTo(Duration.ofMinutes(5)) > 0 ? cooldown : Duration.ofMinutes(5))
            .clock(clock)
            .build();

        FallbackProvider fallbackProvider = new FallbackProvider(clock);
        SymbolCapabilityManager capabilities = new SymbolCapabilityManager(
            provider, config.defaultExchange(), config.symbolRefreshInterval(), clock);
        BatchAggregator batchAggregator = new BatchAggregator(
            fallbackProvider, config.batchEnabled(), config.batchCollectionDelay(), clock);

        IndicatorRequestScheduler scheduler = IndicatorRequestScheduler.builder()
            .provider(provider)
            .cache(new ResultCache(config.cacheTtl(), clock))
            .circuitBreaker(breaker)
            .rateLimiter(rateLimiter)
            .capabilities(capabilities)
            .batchAggregator(batchAggregator)
            .fallbackProvider(fallbackProvider)
            .metrics(metrics)
            .clock(clock)
            .interCallPause(config.interCallPause())
            .providerTimeout(config.providerTimeout())
            .bulkTimeout(config.bulkTimeout())
            .adaptMinDelayToPlan(!config.hasExplicitMinDelay())
            .build();

        try {
            PlanTier tier = scheduler.start().get(config.providerTimeout().toMillis() * 2, TimeUnit.MILLISECONDS);
            log.info("✓ Request scheduler started (plan tier {}, min call spacing {}ms)",
                tier, rateLimiter.getMinDelay().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during symbol discovery", e);
        } catch (Exception e) {
            log.warn("⚠️  Symbol discovery still pending ({}), serving with seed symbols", e.toString());
        }

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        IndicatorHandlers api = new IndicatorHandlers(scheduler, config.defaultExchange());
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());
        log.info("✓ Prometheus /metrics endpoint ready");

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/indicators/health", api::health)
            .get("/api/indicators/symbols", api::symbols)
            .post("/api/indicators/symbols/refresh", api::refreshSymbols)
            .post("/api/indicators/reset", api::reset)
            .post("/api/indicators/flush", api::flush)
            .get("/api/indicators/{symbol}", api::indicators)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "indicator-hub\n\n" +
                    "GET  /api/indicators/{symbol}?interval=1h&exchange=" + config.defaultExchange() + "\n" +
                    "GET  /api/indicators/health, /api/indicators/symbols, /metrics\n" +
                    "POST /api/indicators/reset, /api/indicators/flush, /api/indicators/symbols/refresh\n"
                );
            });

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("✓ HTTP API server started on port {}", config.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down indicator-hub...");
            server.stop();
            scheduler.shutdown();
            log.info("✓ Shutdown complete");
        }, "shutdown-hook"));
    }

    private App() {}
}
