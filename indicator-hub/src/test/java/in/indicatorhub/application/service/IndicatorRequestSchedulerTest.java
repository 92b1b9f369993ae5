package in.indicatorhub.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import in.indicatorhub.domain.indicator.IndicatorSnapshot;
import in.indicatorhub.domain.indicator.SnapshotSource;
import in.indicatorhub.domain.plan.PlanTier;
import in.indicatorhub.infrastructure.provider.BulkConstruct;
import in.indicatorhub.infrastructure.provider.common.CircuitBreaker;
import in.indicatorhub.infrastructure.provider.common.RateLimiter;
import in.indicatorhub.support.MutableClock;
import in.indicatorhub.support.ScriptedIndicatorProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IndicatorRequestSchedulerTest {

    private static final List<String> FREE_SYMBOLS = SymbolCapabilityManager.FREE_PLAN_SYMBOLS;

    private MutableClock clock;
    private ScriptedIndicatorProvider provider;
    private IndicatorRequestScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        provider = new ScriptedIndicatorProvider();
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
        provider.release();
    }

    private IndicatorRequestScheduler.Builder builder() {
        return IndicatorRequestScheduler.builder()
            .provider(provider)
            .clock(clock)
            .circuitBreaker(CircuitBreaker.builder().clock(clock).maxConsecutiveErrors(3).build())
            .rateLimiter(RateLimiter.builder().clock(clock).minDelay(Duration.ZERO).build())
            .batchAggregator(new BatchAggregator(new FallbackProvider(clock), true, Duration.ofSeconds(2), clock))
            .interCallPause(Duration.ZERO)
            .providerTimeout(Duration.ofSeconds(2))
            .bulkTimeout(Duration.ofSeconds(2))
            .adaptMinDelayToPlan(false);
    }

    private static IndicatorSnapshot await(CompletableFuture<IndicatorSnapshot> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    @Test
    void testLiveSnapshotFromSequentialCalls() throws Exception {
        scheduler = builder().build();

        IndicatorSnapshot snapshot = await(scheduler.enqueue("btc/usdt"));

        assertEquals("BTCUSDT", snapshot.symbol());
        assertEquals(SnapshotSource.LIVE, snapshot.source());
        assertFalse(snapshot.fallbackData());
        assertEquals(IndicatorRequestScheduler.SEQUENTIAL_INDICATORS.size(), snapshot.realIndicatorCount());
        assertEquals(50.0, snapshot.value("rsi", 0), 1e-9);
        assertEquals(90.0, snapshot.value("bb_lower", 0), 1e-9);
        assertEquals(4, provider.singleCalls());
        assertTrue(provider.requestedSymbols().stream().allMatch("BTC/USDT"::equals));
    }

    @Test
    void testConcurrentRequestsShareOneProviderCall() throws Exception {
        scheduler = builder().build();
        provider.hold();

        List<CompletableFuture<IndicatorSnapshot>> futures = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            futures.add(scheduler.enqueue("BTCUSDT"));
        }
        // runs on the drain thread after every admission
        scheduler.forceFlush().get(5, TimeUnit.SECONDS);
        assertEquals(1, provider.singleCalls(), "Only the first indicator call is in flight");
        assertTrue(futures.stream().noneMatch(CompletableFuture::isDone));

        provider.release();

        IndicatorSnapshot first = await(futures.get(0));
        for (CompletableFuture<IndicatorSnapshot> future : futures) {
            assertSame(first, await(future));
        }
        assertEquals(4, provider.singleCalls());
    }

    @Test
    void testCacheServesUntilTtlExpires() throws Exception {
        scheduler = builder().build();

        IndicatorSnapshot first = await(scheduler.enqueue("ETHUSDT"));
        IndicatorSnapshot second = await(scheduler.enqueue("ETHUSDT"));
        assertSame(first, second);
        assertEquals(4, provider.singleCalls());

        clock.advance(Duration.ofMinutes(5).minusMillis(1));
        assertSame(first, await(scheduler.enqueue("ETHUSDT")));
        assertEquals(4, provider.singleCalls());

        // age == ttl is already stale
        clock.advance(Duration.ofMillis(1));

        IndicatorSnapshot third = await(scheduler.enqueue("ETHUSDT"));
        assertNotSame(first, third);
        assertEquals(8, provider.singleCalls());
    }

    @Test
    void testFallbacksAreNeverCached() throws Exception {
        provider.onSingle(spec -> ScriptedIndicatorProvider.httpError(502, "Bad gateway"));
        scheduler = builder().build();

        IndicatorSnapshot failed = await(scheduler.enqueue("XRPUSDT"));
        assertTrue(failed.fallbackData());
        assertEquals("provider_error", failed.reason());

        provider.onSingle(spec -> CompletableFuture.completedFuture(ScriptedIndicatorProvider.ALL_FIELDS));
        IndicatorSnapshot recovered = await(scheduler.enqueue("XRPUSDT"));
        assertFalse(recovered.fallbackData());
    }

    @Test
    void testBreakerOpensAndRecoversAfterWindow() throws Exception {
        provider.onSingle(spec -> ScriptedIndicatorProvider.httpError(502, "Bad gateway"));
        scheduler = builder().build();

        for (String symbol : List.of("BTCUSDT", "ETHUSDT", "XRPUSDT")) {
            assertEquals("provider_error", await(scheduler.enqueue(symbol)).reason());
        }
        assertTrue(scheduler.getHealth().breakerOpen());
        assertEquals("degraded", scheduler.getHealth().status());
        int callsWhenOpened = provider.singleCalls();

        IndicatorSnapshot blocked = await(scheduler.enqueue("LTCUSDT"));
        assertEquals("circuit_open", blocked.reason());
        assertEquals(callsWhenOpened, provider.singleCalls(), "No provider call while open");

        provider.onSingle(spec -> CompletableFuture.completedFuture(ScriptedIndicatorProvider.ALL_FIELDS));
        clock.advance(Duration.ofMinutes(5));

        IndicatorSnapshot recovered = await(scheduler.enqueue("LTCUSDT"));
        assertFalse(recovered.fallbackData());
        assertFalse(scheduler.getHealth().breakerOpen());
    }

    @Test
    void testTimeoutsNeverBlacklistButEntitlementDoes() throws Exception {
        provider.onSingle(spec -> switch (spec.providerSymbol()) {
            case "DOGE/USDT" -> ScriptedIndicatorProvider.<JsonNode>never();
            case "SHIB/USDT" -> ScriptedIndicatorProvider.<JsonNode>httpError(403, "Symbol not available on your plan");
            default -> CompletableFuture.completedFuture(ScriptedIndicatorProvider.ALL_FIELDS);
        });
        scheduler = builder().providerTimeout(Duration.ofMillis(300)).build();
        SymbolCapabilityManager capabilities = scheduler.getCapabilities();

        IndicatorSnapshot doge = await(scheduler.enqueue("DOGEUSDT"));
        assertEquals("provider_error", doge.reason());
        assertFalse(capabilities.isBlacklisted("DOGEUSDT"), "Timeouts are transient");

        IndicatorSnapshot shib = await(scheduler.enqueue("SHIBUSDT"));
        assertEquals("plan_limitation", shib.reason());
        assertTrue(capabilities.isBlacklisted("SHIBUSDT"));

        int calls = provider.singleCalls();
        IndicatorSnapshot again = await(scheduler.enqueue("SHIBUSDT"));
        assertEquals("blacklisted", again.reason());
        assertEquals(calls, provider.singleCalls());
        assertEquals(1, scheduler.getHealth().blacklistedCount());
    }

    @Test
    void testThrottleEngagesLimiterWithoutTrippingBreaker() throws Exception {
        provider.onSingle(spec -> ScriptedIndicatorProvider.httpError(429, "Too many requests"));
        scheduler = builder().build();

        assertEquals("rate_limited", await(scheduler.enqueue("BTCUSDT")).reason());
        assertTrue(scheduler.getHealth().rateLimited());
        assertEquals("throttled", scheduler.getHealth().status());

        assertEquals("rate_limited", await(scheduler.enqueue("ETHUSDT")).reason());
        assertEquals(1, provider.singleCalls(), "Throttled requests never leave the process");
        assertFalse(scheduler.getHealth().breakerOpen());
    }

    @Test
    void testUnsupportedSymbolsShortCircuit() throws Exception {
        provider.permittedSymbols(FREE_SYMBOLS);
        scheduler = builder().build();
        assertEquals(PlanTier.FREE, scheduler.start().get(5, TimeUnit.SECONDS));

        IndicatorSnapshot doge = await(scheduler.enqueue("DOGEUSDT"));
        assertEquals("unsupported_by_plan", doge.reason());
        assertEquals(0, provider.singleCalls());
        assertEquals(0, provider.bulkCalls(), "Never tried live once the list is authoritative");

        assertFalse(await(scheduler.enqueue("BTCUSDT")).fallbackData());
    }

    @Test
    void testBatchDemultiplexesBulkResponse() throws Exception {
        List<String> permitted = new ArrayList<>(FREE_SYMBOLS);
        for (int i = 0; i < 45; i++) {
            permitted.add("COIN" + i + "USDT");
        }
        provider.permittedSymbols(permitted)
            .onBulk(constructs -> {
                List<BulkConstruct> answered = constructs.stream()
                    .filter(c -> !c.symbol().equals("XMRUSDT"))
                    .toList();
                return CompletableFuture.completedFuture(ScriptedIndicatorProvider.answerAll(answered));
            });
        scheduler = builder().build();
        assertEquals(PlanTier.STARTER, scheduler.start().get(5, TimeUnit.SECONDS));

        List<CompletableFuture<IndicatorSnapshot>> futures = new ArrayList<>();
        for (String symbol : FREE_SYMBOLS) {
            futures.add(scheduler.enqueue(symbol));
        }

        for (int i = 0; i < FREE_SYMBOLS.size(); i++) {
            IndicatorSnapshot snapshot = await(futures.get(i));
            assertEquals(FREE_SYMBOLS.get(i), snapshot.symbol());
            if (snapshot.symbol().equals("XMRUSDT")) {
                assertEquals("missing_from_batch", snapshot.reason());
            } else {
                assertEquals(SnapshotSource.BATCH, snapshot.source());
                assertEquals(BatchAggregator.BULK_INDICATORS.size(), snapshot.realIndicatorCount());
            }
        }
        assertEquals(1, provider.bulkCalls());
        assertEquals(List.of(5), provider.bulkSizes());
        assertEquals(0, provider.singleCalls());
    }

    @Test
    void testForceFlushEndsCollection() throws Exception {
        List<String> permitted = new ArrayList<>(FREE_SYMBOLS);
        for (int i = 0; i < 45; i++) {
            permitted.add("COIN" + i + "USDT");
        }
        provider.permittedSymbols(permitted);
        scheduler = builder()
            .batchAggregator(new BatchAggregator(new FallbackProvider(clock), true, Duration.ofMinutes(1), clock))
            .build();
        scheduler.start().get(5, TimeUnit.SECONDS);

        CompletableFuture<IndicatorSnapshot> btc = scheduler.enqueue("BTCUSDT");
        CompletableFuture<IndicatorSnapshot> eth = scheduler.enqueue("ETHUSDT");

        assertEquals(2, scheduler.forceFlush().get(5, TimeUnit.SECONDS));
        assertEquals(SnapshotSource.BATCH, await(btc).source());
        assertEquals(SnapshotSource.BATCH, await(eth).source());
        assertEquals(List.of(2), provider.bulkSizes());
    }

    @Test
    void testEmptyBulkResponsesTripBreaker() throws Exception {
        List<String> permitted = new ArrayList<>(FREE_SYMBOLS);
        for (int i = 0; i < 45; i++) {
            permitted.add("COIN" + i + "USDT");
        }
        provider.permittedSymbols(permitted)
            .onBulk(constructs -> CompletableFuture.completedFuture(List.of()));
        scheduler = builder()
            .batchAggregator(new BatchAggregator(new FallbackProvider(clock), true, Duration.ofMinutes(1), clock))
            .build();
        scheduler.start().get(5, TimeUnit.SECONDS);

        for (int round = 0; round < 3; round++) {
            CompletableFuture<IndicatorSnapshot> a = scheduler.enqueue("COIN" + (round * 2) + "USDT");
            CompletableFuture<IndicatorSnapshot> b = scheduler.enqueue("COIN" + (round * 2 + 1) + "USDT");
            scheduler.forceFlush().get(5, TimeUnit.SECONDS);
            assertEquals("missing_from_batch", await(a).reason());
            assertEquals("missing_from_batch", await(b).reason());
        }
        assertEquals(3, provider.bulkCalls());
        assertTrue(scheduler.getHealth().breakerOpen(), "Three empty bulk answers count as failures");

        CompletableFuture<IndicatorSnapshot> blocked = scheduler.enqueue("COIN10USDT");
        scheduler.forceFlush().get(5, TimeUnit.SECONDS);
        assertEquals("circuit_open", await(blocked).reason());
        assertEquals(3, provider.bulkCalls());
    }

    @Test
    void testEveryRequestResolvesUnderFailures() throws Exception {
        provider.onSingle(spec -> {
            int n = Integer.parseInt(spec.providerSymbol().replaceAll("\\D", ""));
            return switch (n % 3) {
                case 0 -> ScriptedIndicatorProvider.<JsonNode>httpError(502, "Bad gateway");
                case 1 -> ScriptedIndicatorProvider.<JsonNode>never();
                default -> CompletableFuture.completedFuture(ScriptedIndicatorProvider.ALL_FIELDS);
            };
        });
        scheduler = builder().providerTimeout(Duration.ofMillis(300)).build();

        List<CompletableFuture<IndicatorSnapshot>> futures = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            futures.add(scheduler.enqueue("S" + i + "USDT"));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);

        long circuitOpen = 0;
        for (int i = 0; i < futures.size(); i++) {
            IndicatorSnapshot snapshot = futures.get(i).join();
            assertEquals("S" + i + "USDT", snapshot.symbol());
            if ("circuit_open".equals(snapshot.reason())) {
                circuitOpen++;
            }
        }
        assertTrue(circuitOpen > 0, "Breaker should have opened and drained the queue");
        assertEquals(0, scheduler.getHealth().queueLength());
    }

    @Test
    void testForceResetDrainsQueue() throws Exception {
        scheduler = builder().build();
        provider.hold();

        CompletableFuture<IndicatorSnapshot> inFlight = scheduler.enqueue("BTCUSDT");
        CompletableFuture<IndicatorSnapshot> eth = scheduler.enqueue("ETHUSDT");
        CompletableFuture<IndicatorSnapshot> xrp = scheduler.enqueue("XRPUSDT");

        assertEquals(2, scheduler.forceReset().get(5, TimeUnit.SECONDS));
        assertEquals("emergency_drain", await(eth).reason());
        assertEquals("emergency_drain", await(xrp).reason());
        assertFalse(inFlight.isDone());

        provider.release();
        assertFalse(await(inFlight).fallbackData());
        assertEquals(0, scheduler.getHealth().queueLength());
    }

    @Test
    void testShutdownAnswersOutstandingRequests() throws Exception {
        scheduler = builder().build();
        provider.hold();

        CompletableFuture<IndicatorSnapshot> inFlight = scheduler.enqueue("BTCUSDT");
        CompletableFuture<IndicatorSnapshot> queued = scheduler.enqueue("ETHUSDT");
        scheduler.forceFlush().get(5, TimeUnit.SECONDS);

        scheduler.shutdown();

        assertEquals("shutdown", await(inFlight).reason());
        assertEquals("shutdown", await(queued).reason());
        assertEquals("shutdown", await(scheduler.enqueue("XRPUSDT")).reason());
    }

    @Test
    void testInvalidSymbolsFallBackImmediately() throws Exception {
        scheduler = builder().build();

        assertEquals("invalid_symbol", await(scheduler.enqueue("  ")).reason());
        assertEquals("invalid_symbol", await(scheduler.enqueue(null)).reason());
        assertEquals("invalid_symbol", await(scheduler.enqueue("BTCUSDT", "", "binance")).reason());
        assertEquals(0, provider.singleCalls());
    }

    @Test
    void testBuilderRequiresProvider() {
        assertThrows(IllegalStateException.class, () -> IndicatorRequestScheduler.builder().build());
        assertThrows(IllegalArgumentException.class,
            () -> IndicatorRequestScheduler.builder().interCallPause(Duration.ofSeconds(-1)));
    }
}
