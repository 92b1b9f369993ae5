package in.indicatorhub.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.indicatorhub.domain.indicator.CacheKey;
import in.indicatorhub.domain.indicator.IndicatorSnapshot;
import in.indicatorhub.domain.indicator.SnapshotSource;
import in.indicatorhub.domain.plan.PlanTier;
import in.indicatorhub.infrastructure.provider.BulkConstruct;
import in.indicatorhub.infrastructure.provider.BulkResult;
import in.indicatorhub.infrastructure.provider.ProviderErrorType;
import in.indicatorhub.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchAggregatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MutableClock clock;
    private BatchAggregator aggregator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        aggregator = new BatchAggregator(new FallbackProvider(clock), true, Duration.ofMillis(250), clock);
    }

    @Test
    void testActiveOnlyForBulkPlans() {
        assertFalse(aggregator.isActive(PlanTier.FREE));
        assertFalse(aggregator.isActive(PlanTier.UNKNOWN));
        assertTrue(aggregator.isActive(PlanTier.STARTER));
        assertEquals(5, aggregator.batchSize(PlanTier.STARTER));
        assertEquals(20, aggregator.batchSize(PlanTier.PRO));
        assertEquals(1, aggregator.batchSize(PlanTier.FREE));

        BatchAggregator disabled = new BatchAggregator(new FallbackProvider(clock), false, Duration.ZERO, clock);
        assertEquals(1, disabled.batchSize(PlanTier.PRO));
    }

    @Test
    void testConstructsCarryCorrelationIds() {
        List<BulkConstruct> constructs = aggregator.buildConstructs(List.of(member("BTCUSDT"), member("ETHUSDT")));

        assertEquals(2, constructs.size());
        assertEquals("ETH/USDT", constructs.get(1).providerSymbol());
        assertEquals(BatchAggregator.BULK_INDICATORS, constructs.get(0).indicators());
        assertEquals("BTCUSDT:rsi", constructs.get(0).correlationId(constructs.get(0).indicators().get(0)));
    }

    @Test
    void testDemultiplexFiveSymbolsWithOneMissing() throws Exception {
        List<BatchAggregator.Member> members = List.of(
            member("BTCUSDT"), member("ETHUSDT"), member("XRPUSDT"), member("LTCUSDT"), member("XMRUSDT"));

        List<BulkResult> results = new ArrayList<>();
        for (String symbol : List.of("BTCUSDT", "ETHUSDT", "XRPUSDT", "LTCUSDT")) {
            results.add(ok(symbol + ":rsi", "{\"value\":60.0}"));
            results.add(ok(symbol + ":macd",
                "{\"valueMACD\":1.5,\"valueMACDSignal\":1.2,\"valueMACDHist\":0.3}"));
        }

        BatchAggregator.BatchOutcome outcome = aggregator.demultiplex(members, results);

        assertEquals(5, outcome.snapshots().size());
        for (String symbol : List.of("BTCUSDT", "ETHUSDT", "XRPUSDT", "LTCUSDT")) {
            IndicatorSnapshot snapshot = outcome.snapshots().get(key(symbol));
            assertFalse(snapshot.fallbackData(), symbol + " should be live");
            assertEquals(SnapshotSource.BATCH, snapshot.source());
            assertEquals(2, snapshot.realIndicatorCount());
            assertEquals(60.0, snapshot.value("rsi", 0), 1e-9);
            assertEquals(0.3, snapshot.value("macd_histogram", 0), 1e-9);
        }

        IndicatorSnapshot missing = outcome.snapshots().get(key("XMRUSDT"));
        assertTrue(missing.fallbackData());
        assertEquals("missing_from_batch", missing.reason());
        assertTrue(outcome.rejected().isEmpty());
    }

    @Test
    void testMalformedItemsCountAsMissing() throws Exception {
        List<BulkResult> results = List.of(
            ok("BTCUSDT:rsi", "{\"value\":\"n/a\"}"),
            ok("BTCUSDT:macd", "{\"valueMACD\":1.0}"),
            ok("ETHUSDT:rsi", "{\"value\":40.0}"),
            ok("ETHUSDT:bbands", "[]"));

        BatchAggregator.BatchOutcome outcome =
            aggregator.demultiplex(List.of(member("BTCUSDT"), member("ETHUSDT")), results);

        assertTrue(outcome.snapshots().get(key("BTCUSDT")).fallbackData());
        IndicatorSnapshot eth = outcome.snapshots().get(key("ETHUSDT"));
        assertFalse(eth.fallbackData(), "Partially populated symbol is still live");
        assertEquals(1, eth.realIndicatorCount());
    }

    @Test
    void testUnanimousEntitlementErrorsRejectSymbol() {
        List<BulkResult> results = List.of(
            new BulkResult("DOGEUSDT:rsi", null, List.of("Free plans only permits [BTC/USDT]")),
            new BulkResult("DOGEUSDT:macd", null, List.of("Free plans only permits [BTC/USDT]")),
            new BulkResult("SHIBUSDT:rsi", null, List.of("Not enough candles")));

        BatchAggregator.BatchOutcome outcome =
            aggregator.demultiplex(List.of(member("DOGEUSDT"), member("SHIBUSDT")), results);

        assertEquals(ProviderErrorType.ENTITLEMENT_DENIED, outcome.rejected().get(key("DOGEUSDT")));
        assertEquals("plan_limitation", outcome.snapshots().get(key("DOGEUSDT")).reason());
        assertFalse(outcome.rejected().containsKey(key("SHIBUSDT")), "Ambiguous errors never blacklist");
        assertEquals("missing_from_batch", outcome.snapshots().get(key("SHIBUSDT")).reason());
    }

    @Test
    void testMixedErrorsDoNotReject() throws Exception {
        List<BulkResult> results = List.of(
            new BulkResult("DOGEUSDT:rsi", null, List.of("Invalid symbol")),
            ok("DOGEUSDT:macd", "{\"valueMACD\":1.0}"));

        BatchAggregator.BatchOutcome outcome = aggregator.demultiplex(List.of(member("DOGEUSDT")), results);

        assertTrue(outcome.rejected().isEmpty());
    }

    @Test
    void testUnexpectedIdsIgnored() throws Exception {
        List<BulkResult> results = List.of(
            ok("garbage", "{\"value\":1.0}"),
            ok("BTCUSDT:unknown", "{\"value\":1.0}"),
            ok("BTCUSDT:rsi", "{\"value\":70.0}"));

        BatchAggregator.BatchOutcome outcome = aggregator.demultiplex(List.of(member("BTCUSDT")), results);

        IndicatorSnapshot btc = outcome.snapshots().get(key("BTCUSDT"));
        assertEquals(1, btc.realIndicatorCount());
        assertEquals(70.0, btc.value("rsi", 0), 1e-9);
    }

    private BulkResult ok(String id, String json) throws Exception {
        JsonNode result = mapper.readTree(json);
        return new BulkResult(id, result, List.of());
    }

    private static CacheKey key(String symbol) {
        return new CacheKey(symbol, "1h", "binance");
    }

    private static BatchAggregator.Member member(String symbol) {
        return new BatchAggregator.Member(key(symbol), SymbolCapabilityManager.toProviderFormat(symbol));
    }
}
