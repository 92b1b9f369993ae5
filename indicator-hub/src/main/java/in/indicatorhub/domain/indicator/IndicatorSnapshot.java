package in.indicatorhub.domain.indicator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable set of indicator readings for one symbol/interval/exchange.
 *
 * This is the only type handed to downstream consumers. Structured provider
 * results are flattened into named components (macd, macd_signal, bb_upper, ...).
 * When {@code fallbackData} is true the values are neutral placeholders and
 * {@code reason} carries the {@link FallbackReason} code.
 */
public record IndicatorSnapshot(
    String symbol,
    String interval,
    String exchange,
    Map<String, Double> values,
    SnapshotSource source,
    boolean fallbackData,
    int realIndicatorCount,
    String reason,
    Instant timestamp
) {
    public IndicatorSnapshot {
        if (symbol == null || source == null || timestamp == null) {
            throw new IllegalArgumentException("symbol, source and timestamp cannot be null");
        }
        values = values == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static IndicatorSnapshot live(CacheKey key, Map<String, Double> values,
                                         int realIndicatorCount, SnapshotSource source,
                                         Instant timestamp) {
        return new IndicatorSnapshot(key.symbol(), key.interval(), key.exchange(), values,
            source, false, realIndicatorCount, null, timestamp);
    }

    public double value(String name, double defaultValue) {
        Double v = values.get(name);
        return v != null ? v : defaultValue;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }
}
