package in.indicatorhub.application.service;

import in.indicatorhub.domain.indicator.FallbackReason;
import in.indicatorhub.domain.indicator.IndicatorSnapshot;
import in.indicatorhub.domain.indicator.SnapshotSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds neutral, clearly-marked snapshots for requests the provider cannot serve.
 *
 * Neutral values: RSI/MFI 50 (mid-range), Stoch-RSI 50/50, ADX 25 (no trend),
 * everything else 0.
 */
public class FallbackProvider {
    private static final Logger log = LoggerFactory.getLogger(FallbackProvider.class);

    static final Map<String, Double> NEUTRAL_VALUES;

    static {
        Map<String, Double> v = new LinkedHashMap<>();
        v.put("rsi", 50.0);
        v.put("macd", 0.0);
        v.put("macd_signal", 0.0);
        v.put("macd_histogram", 0.0);
        v.put("ema20", 0.0);
        v.put("ema50", 0.0);
        v.put("ema200", 0.0);
        v.put("bb_upper", 0.0);
        v.put("bb_middle", 0.0);
        v.put("bb_lower", 0.0);
        v.put("adx", 25.0);
        v.put("atr", 0.0);
        v.put("mfi", 50.0);
        v.put("stochrsi_k", 50.0);
        v.put("stochrsi_d", 50.0);
        NEUTRAL_VALUES = Collections.unmodifiableMap(v);
    }

    private final Clock clock;

    public FallbackProvider(Clock clock) {
        this.clock = clock;
    }

    public FallbackProvider() {
        this(Clock.systemUTC());
    }

    /**
     * @param detail optional extra context for the log; not exposed to callers
     */
    public IndicatorSnapshot build(String symbol, String interval, String exchange,
                                   FallbackReason reason, String detail) {
        if (detail != null) {
            log.debug("[Fallback] {} {} {} -> {} ({})", symbol, interval, exchange, reason.code(), detail);
        }
        return new IndicatorSnapshot(symbol, interval, exchange, NEUTRAL_VALUES,
            SnapshotSource.FALLBACK, true, 0, reason.code(), clock.instant());
    }

    public IndicatorSnapshot build(String symbol, String interval, String exchange, FallbackReason reason) {
        return build(symbol, interval, exchange, reason, null);
    }
}
