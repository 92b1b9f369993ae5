package in.indicatorhub.domain.indicator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Indicators requested from the provider, with their query parameters and
 * the mapping from the provider's result fields to flattened value names.
 */
public enum Indicator {
    RSI("rsi", "rsi", Map.of("period", 14), Map.of("value", "rsi")),
    MACD("macd", "macd", Map.of("optInFastPeriod", 12, "optInSlowPeriod", 26, "optInSignalPeriod", 9),
        orderedMap("valueMACD", "macd", "valueMACDSignal", "macd_signal", "valueMACDHist", "macd_histogram")),
    EMA20("ema20", "ema", Map.of("period", 20), Map.of("value", "ema20")),
    EMA50("ema50", "ema", Map.of("period", 50), Map.of("value", "ema50")),
    EMA200("ema200", "ema", Map.of("period", 200), Map.of("value", "ema200")),
    BBANDS("bbands", "bbands", Map.of("period", 20, "stddev", 2),
        orderedMap("valueUpperBand", "bb_upper", "valueMiddleBand", "bb_middle", "valueLowerBand", "bb_lower")),
    ADX("adx", "adx", Map.of("period", 14), Map.of("value", "adx")),
    ATR("atr", "atr", Map.of("period", 14), Map.of("value", "atr")),
    MFI("mfi", "mfi", Map.of("period", 14), Map.of("value", "mfi")),
    STOCHRSI("stochrsi", "stochrsi", Map.of("period", 14),
        orderedMap("valueFastK", "stochrsi_k", "valueFastD", "stochrsi_d"));

    private final String key;
    private final String endpoint;
    private final Map<String, Object> params;
    private final Map<String, String> fields;

    Indicator(String key, String endpoint, Map<String, Object> params, Map<String, String> fields) {
        this.key = key;
        this.endpoint = endpoint;
        this.params = params;
        this.fields = fields;
    }

    /** Unique key, used inside bulk correlation ids. */
    public String key() {
        return key;
    }

    /** Provider endpoint / indicator name. */
    public String endpoint() {
        return endpoint;
    }

    public Map<String, Object> params() {
        return params;
    }

    public static Indicator fromKey(String key) {
        for (Indicator indicator : values()) {
            if (indicator.key.equals(key)) {
                return indicator;
            }
        }
        throw new IllegalArgumentException("Unknown indicator key: " + key);
    }

    /**
     * Extract the flattened values from a provider result object.
     *
     * @return extracted values, or an empty map if the result is malformed
     */
    public Map<String, Double> extract(JsonNode result) {
        Map<String, Double> out = new LinkedHashMap<>();
        if (result == null || !result.isObject()) {
            return out;
        }
        for (Map.Entry<String, String> field : fields.entrySet()) {
            JsonNode node = result.get(field.getKey());
            if (node == null || !node.isNumber()) {
                return Map.of();
            }
            out.put(field.getValue(), node.asDouble());
        }
        return out;
    }

    private static Map<String, String> orderedMap(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }
}
