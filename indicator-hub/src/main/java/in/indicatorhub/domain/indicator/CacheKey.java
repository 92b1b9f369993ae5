package in.indicatorhub.domain.indicator;

import java.util.Locale;

/**
 * Identity of an indicator request: normalized symbol + interval + exchange.
 */
public record CacheKey(String symbol, String interval, String exchange) {

    public CacheKey {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol cannot be blank");
        }
        if (interval == null || interval.isBlank()) {
            throw new IllegalArgumentException("interval cannot be blank");
        }
        if (exchange == null || exchange.isBlank()) {
            throw new IllegalArgumentException("exchange cannot be blank");
        }
        exchange = exchange.toLowerCase(Locale.ROOT);
    }

    /**
     * Two keys can share one bulk call when interval and exchange match.
     */
    public boolean sameSeries(CacheKey other) {
        return interval.equals(other.interval) && exchange.equals(other.exchange);
    }

    @Override
    public String toString() {
        return symbol + "_" + interval + "_" + exchange;
    }
}
