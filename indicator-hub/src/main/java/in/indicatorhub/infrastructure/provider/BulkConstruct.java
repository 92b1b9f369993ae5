package in.indicatorhub.infrastructure.provider;

import in.indicatorhub.domain.indicator.Indicator;

import java.util.List;

/**
 * One symbol's part of a bulk request: every indicator in {@code indicators}
 * is sent with correlation id {@code symbol:indicatorKey}.
 */
public record BulkConstruct(
    String symbol,
    String providerSymbol,
    String interval,
    String exchange,
    List<Indicator> indicators
) {
    public static final char ID_SEPARATOR = ':';

    public BulkConstruct {
        indicators = List.copyOf(indicators);
    }

    public String correlationId(Indicator indicator) {
        return symbol + ID_SEPARATOR + indicator.key();
    }
}
