package in.indicatorhub.domain.indicator;

/**
 * One indicator for one symbol, in the provider's symbol format.
 */
public record IndicatorSpec(Indicator indicator, String providerSymbol, String interval, String exchange) {

    public IndicatorSpec {
        if (indicator == null || providerSymbol == null) {
            throw new IllegalArgumentException("indicator and providerSymbol cannot be null");
        }
    }
}
