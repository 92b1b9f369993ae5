package in.indicatorhub.domain.plan;

import in.indicatorhub.domain.indicator.FallbackReason;

/**
 * Routing decision for a symbol: call the provider, or answer with fallback only.
 */
public record SymbolRoute(
    Strategy strategy,
    String symbol,
    String providerSymbol,
    FallbackReason fallbackReason,
    String source
) {
    public enum Strategy {
        LIVE,
        FALLBACK_ONLY
    }

    public static SymbolRoute live(String symbol, String providerSymbol, String source) {
        return new SymbolRoute(Strategy.LIVE, symbol, providerSymbol, null, source);
    }

    public static SymbolRoute fallbackOnly(String symbol, FallbackReason reason) {
        return new SymbolRoute(Strategy.FALLBACK_ONLY, symbol, null, reason, reason.code());
    }

    public boolean isLive() {
        return strategy == Strategy.LIVE;
    }
}
