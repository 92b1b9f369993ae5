package in.indicatorhub.infrastructure.provider;

import in.indicatorhub.domain.indicator.FallbackReason;

/**
 * Failure taxonomy for provider calls, with the policy each class drives.
 *
 * Entitlement denials are counted by the breaker as well as blacklisting the
 * symbol; malformed symbols only blacklist.
 */
public enum ProviderErrorType {
    //                  breaker weight, blacklists, fallback reason
    THROTTLED(0.0, false, FallbackReason.RATE_LIMITED),
    ENTITLEMENT_DENIED(1.0, true, FallbackReason.PLAN_LIMITATION),
    MALFORMED_SYMBOL(0.0, true, FallbackReason.INVALID_SYMBOL),
    AUTH_FAILURE(2.0, false, FallbackReason.AUTH_FAILURE),
    TRANSIENT(1.0, false, FallbackReason.PROVIDER_ERROR),
    CIRCUIT_OPEN(0.0, false, FallbackReason.CIRCUIT_OPEN);

    private final double breakerWeight;
    private final boolean blacklists;
    private final FallbackReason fallbackReason;

    ProviderErrorType(double breakerWeight, boolean blacklists, FallbackReason fallbackReason) {
        this.breakerWeight = breakerWeight;
        this.blacklists = blacklists;
        this.fallbackReason = fallbackReason;
    }

    public double breakerWeight() {
        return breakerWeight;
    }

    public boolean blacklists() {
        return blacklists;
    }

    public FallbackReason fallbackReason() {
        return fallbackReason;
    }
}
