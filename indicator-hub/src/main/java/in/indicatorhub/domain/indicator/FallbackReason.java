package in.indicatorhub.domain.indicator;

/**
 * Why a fallback snapshot was returned instead of provider data.
 * The code is embedded in the snapshot so downstream scoring can discount it.
 */
public enum FallbackReason {
    CIRCUIT_OPEN("circuit_open"),
    RATE_LIMITED("rate_limited"),
    PLAN_LIMITATION("plan_limitation"),
    INVALID_SYMBOL("invalid_symbol"),
    BLACKLISTED("blacklisted"),
    UNSUPPORTED_BY_PLAN("unsupported_by_plan"),
    AUTH_FAILURE("auth_failure"),
    PROVIDER_ERROR("provider_error"),
    MISSING_FROM_BATCH("missing_from_batch"),
    EMERGENCY_DRAIN("emergency_drain"),
    SHUTDOWN("shutdown");

    private final String code;

    FallbackReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
