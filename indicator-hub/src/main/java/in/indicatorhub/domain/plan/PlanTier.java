package in.indicatorhub.domain.plan;

/**
 * Provider subscription tier, detected from the size of the permitted symbol list.
 */
public enum PlanTier {
    UNKNOWN(new PlanLimits(5, 4, 1_000, 1)),
    FREE(new PlanLimits(5, 4, 1_000, 1)),
    STARTER(new PlanLimits(100, 30, 10_000, 5)),
    PRO(new PlanLimits(-1, 120, -1, 20));

    private static final int FREE_MAX_SYMBOLS = 5;
    private static final int STARTER_MAX_SYMBOLS = 100;

    private final PlanLimits limits;

    PlanTier(PlanLimits limits) {
        this.limits = limits;
    }

    public PlanLimits limits() {
        return limits;
    }

    public static PlanTier fromSymbolCount(int symbolCount) {
        if (symbolCount <= FREE_MAX_SYMBOLS) {
            return FREE;
        }
        if (symbolCount <= STARTER_MAX_SYMBOLS) {
            return STARTER;
        }
        return PRO;
    }
}
