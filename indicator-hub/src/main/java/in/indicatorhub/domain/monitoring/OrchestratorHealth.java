package in.indicatorhub.domain.monitoring;

import in.indicatorhub.domain.plan.PlanTier;

/**
 * Point-in-time health of one request scheduler.
 */
public record OrchestratorHealth(
    boolean breakerOpen,
    int consecutiveErrors,
    boolean rateLimited,
    int queueLength,
    int inFlight,
    int cacheSize,
    PlanTier planTier,
    String schedulerState,
    int blacklistedCount
) {
    public String status() {
        if (breakerOpen) {
            return "degraded";
        }
        return rateLimited ? "throttled" : "healthy";
    }
}
