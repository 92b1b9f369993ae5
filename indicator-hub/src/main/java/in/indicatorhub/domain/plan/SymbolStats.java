package in.indicatorhub.domain.plan;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of what the active credentials may query.
 */
public record SymbolStats(
    PlanTier planTier,
    PlanLimits planLimits,
    boolean authoritative,
    int supportedCount,
    List<String> supportedSample,
    int blacklistedCount,
    List<String> blacklisted,
    Instant lastRefresh,
    List<String> recommendations
) {}
