package in.indicatorhub.config;

import in.indicatorhub.infrastructure.provider.TaapiIndicatorProvider;
import in.indicatorhub.util.Env;

import java.time.Duration;

/**
 * Process configuration, read once at startup from environment variables
 * (or system properties of the same name).
 *
 * A {@code rateLimitMinDelay} of zero means "derive from the detected plan tier".
 */
public record IndicatorHubConfig(
    String taapiSecret,
    String taapiBaseUrl,
    int port,
    String defaultExchange,
    Duration cacheTtl,
    int circuitMaxErrors,
    Duration circuitResetWindow,
    double circuitDecayFactor,
    Duration rateLimitMinDelay,
    Duration rateLimitCooldown,
    Duration interCallPause,
    boolean batchEnabled,
    Duration batchCollectionDelay,
    Duration providerTimeout,
    Duration bulkTimeout,
    Duration symbolRefreshInterval,
    boolean productionMode
) {

    public static IndicatorHubConfig fromEnv() {
        return new IndicatorHubConfig(
            Env.get("TAAPI_SECRET", null),
            Env.get("TAAPI_BASE_URL", TaapiIndicatorProvider.DEFAULT_BASE_URL),
            Env.getInt("PORT", 9090),
            Env.get("DEFAULT_EXCHANGE", "binance"),
            Duration.ofSeconds(Env.getLong("CACHE_TTL_SECONDS", 300)),
            Env.getInt("CIRCUIT_MAX_ERRORS", 3),
            Duration.ofSeconds(Env.getLong("CIRCUIT_RESET_SECONDS", 300)),
            Env.getDouble("CIRCUIT_DECAY_FACTOR", 0.5),
            Duration.ofMillis(Env.getLong("RATE_LIMIT_MIN_DELAY_MS", 0)),
            Duration.ofSeconds(Env.getLong("RATE_LIMIT_COOLDOWN_SECONDS", 60)),
            Duration.ofMillis(Env.getLong("INTER_CALL_PAUSE_MS", 2000)),
            Env.getBool("BATCH_ENABLED", true),
            Duration.ofMillis(Env.getLong("BATCH_COLLECTION_DELAY_MS", 250)),
            Duration.ofMillis(Env.getLong("PROVIDER_TIMEOUT_MS", 10_000)),
            Duration.ofMillis(Env.getLong("BULK_TIMEOUT_MS", 30_000)),
            Duration.ofHours(Env.getLong("SYMBOL_REFRESH_HOURS", 24)),
            Env.getBool("PRODUCTION_MODE", false)
        );
    }

    public boolean hasExplicitMinDelay() {
        return !rateLimitMinDelay.isZero();
    }

    /**
     * Secret with everything but the last four characters masked, for logs.
     */
    public String maskedSecret() {
        if (taapiSecret == null || taapiSecret.isEmpty()) {
            return "<unset>";
        }
        if (taapiSecret.length() <= 4) {
            return "****";
        }
        return "****" + taapiSecret.substring(taapiSecret.length() - 4);
    }
}
