package in.indicatorhub.bootstrap;

import in.indicatorhub.config.IndicatorHubConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;

/**
 * Startup configuration validator.
 *
 * Runs before anything is wired. Invalid values throw IllegalStateException
 * and the process refuses to start. In production mode the checks are strict;
 * otherwise missing credentials only produce warnings.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(IndicatorHubConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");
        log.info("Production mode: {}", config.productionMode());

        validateRanges(config);

        if (config.productionMode()) {
            validateProductionMode(config);
        } else {
            warnNonProductionMode(config);
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateRanges(IndicatorHubConfig config) {
        if (config.port() <= 0 || config.port() > 65535) {
            fail("PORT must be between 1 and 65535, got " + config.port());
        }
        requirePositive("CACHE_TTL_SECONDS", config.cacheTtl());
        requirePositive("CIRCUIT_RESET_SECONDS", config.circuitResetWindow());
        requirePositive("RATE_LIMIT_COOLDOWN_SECONDS", config.rateLimitCooldown());
        requirePositive("PROVIDER_TIMEOUT_MS", config.providerTimeout());
        requirePositive("BULK_TIMEOUT_MS", config.bulkTimeout());
        requirePositive("SYMBOL_REFRESH_HOURS", config.symbolRefreshInterval());

        if (config.circuitMaxErrors() <= 0) {
            fail("CIRCUIT_MAX_ERRORS must be positive, got " + config.circuitMaxErrors());
        }
        if (config.circuitDecayFactor() < 0.0 || config.circuitDecayFactor() >= 1.0) {
            fail("CIRCUIT_DECAY_FACTOR must be in [0, 1), got " + config.circuitDecayFactor());
        }
        if (config.rateLimitMinDelay().isNegative()) {
            fail("RATE_LIMIT_MIN_DELAY_MS cannot be negative");
        }
        if (config.interCallPause().isNegative()) {
            fail("INTER_CALL_PAUSE_MS cannot be negative");
        }
        if (config.batchCollectionDelay().isNegative()) {
            fail("BATCH_COLLECTION_DELAY_MS cannot be negative");
        }
        if (config.defaultExchange() == null || config.defaultExchange().isBlank()) {
            fail("DEFAULT_EXCHANGE cannot be blank");
        }

        try {
            URI uri = URI.create(config.taapiBaseUrl());
            if (uri.getScheme() == null || uri.getHost() == null) {
                fail("TAAPI_BASE_URL must be an absolute URL, got " + config.taapiBaseUrl());
            }
        } catch (IllegalArgumentException e) {
            fail("TAAPI_BASE_URL is not a valid URL: " + e.getMessage());
        }
        log.info("✓ Value ranges valid");
    }

    /**
     * Validate production mode configuration (strict enforcement).
     */
    private static void validateProductionMode(IndicatorHubConfig config) {
        log.info("PRODUCTION MODE detected - enforcing strict validation");

        if (config.taapiSecret() == null || config.taapiSecret().isBlank()) {
            fail("PRODUCTION MODE requires TAAPI_SECRET\n" +
                "Either:\n" +
                "  1. Set TAAPI_SECRET to the provider API key\n" +
                "  2. Set PRODUCTION_MODE=false to run on fallback data only");
        }
        log.info("✓ Provider secret configured ({})", config.maskedSecret());

        if (!config.taapiBaseUrl().startsWith("https://")) {
            fail("PRODUCTION MODE forbids plain-text provider URLs\n" +
                "URL: " + config.taapiBaseUrl() + "\n" +
                "Either:\n" +
                "  1. Use an https:// TAAPI_BASE_URL\n" +
                "  2. Set PRODUCTION_MODE=false");
        }
        log.info("✓ Provider URL uses TLS: {}", config.taapiBaseUrl());

        if (config.hasExplicitMinDelay() && config.rateLimitMinDelay().compareTo(Duration.ofMillis(500)) < 0) {
            log.warn("⚠️  RATE_LIMIT_MIN_DELAY_MS={} is below any plan's spacing; expect 429s",
                config.rateLimitMinDelay().toMillis());
        }

        log.info("✅ PRODUCTION MODE validation passed");
    }

    /**
     * Warn about non-production mode (informational only).
     */
    private static void warnNonProductionMode(IndicatorHubConfig config) {
        log.warn("⚠️  NON-PRODUCTION MODE detected");
        if (config.taapiSecret() == null || config.taapiSecret().isBlank()) {
            log.warn("⚠️  TAAPI_SECRET not set - provider calls will be rejected and callers get fallback data");
        }
        if (!config.taapiBaseUrl().startsWith("https://")) {
            log.warn("⚠️  Non-TLS provider URL: {}", config.taapiBaseUrl());
        }
        if (!config.batchEnabled()) {
            log.warn("⚠️  Bulk batching disabled - every symbol costs four provider calls");
        }
    }

    private static void requirePositive(String key, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            fail(key + " must be positive, got " + value);
        }
    }

    private static void fail(String message) {
        throw new IllegalStateException("❌ INVALID CONFIG: " + message);
    }

    private StartupConfigValidator() {
        // Utility class - no instantiation
    }
}
