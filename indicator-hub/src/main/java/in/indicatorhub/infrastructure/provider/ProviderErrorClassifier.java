package in.indicatorhub.infrastructure.provider;

import in.indicatorhub.infrastructure.provider.common.CircuitOpenException;
import in.indicatorhub.infrastructure.provider.common.RateLimitedException;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps provider failures onto {@link ProviderErrorType}.
 * Called once per failed call; everything downstream keys off the result.
 */
public final class ProviderErrorClassifier {

    public static ProviderErrorType classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof CircuitOpenException) {
            return ProviderErrorType.CIRCUIT_OPEN;
        }
        if (cause instanceof RateLimitedException) {
            return ProviderErrorType.THROTTLED;
        }
        if (cause instanceof ProviderException pe && pe.getStatusCode() > 0) {
            return fromStatus(pe.getStatusCode());
        }
        // timeouts, connection failures, unparseable bodies
        return ProviderErrorType.TRANSIENT;
    }

    public static ProviderErrorType fromStatus(int statusCode) {
        return switch (statusCode) {
            case 429 -> ProviderErrorType.THROTTLED;
            case 403 -> ProviderErrorType.ENTITLEMENT_DENIED;
            case 400 -> ProviderErrorType.MALFORMED_SYMBOL;
            case 401 -> ProviderErrorType.AUTH_FAILURE;
            default -> ProviderErrorType.TRANSIENT;
        };
    }

    /**
     * Classify the free-text error attached to a single bulk result item.
     * Only unambiguous rejections are recognised.
     */
    public static Optional<ProviderErrorType> classifyMessage(String message) {
        if (message == null || message.isBlank()) {
            return Optional.empty();
        }
        String m = message.toLowerCase(Locale.ROOT);
        if (m.contains("only permits") || m.contains("upgrade") || m.contains("not available on your plan")) {
            return Optional.of(ProviderErrorType.ENTITLEMENT_DENIED);
        }
        if (m.contains("invalid symbol") || m.contains("symbol not found") || m.contains("does not exist")
            || m.contains("not supported on exchange")) {
            return Optional.of(ProviderErrorType.MALFORMED_SYMBOL);
        }
        return Optional.empty();
    }

    /**
     * Whether the failure means the request never left this process.
     */
    public static boolean isLocal(Throwable error) {
        Throwable cause = unwrap(error);
        return cause instanceof CircuitOpenException || cause instanceof RateLimitedException;
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private ProviderErrorClassifier() {}
}
