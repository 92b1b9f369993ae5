package in.indicatorhub.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import in.indicatorhub.domain.indicator.IndicatorSpec;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port to the external indicator-computation API.
 *
 * All calls are asynchronous. Failures complete the future exceptionally,
 * with {@link ProviderException} for error responses so that
 * {@link ProviderErrorClassifier} can tell them apart.
 */
public interface IndicatorProvider {

    /**
     * Fetch one indicator for one symbol.
     *
     * @return the raw result object (e.g. {"value": 54.2})
     */
    CompletableFuture<JsonNode> fetchIndicator(IndicatorSpec spec);

    /**
     * Fetch many indicators for many symbols in a single call.
     *
     * @return result items, each carrying the correlation id it was requested with
     */
    CompletableFuture<List<BulkResult>> fetchBulk(List<BulkConstruct> constructs);

    /**
     * List the symbols the active credentials may query on an exchange,
     * in the provider's symbol format.
     */
    CompletableFuture<List<String>> fetchExchangeSymbols(String exchange);

    /**
     * Provider name, for logs and metrics.
     */
    String getProviderCode();
}
