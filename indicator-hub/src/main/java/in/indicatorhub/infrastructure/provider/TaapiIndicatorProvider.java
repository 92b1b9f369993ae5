package in.indicatorhub.infrastructure.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.indicatorhub.domain.indicator.Indicator;
import in.indicatorhub.domain.indicator.IndicatorSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * TAAPI.IO indicator provider.
 *
 * Endpoints:
 * - GET  /{indicator}?secret&exchange&symbol&interval&... - single indicator
 * - POST /bulk - many indicators, each construct item tagged with an id
 * - GET  /exchange-symbols?secret&exchange - symbols permitted for the credentials
 *
 * Example bulk response:
 * <pre>
 * {"data":[{"id":"BTCUSDT:rsi","indicator":"rsi","result":{"value":54.2},"errors":[]}]}
 * </pre>
 *
 * Non-2xx responses fail the future with {@link ProviderException} carrying the
 * status and the provider's error text. The secret never appears in logs.
 */
public class TaapiIndicatorProvider implements IndicatorProvider {
    private static final Logger log = LoggerFactory.getLogger(TaapiIndicatorProvider.class);

    public static final String DEFAULT_BASE_URL = "https://api.taapi.io";
    private static final String USER_AGENT = "indicator-hub/0.1";
    private static final int MAX_ERROR_TEXT = 500;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String baseUrl;
    private final String secret;
    private final Duration requestTimeout;
    private final Duration bulkTimeout;

    public TaapiIndicatorProvider(String baseUrl, String secret, Duration requestTimeout, Duration bulkTimeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.secret = secret;
        this.requestTimeout = requestTimeout;
        this.bulkTimeout = bulkTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(requestTimeout)
            .build();
    }

    @Override
    public CompletableFuture<JsonNode> fetchIndicator(IndicatorSpec spec) {
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("secret", secret);
        query.put("exchange", spec.exchange());
        query.put("symbol", spec.providerSymbol());
        query.put("interval", spec.interval());
        query.putAll(spec.indicator().params());

        HttpRequest request = HttpRequest.newBuilder()
            .uri(buildUri("/" + spec.indicator().endpoint(), query))
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .header("User-Agent", USER_AGENT)
            .GET()
            .build();

        log.debug("[Taapi] GET /{} symbol={} interval={}",
            spec.indicator().endpoint(), spec.providerSymbol(), spec.interval());
        return send(request).thenApply(this::readTree);
    }

    @Override
    public CompletableFuture<List<BulkResult>> fetchBulk(List<BulkConstruct> constructs) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(buildBulkPayload(constructs));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new ProviderException("Failed to encode bulk request", e));
        }

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/bulk"))
            .timeout(bulkTimeout)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .header("User-Agent", USER_AGENT)
            .POST(HttpRequest.BodyPublishers.ofString(payload))
            .build();

        log.debug("[Taapi] POST /bulk constructs={}", constructs.size());
        return send(request).thenApply(body -> parseBulkResponse(readTree(body)));
    }

    @Override
    public CompletableFuture<List<String>> fetchExchangeSymbols(String exchange) {
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("secret", secret);
        query.put("exchange", exchange);

        HttpRequest request = HttpRequest.newBuilder()
            .uri(buildUri("/exchange-symbols", query))
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .header("User-Agent", USER_AGENT)
            .GET()
            .build();

        log.debug("[Taapi] GET /exchange-symbols exchange={}", exchange);
        return send(request).thenApply(body -> {
            JsonNode root = readTree(body);
            if (!root.isArray()) {
                throw new ProviderException("Expected symbol array from /exchange-symbols", null);
            }
            List<String> symbols = new ArrayList<>(root.size());
            root.forEach(node -> symbols.add(node.asText()));
            return symbols;
        });
    }

    @Override
    public String getProviderCode() {
        return "TAAPI";
    }

    ObjectNode buildBulkPayload(List<BulkConstruct> constructs) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("secret", secret);
        ArrayNode constructArray = root.putArray("construct");
        for (BulkConstruct construct : constructs) {
            ObjectNode c = constructArray.addObject();
            c.put("exchange", construct.exchange());
            c.put("symbol", construct.providerSymbol());
            c.put("interval", construct.interval());
            ArrayNode indicators = c.putArray("indicators");
            for (Indicator indicator : construct.indicators()) {
                ObjectNode item = indicators.addObject();
                item.put("id", construct.correlationId(indicator));
                item.put("indicator", indicator.endpoint());
                indicator.params().forEach((k, v) -> item.putPOJO(k, v));
            }
        }
        return root;
    }

    List<BulkResult> parseBulkResponse(JsonNode root) {
        JsonNode data = root.path("data");
        if (!data.isArray()) {
            throw new ProviderException("Bulk response has no data array", null);
        }
        List<BulkResult> results = new ArrayList<>(data.size());
        for (JsonNode item : data) {
            String id = item.path("id").asText(null);
            if (id == null) {
                log.warn("[Taapi] Skipping bulk item without id: {}", item);
                continue;
            }
            List<String> errors = new ArrayList<>();
            item.path("errors").forEach(e -> errors.add(e.asText()));
            JsonNode result = item.get("result");
            results.add(new BulkResult(id, result != null && !result.isNull() ? result : null, errors));
        }
        return results;
    }

    private CompletableFuture<String> send(HttpRequest request) {
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .thenApply(response -> {
                int status = response.statusCode();
                if (status < 200 || status >= 300) {
                    String message = extractErrorMessage(response.body());
                    log.warn("[Taapi] {} {} -> HTTP {}: {}",
                        request.method(), request.uri().getPath(), status, message);
                    throw new ProviderException(status, message, response.body());
                }
                return response.body();
            });
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Malformed JSON from provider", e);
        }
    }

    /**
     * TAAPI reports errors as {"error": "..."} or {"errors": ["..."]}.
     */
    String extractErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "empty response";
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root.hasNonNull("error")) {
                return root.get("error").asText();
            }
            JsonNode errors = root.path("errors");
            if (errors.isArray() && errors.size() > 0) {
                return errors.get(0).asText();
            }
            if (root.hasNonNull("message")) {
                return root.get("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("[Taapi] Error body is not JSON, using raw text");
        }
        return body.length() > MAX_ERROR_TEXT ? body.substring(0, MAX_ERROR_TEXT) : body;
    }

    private URI buildUri(String path, Map<String, Object> query) {
        StringBuilder sb = new StringBuilder(baseUrl).append(path);
        char sep = '?';
        for (Map.Entry<String, Object> e : query.entrySet()) {
            if (e.getValue() == null) {
                continue;
            }
            sb.append(sep)
                .append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(String.valueOf(e.getValue()), StandardCharsets.UTF_8));
            sep = '&';
        }
        return URI.create(sb.toString());
    }
}
