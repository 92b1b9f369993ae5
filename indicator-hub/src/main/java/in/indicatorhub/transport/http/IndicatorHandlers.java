package in.indicatorhub.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.indicatorhub.application.service.IndicatorRequestScheduler;
import in.indicatorhub.application.service.SymbolCapabilityManager;
import in.indicatorhub.domain.indicator.IndicatorSnapshot;
import in.indicatorhub.domain.monitoring.OrchestratorHealth;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.SameThreadExecutor;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP handlers for the indicator API.
 *
 * Endpoints:
 * - GET  /api/indicators/{symbol}?interval=1h&exchange=binance - indicator snapshot
 * - GET  /api/indicators/health - scheduler, breaker and limiter health
 * - GET  /api/indicators/symbols - plan tier and symbol capability stats
 * - POST /api/indicators/reset - clear breaker / limiter / cache, drain queue
 * - POST /api/indicators/flush - drain now
 * - POST /api/indicators/symbols/refresh - forget blacklist, rediscover symbols
 */
public final class IndicatorHandlers {
    private static final Logger log = LoggerFactory.getLogger(IndicatorHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final IndicatorRequestScheduler scheduler;
    private final SymbolCapabilityManager capabilities;
    private final String defaultExchange;

    public IndicatorHandlers(IndicatorRequestScheduler scheduler, String defaultExchange) {
        this.scheduler = scheduler;
        this.capabilities = scheduler.getCapabilities();
        this.defaultExchange = defaultExchange;
    }

    /**
     * GET /api/indicators/{symbol}
     *
     * Always 200: failures are reported inside the snapshot (fallbackData / reason).
     */
    public void indicators(HttpServerExchange exchange) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        String symbol = match != null ? match.getParameters().get("symbol") : null;
        if (symbol == null || symbol.isBlank()) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "symbol is required");
            return;
        }
        String interval = queryParam(exchange, "interval", IndicatorRequestScheduler.DEFAULT_INTERVAL);
        String exch = queryParam(exchange, "exchange", defaultExchange);

        respondAsync(exchange, scheduler.enqueue(symbol, interval, exch), "GET /api/indicators/" + symbol);
    }

    /**
     * GET /api/indicators/health
     */
    public void health(HttpServerExchange exchange) {
        try {
            OrchestratorHealth health = scheduler.getHealth();
            ObjectNode body = MAPPER.valueToTree(health);
            body.put("status", health.status());
            body.put("ts", Instant.now().toString());
            sendJson(exchange, StatusCodes.OK, body.toString());
        } catch (Exception e) {
            log.error("GET /api/indicators/health failed: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to read health: " + e.getMessage());
        }
    }

    /**
     * GET /api/indicators/symbols
     */
    public void symbols(HttpServerExchange exchange) {
        try {
            sendJson(exchange, StatusCodes.OK, MAPPER.writeValueAsString(capabilities.getStats()));
        } catch (Exception e) {
            log.error("GET /api/indicators/symbols failed: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to read symbol stats: " + e.getMessage());
        }
    }

    /**
     * POST /api/indicators/reset
     */
    public void reset(HttpServerExchange exchange) {
        log.warn("POST /api/indicators/reset from {}", exchange.getSourceAddress());
        respondAsync(exchange, scheduler.forceReset().thenApply(drained -> {
            ObjectNode body = MAPPER.createObjectNode();
            body.put("success", true);
            body.put("drained", drained);
            return body;
        }), "POST /api/indicators/reset");
    }

    /**
     * POST /api/indicators/flush
     */
    public void flush(HttpServerExchange exchange) {
        respondAsync(exchange, scheduler.forceFlush().thenApply(queued -> {
            ObjectNode body = MAPPER.createObjectNode();
            body.put("success", true);
            body.put("queued", queued);
            return body;
        }), "POST /api/indicators/flush");
    }

    /**
     * POST /api/indicators/symbols/refresh
     */
    public void refreshSymbols(HttpServerExchange exchange) {
        log.warn("POST /api/indicators/symbols/refresh from {}", exchange.getSourceAddress());
        respondAsync(exchange, capabilities.refreshSymbols().thenApply(tier -> capabilities.getStats()),
            "POST /api/indicators/symbols/refresh");
    }

    /**
     * Complete the exchange when the future does, without holding an IO thread.
     */
    private void respondAsync(HttpServerExchange exchange, CompletableFuture<?> future, String route) {
        exchange.dispatch(SameThreadExecutor.INSTANCE, () ->
            future.whenComplete((result, error) -> {
                if (error != null) {
                    log.error("{} failed: {}", route, error.getMessage(), error);
                    sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, error.getMessage());
                    return;
                }
                try {
                    sendJson(exchange, StatusCodes.OK, MAPPER.writeValueAsString(result));
                    if (result instanceof IndicatorSnapshot snapshot) {
                        log.debug("{} -> {} ({})", route, snapshot.source(), snapshot.reason());
                    }
                } catch (Exception e) {
                    log.error("{} serialization failed: {}", route, e.getMessage(), e);
                    sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Serialization failed");
                }
            }));
    }

    private static String queryParam(HttpServerExchange exchange, String name, String defaultValue) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty() || values.peekFirst().isBlank()) {
            return defaultValue;
        }
        return values.peekFirst();
    }

    private static void sendJson(HttpServerExchange exchange, int statusCode, String json) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    /**
     * Send error response.
     */
    private static void sendError(HttpServerExchange exchange, int statusCode, String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("success", false);
        body.put("error", message);
        sendJson(exchange, statusCode, body.toString());
    }
}
