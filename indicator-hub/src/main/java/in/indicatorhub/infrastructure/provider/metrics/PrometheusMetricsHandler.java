package in.indicatorhub.infrastructure.provider.metrics;

import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.Set;

/**
 * HTTP handler for the Prometheus /metrics endpoint.
 *
 * Honours the scraper's Accept header (Prometheus text 0.0.4 or OpenMetrics)
 * and the standard {@code name[]} query parameter for scraping a subset:
 * <pre>
 * GET /metrics?name[]=indicator_queue_length&amp;name[]=indicator_circuit_breaker_open
 * </pre>
 *
 * Example output:
 * <pre>
 * # HELP indicator_provider_calls_total Total number of indicator provider calls
 * # TYPE indicator_provider_calls_total counter
 * indicator_provider_calls_total{call_type="BULK",outcome="success",} 42.0
 * indicator_provider_calls_total{call_type="SINGLE",outcome="TRANSIENT",} 3.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Set<String> names = requestedNames(exchange);
        Enumeration<Collector.MetricFamilySamples> samples = names.isEmpty()
            ? registry.metricFamilySamples()
            : registry.filteredMetricFamilySamples(names);

        StringWriter writer = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, writer, samples);
        } catch (IOException e) {
            log.error("[PrometheusMetricsHandler] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
            return;
        }

        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(writer.toString());
        log.debug("[PrometheusMetricsHandler] Served {} bytes ({}{})", writer.getBuffer().length(),
            contentType.startsWith(TextFormat.CONTENT_TYPE_OPENMETRICS_100) ? "openmetrics" : "text",
            names.isEmpty() ? "" : ", " + names.size() + " names");
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        return values == null ? Set.of() : new HashSet<>(values);
    }
}
