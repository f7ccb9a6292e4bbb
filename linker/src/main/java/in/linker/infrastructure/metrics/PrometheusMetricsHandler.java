package in.linker.infrastructure.metrics;

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
 * GET /metrics - scrape endpoint for the link registry.
 *
 * The exposition format follows the Accept header (Prometheus text 0.0.4 by
 * default, OpenMetrics when asked for). Repeated {@code name[]} parameters
 * restrict the output to those sample names:
 * <pre>
 * GET /metrics?name[]=linker_creates_total&amp;name[]=linker_cache_size
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

        StringWriter body = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, body, samples);
        } catch (IOException e) {
            log.error("[METRICS] Exposition failed: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
            return;
        }

        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(body.toString());
        log.debug("[METRICS] Scrape served: names={}, format={}", names.isEmpty() ? "all" : names, contentType);
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        return values == null ? Set.of() : new HashSet<>(values);
    }
}
