package in.linker.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.linker.domain.common.LinkResult;
import in.linker.domain.link.LinkRecord;
import in.linker.infrastructure.metrics.LinkMetrics;
import in.linker.service.ResolutionEngine;
import in.linker.service.cache.CacheEntry;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RequestTooBigException;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP handlers for the public link API.
 *
 * All handlers call the engine synchronously and must run on a worker thread
 * (wrap them in a BlockingHandler).
 */
public final class LinkHandlers {
    private static final Logger log = LoggerFactory.getLogger(LinkHandlers.class);

    private final ResolutionEngine engine;
    private final LinkMetrics metrics;
    private final ObjectMapper objectMapper;
    private final String publicBaseUrl;

    /**
     * @param publicBaseUrl base for returned short URLs, or null to use the
     *                      request's own scheme and Host header
     */
    public LinkHandlers(ResolutionEngine engine, LinkMetrics metrics, ObjectMapper objectMapper, String publicBaseUrl) {
        this.engine = engine;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.publicBaseUrl = stripTrailingSlash(publicBaseUrl);
    }

    /**
     * POST /api/links - Register a destination
     *
     * Body: {"url": "https://...", "hidden": false}
     */
    public void create(HttpServerExchange exchange) {
        metrics.recordHttpRequest("create");

        JsonNode body;
        try {
            byte[] data = exchange.getInputStream().readAllBytes();
            body = objectMapper.readTree(data);
        } catch (RequestTooBigException e) {
            sendError(exchange, StatusCodes.REQUEST_ENTITY_TOO_LARGE, "Request body too large");
            return;
        } catch (JsonProcessingException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid JSON body");
            return;
        } catch (IOException e) {
            log.warn("Failed to read request body: {}", e.getMessage());
            sendError(exchange, StatusCodes.BAD_REQUEST, "Failed to read request body");
            return;
        }

        if (body == null || !body.isObject()) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Body must be a JSON object");
            return;
        }
        JsonNode url = body.get("url");
        if (url == null || !url.isTextual()) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Field 'url' is required");
            return;
        }
        JsonNode hiddenNode = body.get("hidden");
        if (hiddenNode != null && !hiddenNode.isNull() && !hiddenNode.isBoolean()) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Field 'hidden' must be a boolean");
            return;
        }
        boolean hidden = hiddenNode != null && hiddenNode.asBoolean(false);

        LinkResult<LinkRecord> result = engine.create(url.asText(), hidden);
        if (!result.isOk()) {
            sendFailure(exchange, result);
            return;
        }

        LinkRecord record = result.value();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("code", record.code());
        response.put("shortUrl", shortUrl(exchange, record.code()));
        response.put("destination", record.destination());
        response.put("hidden", record.hidden());
        response.put("createdAt", record.createdAt());
        sendJson(exchange, StatusCodes.CREATED, response);
    }

    /**
     * GET /{code} - Redirect to the destination
     */
    public void resolve(HttpServerExchange exchange) {
        metrics.recordHttpRequest("resolve");

        String code = pathParam(exchange, "code");
        LinkResult<CacheEntry> result = engine.resolve(code);
        if (!result.isOk()) {
            sendFailure(exchange, result);
            return;
        }

        CacheEntry entry = result.value();
        exchange.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-store");
        if (entry.hidden()) {
            exchange.setStatusCode(StatusCodes.OK);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/html; charset=utf-8");
            exchange.getResponseSender().send(hiddenRedirectPage(entry.destination()));
            return;
        }

        exchange.setStatusCode(StatusCodes.FOUND);
        exchange.getResponseHeaders().put(Headers.LOCATION, entry.destination());
        exchange.endExchange();
    }

    /**
     * DELETE /api/links/{code} - Delete a link
     */
    public void delete(HttpServerExchange exchange) {
        metrics.recordHttpRequest("delete");

        LinkResult<Void> result = engine.delete(pathParam(exchange, "code"));
        if (!result.isOk()) {
            sendFailure(exchange, result);
            return;
        }
        exchange.setStatusCode(StatusCodes.NO_CONTENT);
        exchange.endExchange();
    }

    /**
     * GET /api/reverse?url=... - Code currently registered for a destination
     */
    public void reverse(HttpServerExchange exchange) {
        metrics.recordHttpRequest("reverse");

        Deque<String> url = exchange.getQueryParameters().get("url");
        if (url == null || url.isEmpty()) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Query parameter 'url' is required");
            return;
        }

        LinkResult<String> result = engine.reverse(url.getFirst());
        if (!result.isOk()) {
            sendFailure(exchange, result);
            return;
        }
        sendJson(exchange, StatusCodes.OK, Map.of("code", result.value()));
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        metrics.recordHttpRequest("health");
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("metrics", metrics.snapshot());
        sendJson(exchange, StatusCodes.OK, response);
    }

    String shortUrl(HttpServerExchange exchange, String code) {
        if (publicBaseUrl != null) {
            return publicBaseUrl + "/" + code;
        }
        return exchange.getRequestScheme() + "://" + exchange.getHostAndPort() + "/" + code;
    }

    /**
     * Page that redirects from script, so the destination never shows up in
     * a Location header.
     */
    String hiddenRedirectPage(String destination) {
        String jsLiteral;
        try {
            jsLiteral = objectMapper.writeValueAsString(destination).replace("</", "<\\/");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode destination", e);
        }
        return """
            <!DOCTYPE html>
            <html>
            <head><meta charset="utf-8"><meta name="referrer" content="no-referrer"><title>Redirecting</title></head>
            <body>
            <script>window.location.replace(%s);</script>
            <noscript><a href="%s">Continue</a></noscript>
            </body>
            </html>
            """.formatted(jsLiteral, escapeHtml(destination));
    }

    private void sendFailure(HttpServerExchange exchange, LinkResult<?> result) {
        sendError(exchange, HttpStatusMapper.statusFor(result.outcome()), result.message());
    }

    private void sendJson(HttpServerExchange exchange, int statusCode, Object data) {
        HttpResponses.sendJson(objectMapper, exchange, statusCode, data);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        HttpResponses.sendError(objectMapper, exchange, statusCode, message);
    }

    static String pathParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.getFirst();
    }

    private static String escapeHtml(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String stripTrailingSlash(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
