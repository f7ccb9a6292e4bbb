package in.linker.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import in.linker.domain.common.LinkResult;
import in.linker.domain.link.LinkRecord;
import in.linker.domain.link.LinkStatus;
import in.linker.infrastructure.metrics.LinkMetrics;
import in.linker.service.ResolutionEngine;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Admin endpoints: full link export and stored status per code.
 *
 * Unauthenticated; bind the listener to a private interface or put a proxy in
 * front when exposing the service.
 */
public final class AdminHandlers {
    private static final Logger log = LoggerFactory.getLogger(AdminHandlers.class);
    private static final byte[] NEWLINE = {'\n'};

    private final ResolutionEngine engine;
    private final LinkMetrics metrics;
    private final ObjectMapper objectMapper;

    public AdminHandlers(ResolutionEngine engine, LinkMetrics metrics, ObjectMapper objectMapper) {
        this.engine = engine;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    /**
     * GET /admin/links - Every stored link as newline-delimited JSON
     *
     * Rows stream straight from the store. A store failure after the first
     * row has gone out can only truncate the response.
     */
    public void listLinks(HttpServerExchange exchange) {
        metrics.recordHttpRequest("admin_list");

        ObjectWriter writer = objectMapper.writer();
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/x-ndjson; charset=utf-8");

        OutputStream out = exchange.getOutputStream();
        AtomicLong written = new AtomicLong();
        LinkResult<Long> result;
        try {
            result = engine.export(record -> {
                try {
                    out.write(writer.writeValueAsBytes(toJson(record)));
                    out.write(NEWLINE);
                    written.incrementAndGet();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            log.warn("Link export aborted, client write failed: {}", e.getCause().getMessage());
            exchange.endExchange();
            return;
        }

        if (!result.isOk()) {
            if (written.get() > 0) {
                log.error("Link export truncated after {} links: {}", written.get(), result.message());
                exchange.endExchange();
            } else {
                exchange.getResponseHeaders().remove(Headers.CONTENT_TYPE);
                HttpResponses.sendError(objectMapper, exchange,
                    HttpStatusMapper.statusFor(result.outcome()), result.message());
            }
            return;
        }

        log.debug("Exported {} links", result.value());
        exchange.endExchange();
    }

    /**
     * GET /admin/links/{code} - Stored status of a code (ACTIVE or DELETED)
     */
    public void linkStatus(HttpServerExchange exchange) {
        metrics.recordHttpRequest("admin_status");

        String code = LinkHandlers.pathParam(exchange, "code");
        LinkResult<LinkStatus> result = engine.status(code);
        if (!result.isOk()) {
            HttpResponses.sendError(objectMapper, exchange,
                HttpStatusMapper.statusFor(result.outcome()), result.message());
            return;
        }
        HttpResponses.sendJson(objectMapper, exchange, StatusCodes.OK,
            Map.of("code", code, "status", result.value().name()));
    }

    private static Map<String, Object> toJson(LinkRecord record) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("code", record.code());
        map.put("destination", record.destination());
        map.put("hidden", record.hidden());
        map.put("status", record.status().name());
        map.put("createdAt", record.createdAt());
        map.put("updatedAt", record.updatedAt());
        return map;
    }
}
