package in.linker.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * JSON response helpers shared by the handlers.
 */
final class HttpResponses {
    private static final Logger log = LoggerFactory.getLogger(HttpResponses.class);

    static final String JSON = "application/json; charset=utf-8";

    private HttpResponses() {}

    static void sendJson(ObjectMapper objectMapper, HttpServerExchange exchange, int statusCode, Object data) {
        try {
            String json = objectMapper.writeValueAsString(data);
            exchange.setStatusCode(statusCode);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON);
            exchange.getResponseSender().send(json);
        } catch (JsonProcessingException e) {
            log.error("Failed to send JSON response: {}", e.getMessage());
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON);
            exchange.getResponseSender().send("{\"error\":\"Internal server error\"}");
        }
    }

    static void sendError(ObjectMapper objectMapper, HttpServerExchange exchange, int statusCode, String message) {
        sendJson(objectMapper, exchange, statusCode, Map.of("error", message != null ? message : "Error"));
    }
}
