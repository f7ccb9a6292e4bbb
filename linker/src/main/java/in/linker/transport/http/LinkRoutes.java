package in.linker.transport.http;

import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;

/**
 * Route table plus the CORS and access-log wrappers.
 *
 * <pre>
 * POST   /api/links            create
 * DELETE /api/links/{code}     delete
 * GET    /api/reverse?url=     reverse lookup
 * GET    /api/health           liveness
 * GET    /admin/links          NDJSON export
 * GET    /admin/links/{code}   stored status
 * GET    /metrics              Prometheus
 * GET    /{code}               redirect
 * </pre>
 */
public final class LinkRoutes {

    private LinkRoutes() {}

    public static HttpHandler build(LinkHandlers links, AdminHandlers admin, HttpHandler metricsHandler) {
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", links::health)
            .post("/api/links", blocking(links::create))
            .delete("/api/links/{code}", blocking(links::delete))
            .get("/api/reverse", blocking(links::reverse))
            .get("/admin/links", blocking(admin::listLinks))
            .get("/admin/links/{code}", blocking(admin::linkStatus))
            .get("/{code}", blocking(links::resolve))
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(StatusCodes.NOT_FOUND);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, HttpResponses.JSON);
                exchange.getResponseSender().send("{\"error\":\"Not found\"}");
            })
            .setInvalidMethodHandler(exchange -> {
                exchange.setStatusCode(StatusCodes.METHOD_NOT_ALLOWED);
                exchange.endExchange();
            });

        HttpHandler corsHandler = exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, DELETE, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().equals(Methods.OPTIONS)) {
                exchange.setStatusCode(StatusCodes.OK);
                exchange.endExchange();
            } else {
                routes.handleRequest(exchange);
            }
        };

        return new AccessLogHandler(corsHandler);
    }

    private static HttpHandler blocking(HttpHandler handler) {
        return new BlockingHandler(handler);
    }
}
