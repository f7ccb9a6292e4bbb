package in.linker.transport.http;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs one line per finished request: method, path, status, duration.
 */
public final class AccessLogHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger("in.linker.access");

    private final HttpHandler next;

    public AccessLogHandler(HttpHandler next) {
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        long start = System.nanoTime();
        exchange.addExchangeCompleteListener((ex, nextListener) -> {
            try {
                long micros = (System.nanoTime() - start) / 1_000;
                log.info("{} {} {} {}us", ex.getRequestMethod(), ex.getRequestPath(), ex.getStatusCode(), micros);
            } finally {
                nextListener.proceed();
            }
        });
        next.handleRequest(exchange);
    }
}
