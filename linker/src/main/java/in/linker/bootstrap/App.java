package in.linker.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.linker.config.LinkerConfig;
import in.linker.domain.repository.LinkRepository;
import in.linker.infrastructure.metrics.MeteredLinkRepository;
import in.linker.infrastructure.metrics.PrometheusLinkMetrics;
import in.linker.infrastructure.metrics.PrometheusMetricsHandler;
import in.linker.infrastructure.persistence.PostgresLinkRepository;
import in.linker.migration.LinksTableMigration;
import in.linker.security.InputValidator;
import in.linker.service.ResolutionEngine;
import in.linker.service.cache.ResolutionCache;
import in.linker.service.code.RandomCodeGenerator;
import in.linker.transport.http.AdminHandlers;
import in.linker.transport.http.LinkHandlers;
import in.linker.transport.http.LinkRoutes;
import in.linker.util.Json;
import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import io.undertow.server.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Link service entry point.
 *
 * Wiring: Hikari pool → links migration → Postgres repository (metered) →
 * resolution cache → engine → Undertow routes.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Linker Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        LinkerConfig config = LinkerConfig.fromEnv();
        StartupConfigValidator.validate(config);

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource(config);
        new LinksTableMigration(dataSource).migrate();

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusLinkMetrics metrics = new PrometheusLinkMetrics();
        log.info("✓ Prometheus metrics initialized");

        LinkRepository repository = new MeteredLinkRepository(
            new PostgresLinkRepository(dataSource, config.storeTimeout()), metrics);

        // ═══════════════════════════════════════════════════════════════
        // Resolution engine
        // ═══════════════════════════════════════════════════════════════
        ExecutorService storeExecutor = createStoreExecutor(config.storeThreads());
        ResolutionCache cache = new ResolutionCache(
            config.cacheCapacity(),
            config.cacheTtl(),
            config.cacheIdleTimeout(),
            config.storeTimeout(),
            storeExecutor);

        ResolutionEngine engine = new ResolutionEngine(
            repository,
            cache,
            new RandomCodeGenerator(config.codeAlphabet(), config.codeLength()),
            new InputValidator(config.codeLength(), config.codeAlphabet()),
            config.maxCollisionRetries(),
            metrics);
        log.info("✓ Resolution engine ready: cacheCapacity={}, codeLength={}",
            config.cacheCapacity(), config.codeLength());

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        ObjectMapper objectMapper = Json.newMapper();
        HttpHandler root = LinkRoutes.build(
            new LinkHandlers(engine, metrics, objectMapper, config.publicBaseUrl()),
            new AdminHandlers(engine, metrics, objectMapper),
            new PrometheusMetricsHandler(metrics.getRegistry()));

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), config.host())
            .setServerOption(UndertowOptions.MAX_ENTITY_SIZE, config.maxBodyBytes())
            .setHandler(root)
            .build();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            storeExecutor.shutdown();
            try {
                if (!storeExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    storeExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                storeExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            dataSource.close();
            log.info("✓ Shutdown complete");
        }, "linker-shutdown"));

        server.start();
        log.info("✓ Linker started on http://{}:{}/", config.host(), config.port());
    }

    static HikariDataSource createDataSource(LinkerConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPass());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(Math.min(2, config.dbPoolSize()));
        hikari.setConnectionTimeout(Math.max(250, config.storeTimeout().toMillis()));
        hikari.setPoolName("linker-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }

    static ExecutorService createStoreExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "linker-store-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
