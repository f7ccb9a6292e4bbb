package in.linker.bootstrap;

import in.linker.config.LinkerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Startup configuration validator.
 *
 * Runs from App.main() before anything connects or binds.
 * Throws IllegalStateException if the configuration is unusable; small but
 * legal code spaces only produce a warning.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    // Below this many codes per expected link, collisions dominate create latency
    static final double SMALL_CODE_SPACE = 1_000_000d;

    private StartupConfigValidator() {}

    /**
     * @throws IllegalStateException if the configuration is invalid
     */
    public static void validate(LinkerConfig config) {
        log.info("Running startup config validation...");

        require(config.port() > 0 && config.port() <= 65535, "PORT must be 1-65535, got " + config.port());
        require(config.maxBodyBytes() > 0, "MAX_BODY_BYTES must be positive");
        require(config.dbPoolSize() > 0, "DB_POOL_SIZE must be positive");

        validateCodes(config);

        require(config.cacheCapacity() > 0, "CACHE_CAPACITY must be positive");
        requirePositive(config.cacheTtl(), "CACHE_TTL_SECONDS");
        requirePositive(config.cacheIdleTimeout(), "CACHE_IDLE_SECONDS");
        requirePositive(config.storeTimeout(), "STORE_TIMEOUT_MS");
        require(config.storeThreads() > 0, "STORE_THREADS must be positive");

        if (config.publicBaseUrl() != null) {
            validateBaseUrl(config.publicBaseUrl());
        }

        log.info("✓ Startup config validation passed: {}", config);
    }

    private static void validateCodes(LinkerConfig config) {
        String alphabet = config.codeAlphabet();
        require(config.codeLength() > 0, "CODE_LENGTH must be positive");
        require(alphabet != null && !alphabet.isEmpty(), "CODE_ALPHABET cannot be empty");
        require(config.maxCollisionRetries() > 0, "MAX_COLLISION_RETRIES must be positive");

        Set<Character> seen = new HashSet<>();
        for (char c : alphabet.toCharArray()) {
            require(c > ' ' && c < 127 && c != '/' && c != '?' && c != '#' && c != '%',
                "CODE_ALPHABET must contain URL-safe printable ASCII only, got '" + c + "'");
            require(seen.add(c), "CODE_ALPHABET contains duplicate symbol '" + c + "'");
        }

        double space = config.codeSpace();
        if (space < SMALL_CODE_SPACE) {
            log.warn("⚠️ Small code space: {} codes ({} symbols, length {}). Creates will exhaust quickly.",
                (long) space, alphabet.length(), config.codeLength());
        }
    }

    private static void validateBaseUrl(String url) {
        try {
            URI uri = new URI(url);
            require(uri.isAbsolute() && uri.getHost() != null,
                "PUBLIC_BASE_URL must be an absolute URL with a host, got " + url);
        } catch (URISyntaxException e) {
            throw new IllegalStateException("❌ INVALID CONFIG: PUBLIC_BASE_URL is not a valid URL: " + url, e);
        }
    }

    private static void requirePositive(Duration d, String key) {
        require(d != null && !d.isNegative() && !d.isZero(), key + " must be positive");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException("❌ INVALID CONFIG: " + message + "\nSystem refuses to start.");
        }
    }
}
