package in.linker.bootstrap;

import in.linker.config.LinkerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Startup Config Validator Tests")
class StartupConfigValidatorTest {

    private static LinkerConfig withPort(int port) {
        LinkerConfig d = LinkerConfig.defaults();
        return new LinkerConfig(d.host(), port, d.maxBodyBytes(), d.publicBaseUrl(),
            d.dbUrl(), d.dbUser(), d.dbPass(), d.dbPoolSize(),
            d.codeLength(), d.codeAlphabet(), d.maxCollisionRetries(),
            d.cacheCapacity(), d.cacheTtl(), d.cacheIdleTimeout(),
            d.storeTimeout(), d.storeThreads());
    }

    private static LinkerConfig withBaseUrl(String url) {
        LinkerConfig d = LinkerConfig.defaults();
        return new LinkerConfig(d.host(), d.port(), d.maxBodyBytes(), url,
            d.dbUrl(), d.dbUser(), d.dbPass(), d.dbPoolSize(),
            d.codeLength(), d.codeAlphabet(), d.maxCollisionRetries(),
            d.cacheCapacity(), d.cacheTtl(), d.cacheIdleTimeout(),
            d.storeTimeout(), d.storeThreads());
    }

    @Test
    @DisplayName("Defaults are valid")
    void testDefaults() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(LinkerConfig.defaults()));
        assertDoesNotThrow(() -> StartupConfigValidator.validate(withBaseUrl("https://sho.rt/")));
    }

    @Test
    @DisplayName("Small code space only warns")
    void testSmallCodeSpace() {
        LinkerConfig tiny = LinkerConfig.defaults().withCodes(1, "a", 3);
        assertDoesNotThrow(() -> StartupConfigValidator.validate(tiny));
    }

    @Test
    @DisplayName("Invalid values refuse to start")
    void testInvalidValues() {
        LinkerConfig d = LinkerConfig.defaults();

        assertThrows(IllegalStateException.class, () -> StartupConfigValidator.validate(withPort(0)));
        assertThrows(IllegalStateException.class, () -> StartupConfigValidator.validate(withPort(70000)));
        assertThrows(IllegalStateException.class, () -> StartupConfigValidator.validate(d.withCodes(0, "abc", 3)));
        assertThrows(IllegalStateException.class, () -> StartupConfigValidator.validate(d.withCodes(6, "", 3)));
        assertThrows(IllegalStateException.class, () -> StartupConfigValidator.validate(d.withCodes(6, "abc", 0)));
        assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(d.withCache(0, Duration.ofHours(1), Duration.ofMinutes(1), Duration.ofSeconds(1))));
        assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(d.withCache(10, Duration.ZERO, Duration.ofMinutes(1), Duration.ofSeconds(1))));
        assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(d.withCache(10, Duration.ofHours(1), Duration.ofMinutes(1), Duration.ofMillis(-1))));
        assertThrows(IllegalStateException.class, () -> StartupConfigValidator.validate(withBaseUrl("not a url")));
        assertThrows(IllegalStateException.class, () -> StartupConfigValidator.validate(withBaseUrl("/relative")));
    }

    @Test
    @DisplayName("Alphabet must be unique URL-safe ASCII")
    void testAlphabet() {
        LinkerConfig d = LinkerConfig.defaults();

        IllegalStateException duplicate = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(d.withCodes(6, "abca", 3)));
        assertTrue(duplicate.getMessage().contains("duplicate"));

        assertThrows(IllegalStateException.class, () -> StartupConfigValidator.validate(d.withCodes(6, "ab/c", 3)));
        assertThrows(IllegalStateException.class, () -> StartupConfigValidator.validate(d.withCodes(6, "ab c", 3)));
        assertThrows(IllegalStateException.class, () -> StartupConfigValidator.validate(d.withCodes(6, "abé", 3)));
        assertDoesNotThrow(() -> StartupConfigValidator.validate(d.withCodes(6, "abc-_~", 3)));
    }
}
