package in.linker.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LinkerConfigTest {

    private static final String[] KEYS = {"CODE_LENGTH", "CACHE_TTL_SECONDS", "STORE_TIMEOUT_MS", "PUBLIC_BASE_URL", "CACHE_CAPACITY"};

    @AfterEach
    void tearDown() {
        for (String key : KEYS) {
            System.clearProperty(key);
        }
    }

    @Test
    void testDefaults() {
        LinkerConfig config = LinkerConfig.defaults();

        assertEquals(10, config.codeLength());
        assertEquals(62, config.codeAlphabet().length());
        assertEquals(1000, config.cacheCapacity());
        assertEquals(5, config.maxCollisionRetries());
        assertNull(config.publicBaseUrl());
        assertEquals(Math.pow(62, 10), config.codeSpace());
    }

    @Test
    void testOverridesFromSystemProperties() {
        System.setProperty("CODE_LENGTH", "7");
        System.setProperty("CACHE_TTL_SECONDS", "120");
        System.setProperty("STORE_TIMEOUT_MS", "750");
        System.setProperty("PUBLIC_BASE_URL", "https://sho.rt");

        LinkerConfig config = LinkerConfig.fromEnv();

        assertEquals(7, config.codeLength());
        assertEquals(Duration.ofSeconds(120), config.cacheTtl());
        assertEquals(Duration.ofMillis(750), config.storeTimeout());
        assertEquals("https://sho.rt", config.publicBaseUrl());
    }

    @Test
    void testMalformedNumberFallsBackToDefault() {
        System.setProperty("CACHE_CAPACITY", "lots");
        assertEquals(1000, LinkerConfig.fromEnv().cacheCapacity());
    }

    @Test
    void testToStringOmitsPassword() {
        String text = LinkerConfig.defaults().toString();
        assertFalse(text.contains("dbPass"));
        assertFalse(text.toLowerCase().contains("pass"));
    }
}
