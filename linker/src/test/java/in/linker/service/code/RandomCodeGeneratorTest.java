package in.linker.service.code;

import in.linker.config.LinkerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Random Code Generator Tests")
class RandomCodeGeneratorTest {

    @Test
    @DisplayName("Codes have the configured length and only alphabet symbols")
    void testLengthAndAlphabet() {
        RandomCodeGenerator generator = new RandomCodeGenerator(LinkerConfig.ALPHANUMERIC, 10);

        for (int i = 0; i < 1000; i++) {
            String code = generator.generate();
            assertEquals(10, code.length());
            for (char c : code.toCharArray()) {
                assertTrue(LinkerConfig.ALPHANUMERIC.indexOf(c) >= 0, "Unexpected symbol: " + c);
            }
        }
    }

    @Test
    @DisplayName("Large code space rarely repeats")
    void testUniqueness() {
        RandomCodeGenerator generator = new RandomCodeGenerator(LinkerConfig.ALPHANUMERIC, 10);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            seen.add(generator.generate());
        }
        assertEquals(10_000, seen.size());
    }

    @Test
    @DisplayName("Single-symbol alphabet always yields the same code")
    void testSingleSymbolAlphabet() {
        RandomCodeGenerator generator = new RandomCodeGenerator("a", 3);
        assertEquals("aaa", generator.generate());
        assertEquals("aaa", generator.generate());
    }

    @Test
    @DisplayName("Same seed gives the same sequence")
    void testSeededRandom() {
        RandomCodeGenerator a = new RandomCodeGenerator("abc", 8, new Random(42));
        RandomCodeGenerator b = new RandomCodeGenerator("abc", 8, new Random(42));
        for (int i = 0; i < 20; i++) {
            assertEquals(a.generate(), b.generate());
        }
    }

    @Test
    @DisplayName("Invalid arguments are rejected")
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new RandomCodeGenerator("", 5));
        assertThrows(IllegalArgumentException.class, () -> new RandomCodeGenerator(null, 5));
        assertThrows(IllegalArgumentException.class, () -> new RandomCodeGenerator("abc", 0));
    }
}
