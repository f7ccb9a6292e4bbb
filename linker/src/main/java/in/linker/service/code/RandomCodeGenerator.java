package in.linker.service.code;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Fixed-length codes drawn uniformly from a fixed alphabet.
 *
 * With the default 62-symbol alphabet and length 10 the space holds about
 * 8.4e17 codes, so collisions stay rare far beyond any realistic table size.
 */
public final class RandomCodeGenerator implements CodeGenerator {

    private final char[] alphabet;
    private final int length;
    private final Random random;

    public RandomCodeGenerator(String alphabet, int length) {
        this(alphabet, length, new SecureRandom());
    }

    public RandomCodeGenerator(String alphabet, int length, Random random) {
        if (alphabet == null || alphabet.isEmpty()) {
            throw new IllegalArgumentException("alphabet cannot be empty");
        }
        if (length <= 0) {
            throw new IllegalArgumentException("length must be positive: " + length);
        }
        this.alphabet = alphabet.toCharArray();
        this.length = length;
        this.random = random;
    }

    @Override
    public String generate() {
        char[] code = new char[length];
        for (int i = 0; i < length; i++) {
            code[i] = alphabet[random.nextInt(alphabet.length)];
        }
        return new String(code);
    }

    public int length() {
        return length;
    }
}
