package in.linker.security;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.BitSet;
import java.util.Locale;

/**
 * Input validator for destinations and codes.
 *
 * Validation Rules:
 * - Destinations: absolute http/https URI with a host, max 2048 chars
 *   (the destination column width) after percent-encoding, no whitespace
 *   or control characters
 * - Codes: exactly the configured length, every symbol from the configured
 *   alphabet
 *
 * Codes that fail validation can never exist in the store, so callers can
 * answer "not found" without touching the cache or the database. This also
 * keeps garbage keys from filling the cache with tombstones.
 *
 * Usage:
 * <pre>
 * InputValidator validator = new InputValidator(10, LinkerConfig.ALPHANUMERIC);
 *
 * String destination = validator.validateDestination(" https://example.com/a ");
 * if (!validator.isValidCode(code)) {
 *     return notFound();
 * }
 * </pre>
 */
public class InputValidator {

    public static final int MAX_DESTINATION_LENGTH = 2048;

    private final int codeLength;
    private final BitSet alphabet = new BitSet(128);

    public InputValidator(int codeLength, String codeAlphabet) {
        this.codeLength = codeLength;
        for (char c : codeAlphabet.toCharArray()) {
            alphabet.set(c);
        }
    }

    /**
     * Validate and normalize a destination URL.
     *
     * @param raw Destination as supplied by the client
     * @return Trimmed destination with lower-cased scheme, non-ASCII
     *         characters percent-encoded as UTF-8
     * @throws IllegalArgumentException with a client-facing reason if invalid
     */
    public String validateDestination(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Destination is required");
        }

        String url = raw.trim();
        if (url.isEmpty()) {
            throw new IllegalArgumentException("Destination is required");
        }
        if (url.length() > MAX_DESTINATION_LENGTH) {
            throw new IllegalArgumentException("Destination exceeds maximum length: " + MAX_DESTINATION_LENGTH);
        }
        for (int i = 0; i < url.length(); i++) {
            char c = url.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                throw new IllegalArgumentException("Destination contains whitespace or control characters");
            }
        }

        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Destination is not a valid URL: " + e.getReason());
        }

        if (!uri.isAbsolute()) {
            throw new IllegalArgumentException("Destination must be an absolute URL");
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("Destination scheme must be http or https");
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new IllegalArgumentException("Destination must have a host");
        }

        // Location headers carry bytes, not characters
        String ascii = scheme + uri.toASCIIString().substring(uri.getScheme().length());
        if (ascii.length() > MAX_DESTINATION_LENGTH) {
            throw new IllegalArgumentException("Destination exceeds maximum length: " + MAX_DESTINATION_LENGTH);
        }
        return ascii;
    }

    public boolean isValidDestination(String raw) {
        try {
            validateDestination(raw);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Check code shape against the configured length and alphabet.
     */
    public boolean isValidCode(String code) {
        if (code == null || code.length() != codeLength) {
            return false;
        }
        for (int i = 0; i < code.length(); i++) {
            if (!alphabet.get(code.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
