package in.linker.config;

import in.linker.util.Env;

import java.time.Duration;

/**
 * Runtime configuration for the link service.
 *
 * Values are read from environment variables (or system properties of the
 * same name) by {@link #fromEnv()}; {@link #defaults()} gives the values used
 * when nothing is set.
 */
public record LinkerConfig(
    // HTTP
    String host,
    int port,
    long maxBodyBytes,
    String publicBaseUrl,           // null = derive from the request Host header

    // Database
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize,

    // Codes
    int codeLength,
    String codeAlphabet,
    int maxCollisionRetries,        // total insert attempts per create

    // Resolution cache
    long cacheCapacity,
    Duration cacheTtl,
    Duration cacheIdleTimeout,

    // Store calls
    Duration storeTimeout,
    int storeThreads
) {
    public static final String ALPHANUMERIC =
        "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    public static LinkerConfig defaults() {
        return new LinkerConfig(
            "0.0.0.0",
            8080,
            8 * 1024,
            null,
            "jdbc:postgresql://localhost:5432/linker",
            "postgres",
            "postgres",
            10,
            10,
            ALPHANUMERIC,
            5,
            1000,
            Duration.ofHours(1),
            Duration.ofMinutes(10),
            Duration.ofSeconds(2),
            8
        );
    }

    public static LinkerConfig fromEnv() {
        LinkerConfig d = defaults();
        return new LinkerConfig(
            Env.get("LISTEN_HOST", d.host()),
            Env.getInt("PORT", d.port()),
            Env.getLong("MAX_BODY_BYTES", d.maxBodyBytes()),
            Env.get("PUBLIC_BASE_URL", d.publicBaseUrl()),
            Env.get("DB_URL", d.dbUrl()),
            Env.get("DB_USER", d.dbUser()),
            Env.get("DB_PASS", d.dbPass()),
            Env.getInt("DB_POOL_SIZE", d.dbPoolSize()),
            Env.getInt("CODE_LENGTH", d.codeLength()),
            Env.get("CODE_ALPHABET", d.codeAlphabet()),
            Env.getInt("MAX_COLLISION_RETRIES", d.maxCollisionRetries()),
            Env.getLong("CACHE_CAPACITY", d.cacheCapacity()),
            Env.getSeconds("CACHE_TTL_SECONDS", d.cacheTtl()),
            Env.getSeconds("CACHE_IDLE_SECONDS", d.cacheIdleTimeout()),
            Env.getMillis("STORE_TIMEOUT_MS", d.storeTimeout()),
            Env.getInt("STORE_THREADS", d.storeThreads())
        );
    }

    /**
     * Copy with a different code space, used by tests and tooling.
     */
    public LinkerConfig withCodes(int length, String alphabet, int retries) {
        return new LinkerConfig(host, port, maxBodyBytes, publicBaseUrl,
            dbUrl, dbUser, dbPass, dbPoolSize,
            length, alphabet, retries,
            cacheCapacity, cacheTtl, cacheIdleTimeout,
            storeTimeout, storeThreads);
    }

    /**
     * Copy with different cache and store-call limits.
     */
    public LinkerConfig withCache(long capacity, Duration ttl, Duration idle, Duration timeout) {
        return new LinkerConfig(host, port, maxBodyBytes, publicBaseUrl,
            dbUrl, dbUser, dbPass, dbPoolSize,
            codeLength, codeAlphabet, maxCollisionRetries,
            capacity, ttl, idle,
            timeout, storeThreads);
    }

    /**
     * Number of distinct codes for the configured alphabet and length.
     * Saturates at {@link Double#POSITIVE_INFINITY} for very large spaces.
     */
    public double codeSpace() {
        return Math.pow(codeAlphabet.length(), codeLength);
    }

    @Override
    public String toString() {
        // omits dbPass
        return "LinkerConfig[port=" + port + ", dbUrl=" + dbUrl + ", dbUser=" + dbUser
            + ", pool=" + dbPoolSize + ", codeLength=" + codeLength
            + ", alphabetSize=" + codeAlphabet.length() + ", retries=" + maxCollisionRetries
            + ", cacheCapacity=" + cacheCapacity + ", cacheTtl=" + cacheTtl
            + ", cacheIdle=" + cacheIdleTimeout + ", storeTimeout=" + storeTimeout + "]";
    }
}
