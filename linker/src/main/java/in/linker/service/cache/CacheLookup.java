package in.linker.service.cache;

/**
 * Entry returned by {@link ResolutionCache#getOrPopulate} and how it was obtained.
 */
public record CacheLookup(CacheEntry entry, Source source) {

    public enum Source {
        HIT,        // served from memory
        MISS,       // this caller ran the population
        JOINED      // waited on another caller's population
    }

    public boolean isHit() {
        return source == Source.HIT;
    }
}
