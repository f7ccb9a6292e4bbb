package in.linker.service.cache;

import in.linker.domain.repository.StoreException;

/**
 * Loads the entry for a code from the store on a cache miss.
 */
@FunctionalInterface
public interface CachePopulator {

    CacheEntry load(String code) throws StoreException;
}
