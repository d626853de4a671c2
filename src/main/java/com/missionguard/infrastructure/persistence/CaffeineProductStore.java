package com.missionguard.infrastructure.persistence;

import com.missionguard.domain.repository.ProductStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Local product store backed by the Caffeine {@code products} cache.
 *
 * <p>Stands in for the persistence collaborator in standalone deployments. Eviction
 * is Caffeine's, configured in {@code CacheConfiguration}; the engine never evicts.
 */
@Repository
@Slf4j
public class CaffeineProductStore implements ProductStore {

    static final String CACHE_NAME = "products";

    private final Cache cache;

    public CaffeineProductStore(@Qualifier("productCacheManager") CacheManager productCacheManager) {
        this.cache = productCacheManager.getCache(CACHE_NAME);
        if (this.cache == null) {
            throw new IllegalStateException("Cache '" + CACHE_NAME + "' is not configured");
        }
    }

    @Override
    public <T> Optional<T> get(ProductKey key, Class<T> type) {
        T value = cache.get(key, type);
        if (log.isDebugEnabled()) {
            log.debug("Product store {} for {}", value != null ? "hit" : "miss", key);
        }
        return Optional.ofNullable(value);
    }

    @Override
    public void put(ProductKey key, Object product) {
        cache.put(key, product);
    }
}
