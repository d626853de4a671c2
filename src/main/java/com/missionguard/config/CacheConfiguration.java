package com.missionguard.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine cache backing the local product store.
 *
 * Keys carry the policy registry version, so a reload never serves a product built
 * under the previous policy. Entries age out; the engine itself never evicts.
 */
@Configuration
@Slf4j
public class CacheConfiguration {

    @Bean(name = "productCacheManager")
    public CacheManager productCacheManager() {
        log.info("Configuring Caffeine product cache");

        CaffeineCacheManager cacheManager = new CaffeineCacheManager();
        cacheManager.setCaffeine(Caffeine.newBuilder()
            .maximumSize(5_000)
            .expireAfterWrite(24, TimeUnit.HOURS)
            .recordStats()
        );
        cacheManager.setCacheNames(List.of("products"));
        return cacheManager;
    }
}
