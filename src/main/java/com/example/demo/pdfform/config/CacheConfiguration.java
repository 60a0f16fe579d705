package com.example.demo.pdfform.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Caffeine-backed cache for loaded form catalogs.
 * Catalogs are read-only once loaded, so entries only expire to pick up edits to the CSV.
 */
@Configuration
public class CacheConfiguration {

    public static final String FORMS_CATALOG_CACHE = "formsCatalog";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(FORMS_CATALOG_CACHE);
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(16)
                .expireAfterWrite(Duration.ofMinutes(10))
                .recordStats());
        return cacheManager;
    }
}
