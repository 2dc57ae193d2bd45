package com.feetrail.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    /** Vault address to supports reassignDev. Deployed bytecode does not change, so entries never expire. */
    public static final String VAULT_CAPABILITY_CACHE = "vaultCapabilityCache";
    public static final String FEE_TOTALS_CACHE = "feeTotalsCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(VAULT_CAPABILITY_CACHE, Caffeine.newBuilder()
                .maximumSize(64)
                .build());
        manager.registerCustomCache(FEE_TOTALS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(30, TimeUnit.SECONDS)
                .maximumSize(1)
                .build());
        return manager;
    }
}
