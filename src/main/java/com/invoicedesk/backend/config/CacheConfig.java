package com.invoicedesk.backend.config;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableCaching
public class CacheConfig {

    public static final String INVOICES_CACHE = "invoices";
    public static final String CUSTOMERS_CACHE = "customers";

    @Bean
    public CacheManager cacheManager() {
        ConcurrentMapCacheManager cacheManager = new ConcurrentMapCacheManager(INVOICES_CACHE, CUSTOMERS_CACHE);
        cacheManager.setAllowNullValues(false);
        return cacheManager;
    }
}
