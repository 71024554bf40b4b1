package com.invoicedesk.backend.services;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import com.invoicedesk.backend.config.CacheConfig;
import com.invoicedesk.backend.config.ViewsProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Marca como obsoletas as views associadas a um caminho, para que a próxima leitura
 * seja recalculada. Melhor esforço: falhas são apenas registradas.
 */
@Slf4j
@Component
public class ViewCacheInvalidator {

    private final CacheManager cacheManager;
    private final Map<String, Set<String>> cachesByPath = new LinkedHashMap<>();

    public ViewCacheInvalidator(CacheManager cacheManager, ViewsProperties views) {
        this.cacheManager = cacheManager;
        // os dois caminhos podem coincidir; nesse caso o caminho invalida as duas views
        register(views.invoicesPath(), CacheConfig.INVOICES_CACHE);
        register(views.customersPath(), CacheConfig.CUSTOMERS_CACHE);
    }

    private void register(String path, String cacheName) {
        cachesByPath.computeIfAbsent(path, p -> new LinkedHashSet<>()).add(cacheName);
    }

    public void revalidatePath(String path) {
        Set<String> cacheNames = cachesByPath.get(path);
        if (cacheNames == null) {
            log.debug("Nenhuma view em cache para o caminho {}", path);
            return;
        }

        for (String cacheName : cacheNames) {
            try {
                Cache cache = cacheManager.getCache(cacheName);
                if (cache != null) {
                    cache.clear();
                    log.debug("View {} invalidada ({})", path, cacheName);
                }
            } catch (RuntimeException e) {
                log.warn("Falha ao invalidar a view {} ({})", path, cacheName, e);
            }
        }
    }
}
