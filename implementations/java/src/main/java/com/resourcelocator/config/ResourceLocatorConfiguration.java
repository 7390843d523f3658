package com.resourcelocator.config;

import com.resourcelocator.domain.repository.StorageAdapter;
import com.resourcelocator.infrastructure.crypto.CryptoService;
import com.resourcelocator.infrastructure.crypto.HmacCryptoService;
import com.resourcelocator.infrastructure.persistence.DeadlineBoundStorage;
import com.resourcelocator.infrastructure.persistence.InMemoryStorageAdapter;
import com.resourcelocator.infrastructure.security.VectorValueMaps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Core collaborators of the locator, built once at startup and injected by reference.
 */
@Configuration
@Slf4j
public class ResourceLocatorConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    public CryptoService cryptoService(ResourceLocatorProperties properties, SecureRandom secureRandom) {
        return HmacCryptoService.fromSecret(properties.getToken().getSecret(), secureRandom);
    }

    @Bean
    public VectorValueMaps vectorValueMaps(ResourceLocatorProperties properties) {
        VectorValueMaps maps = new VectorValueMaps(properties.getVectorMaps());
        log.info("Loaded {} vector value maps", maps.size());
        return maps;
    }

    @Bean
    @ConditionalOnProperty(prefix = "resource-locator.storage", name = "type", havingValue = "memory",
        matchIfMissing = true)
    public InMemoryStorageAdapter inMemoryStorageAdapter(ResourceLocatorProperties properties) {
        log.warn("Using in-memory storage; definitions and audit events are lost on restart");
        return new InMemoryStorageAdapter(properties.getStorage().getMemoryAuditRetention());
    }

    @Bean
    public DeadlineBoundStorage deadlineBoundStorage(
            StorageAdapter storageAdapter,
            @Qualifier(ExecutorConfiguration.STORAGE_EXECUTOR) ThreadPoolTaskExecutor storageExecutor,
            ResourceLocatorProperties properties,
            Clock clock) {
        return new DeadlineBoundStorage(storageAdapter, storageExecutor, properties.getStorage().getTimeout(), clock);
    }
}
