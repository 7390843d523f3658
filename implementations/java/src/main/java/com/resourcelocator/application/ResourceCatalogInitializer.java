package com.resourcelocator.application;

import com.resourcelocator.config.ResourceLocatorProperties;
import com.resourcelocator.domain.model.CapabilityKind;
import com.resourcelocator.domain.model.ConnectionDescriptor;
import com.resourcelocator.domain.model.EncryptedCredential;
import com.resourcelocator.domain.model.ResourceDefinition;
import com.resourcelocator.domain.repository.StorageAdapter;
import com.resourcelocator.infrastructure.persistence.PolicyCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Prepares the Storage Adapter at startup and registers the catalog entries listed
 * under {@code resource-locator.resources}. Registration goes through the locator so
 * cached copies are evicted. The adapter is closed with the application context.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResourceCatalogInitializer implements ApplicationRunner, DisposableBean {

    private final StorageAdapter storageAdapter;
    private final SecureResourceLocator locator;
    private final PolicyCodec policyCodec;
    private final ResourceLocatorProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        storageAdapter.init();

        for (ResourceLocatorProperties.CatalogEntry entry : properties.getResources()) {
            locator.register(toDefinition(entry));
        }
        log.info("Resource catalog ready: {} configured entries registered", properties.getResources().size());
    }

    @Override
    public void destroy() {
        storageAdapter.close();
    }

    ResourceDefinition toDefinition(ResourceLocatorProperties.CatalogEntry entry) {
        EncryptedCredential credential = entry.getEncryptedCredentials() == null
            || entry.getEncryptedCredentials().isBlank()
            ? null
            : new EncryptedCredential(entry.getEncryptedCredentials());

        return ResourceDefinition.builder()
            .logicalName(entry.getLogicalName())
            .connection(new ConnectionDescriptor(entry.getProtocol(), entry.getAddress(), credential))
            .capability(CapabilityKind.fromAction(entry.getCapability())
                .orElseThrow(() -> new IllegalArgumentException(
                    "Unknown capability for " + entry.getLogicalName() + ": " + entry.getCapability())))
            .requiredPolicy(policyCodec.decodePolicy(entry.getPolicy()))
            .description(entry.getDescription())
            .build();
    }
}
