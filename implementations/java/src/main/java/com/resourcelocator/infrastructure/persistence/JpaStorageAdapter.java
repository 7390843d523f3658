package com.resourcelocator.infrastructure.persistence;

import com.resourcelocator.domain.model.AuditEvent;
import com.resourcelocator.domain.model.CapabilityKind;
import com.resourcelocator.domain.model.ConnectionDescriptor;
import com.resourcelocator.domain.model.EncryptedCredential;
import com.resourcelocator.domain.model.ResourceDefinition;
import com.resourcelocator.domain.policy.AccessPolicy;
import com.resourcelocator.domain.policy.BooleanPolicy;
import com.resourcelocator.domain.policy.PolicyNode;
import com.resourcelocator.domain.repository.StorageAdapter;
import com.resourcelocator.domain.repository.StorageUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Relational Storage Adapter backed by Spring Data JPA.
 *
 * <p>Tables:
 * <pre>
 * connections (logical_name PK, protocol, address, encrypted_credentials, capability,
 *              required_policy JSON, description)
 * audit_logs  (id, trace_id, timestamp, type, reason, user_id, resource)
 * </pre>
 *
 * <p>Schema creation is left to Hibernate ({@code ddl-auto}); {@link #init()} only
 * verifies connectivity. Spring's {@link DataAccessException} hierarchy is translated
 * to {@link StorageUnavailableException}.
 */
@Component
@ConditionalOnProperty(prefix = "resource-locator.storage", name = "type", havingValue = "jpa")
@Transactional
@RequiredArgsConstructor
@Slf4j
public class JpaStorageAdapter implements StorageAdapter {

    private final SpringDataResourceDefinitionRepository definitions;
    private final SpringDataAuditEventRepository auditEvents;
    private final PolicyCodec policyCodec;

    @Override
    @Transactional(readOnly = true)
    public void init() {
        try {
            long count = definitions.count();
            log.info("JPA storage ready: {} registered connections", count);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Connection store is not reachable", e);
        }
    }

    @Override
    public void registerConnection(ResourceDefinition definition) {
        ConnectionDescriptor connection = definition.getConnection();
        ResourceDefinitionEntity entity = ResourceDefinitionEntity.builder()
            .logicalName(definition.getLogicalName())
            .protocol(connection.getProtocol())
            .address(connection.getAddress())
            .encryptedCredentials(connection.getEncryptedCredential().map(EncryptedCredential::reveal).orElse(null))
            .capability(definition.getCapability().name())
            .requiredPolicy(policyCodec.encodePolicy(definition.getRequiredPolicy()))
            .description(definition.getDescription())
            .build();
        try {
            // save() merges on an existing primary key
            definitions.save(entity);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to register connection", e);
        }
        log.info("Connection registered: logicalName={}, protocol={}",
            definition.getLogicalName(), connection.getProtocol());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ResourceDefinition> getConnection(String logicalName) {
        try {
            return definitions.findById(logicalName).map(this::toDomain);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to read connection", e);
        }
    }

    @Override
    public void logEvent(AuditEvent event) {
        AuditEventEntity entity = AuditEventEntity.builder()
            .traceId(event.getTraceId())
            .timestamp(event.getTimestamp())
            .type(event.getKind().name())
            .reason(event.getReason())
            .userId(event.getCallerId())
            .resource(event.getResource())
            .build();
        try {
            auditEvents.save(entity);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to append audit event", e);
        }
    }

    @Override
    public void close() {
        // The DataSource is owned and closed by the Spring context
        log.debug("JPA storage adapter closed");
    }

    /**
     * Map a row to the domain. A row whose capability is unknown keeps its name but gets
     * a malformed policy, so every resolution of it is denied.
     */
    ResourceDefinition toDomain(ResourceDefinitionEntity entity) {
        EncryptedCredential credential = entity.getEncryptedCredentials() == null
            || entity.getEncryptedCredentials().isBlank()
            ? null
            : new EncryptedCredential(entity.getEncryptedCredentials());

        Optional<CapabilityKind> capability = CapabilityKind.fromAction(entity.getCapability());
        AccessPolicy policy;
        if (capability.isPresent()) {
            policy = policyCodec.decodePolicy(entity.getRequiredPolicy());
        } else {
            log.error("Stored connection {} has unknown capability '{}'; denying access",
                entity.getLogicalName(), Encode.forJava(String.valueOf(entity.getCapability())));
            policy = BooleanPolicy.of(PolicyNode.malformed("Unknown capability '" + entity.getCapability() + "'"));
        }

        return ResourceDefinition.builder()
            .logicalName(entity.getLogicalName())
            .connection(new ConnectionDescriptor(entity.getProtocol(), entity.getAddress(), credential))
            .capability(capability.orElse(CapabilityKind.READ))
            .requiredPolicy(policy)
            .description(entity.getDescription())
            .build();
    }
}
