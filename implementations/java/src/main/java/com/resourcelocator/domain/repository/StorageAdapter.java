package com.resourcelocator.domain.repository;

import com.resourcelocator.domain.model.AuditEvent;
import com.resourcelocator.domain.model.ResourceDefinition;

import java.util.Optional;

/**
 * Persistence contract for resource definitions and audit events.
 *
 * <p>Any store satisfying this contract (relational, document, in-memory) is
 * substitutable. Implementations:
 * <ul>
 *   <li>must be safe for concurrent use</li>
 *   <li>must treat {@link #registerConnection} as an upsert keyed by logical name</li>
 *   <li>must never mutate or delete logged audit events</li>
 *   <li>signal I/O failure with {@link StorageUnavailableException}, never by returning empty</li>
 * </ul>
 *
 * <p>Caching is not the adapter's concern; the locator owns the cache.
 *
 * @since 1.0.0
 */
public interface StorageAdapter {

    /**
     * Prepare the backing store (schema, connectivity check).
     */
    void init();

    /**
     * Insert or replace the definition registered under its logical name.
     *
     * @param definition Definition to persist
     */
    void registerConnection(ResourceDefinition definition);

    /**
     * Look up a definition.
     *
     * @param logicalName Logical name
     * @return Definition if registered, empty otherwise
     */
    Optional<ResourceDefinition> getConnection(String logicalName);

    /**
     * Append an audit event.
     *
     * @param event Event to persist
     */
    void logEvent(AuditEvent event);

    /**
     * Release resources held by the adapter.
     */
    void close();
}
