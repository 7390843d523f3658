package com.resourcelocator.infrastructure.persistence;

import com.resourcelocator.domain.model.AuditEvent;
import com.resourcelocator.domain.model.ResourceDefinition;
import com.resourcelocator.domain.repository.StorageAdapter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local Storage Adapter. Default when no database is configured, and the
 * adapter used by tests.
 *
 * <p>The audit trail is a bounded ring: once {@code auditRetention} events are held,
 * each append drops the oldest one. Deployments that need a durable, complete trail
 * use the JPA adapter.
 */
@Slf4j
public class InMemoryStorageAdapter implements StorageAdapter {

    public static final int DEFAULT_AUDIT_RETENTION = 10_000;

    private final Map<String, ResourceDefinition> connections = new ConcurrentHashMap<>();
    private final Deque<AuditEvent> events = new ArrayDeque<>();
    private final int auditRetention;
    private long droppedEvents;

    public InMemoryStorageAdapter() {
        this(DEFAULT_AUDIT_RETENTION);
    }

    public InMemoryStorageAdapter(int auditRetention) {
        if (auditRetention <= 0) {
            throw new IllegalArgumentException("Audit retention must be positive");
        }
        this.auditRetention = auditRetention;
    }

    @Override
    public void init() {
        log.info("In-memory storage initialized, audit retention={} events", auditRetention);
    }

    @Override
    public void registerConnection(ResourceDefinition definition) {
        connections.put(definition.getLogicalName(), definition);
    }

    @Override
    public Optional<ResourceDefinition> getConnection(String logicalName) {
        return Optional.ofNullable(connections.get(logicalName));
    }

    @Override
    public void logEvent(AuditEvent event) {
        synchronized (events) {
            if (events.size() == auditRetention) {
                events.removeFirst();
                if (droppedEvents++ == 0) {
                    log.warn("In-memory audit trail full ({} events); dropping oldest events", auditRetention);
                }
            }
            events.addLast(event);
        }
    }

    /**
     * Snapshot of the retained events, in append order.
     */
    public List<AuditEvent> getEvents() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    @Override
    public void close() {
        synchronized (events) {
            log.info("In-memory storage closed: {} connections, {} audit events retained, {} dropped",
                connections.size(), events.size(), droppedEvents);
        }
    }
}
