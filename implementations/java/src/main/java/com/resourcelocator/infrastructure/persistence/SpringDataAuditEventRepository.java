package com.resourcelocator.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for the {@code audit_logs} table.
 *
 * <p>Only inserts and reads are used; audit rows are never updated or deleted.
 */
@Repository
public interface SpringDataAuditEventRepository extends JpaRepository<AuditEventEntity, Long> {

    /**
     * Events of one resolution, oldest first.
     *
     * @param traceId Trace id of the resolution
     * @return Matching rows
     */
    List<AuditEventEntity> findByTraceIdOrderByIdAsc(String traceId);
}
