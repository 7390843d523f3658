package com.resourcelocator.infrastructure.persistence;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Row of the append-only {@code audit_logs} table.
 */
@Entity
@Table(name = "audit_logs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditEventEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, name = "trace_id")
    private String traceId;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(nullable = false, length = 64)
    private String type;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "user_id")
    private String userId;

    @Column(length = 2048)
    private String resource;
}
