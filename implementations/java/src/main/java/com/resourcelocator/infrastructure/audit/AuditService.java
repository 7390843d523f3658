package com.resourcelocator.infrastructure.audit;

import com.resourcelocator.domain.model.ConnectionDescriptor;

import java.time.Instant;

/**
 * Records authorization decisions and token validation failures.
 *
 * <p>Writes are best-effort: a failed write is reported to operators and never
 * changes the decision being recorded. {@code deadline} may be {@code null}.
 */
public interface AuditService {

    void logHandshakeSuccess(String traceId, String logicalName, String callerId, String grantReason, Instant deadline);

    void logHandshakeFailure(String traceId, String logicalName, String callerId, String reason, Instant deadline);

    /**
     * Record a rejected capability token. Only the credential-free physical resource
     * of {@code descriptor} is written.
     */
    void logPointerFailure(String traceId, ConnectionDescriptor descriptor, String callerId, String reason, Instant deadline);
}
