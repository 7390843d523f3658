package com.resourcelocator.infrastructure.audit;

import com.resourcelocator.domain.model.AuditEvent;
import com.resourcelocator.domain.model.AuditEventKind;
import com.resourcelocator.domain.model.ConnectionDescriptor;
import com.resourcelocator.infrastructure.persistence.DeadlineBoundStorage;
import com.resourcelocator.infrastructure.token.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
@Slf4j
@RequiredArgsConstructor
public class DefaultAuditService implements AuditService {

    private final DeadlineBoundStorage storage;
    private final Clock clock;

    @Override
    public void logHandshakeSuccess(String traceId, String logicalName, String callerId, String grantReason,
                                    Instant deadline) {
        log.info("AUDIT kind={} trace={} resource={} caller={} reason={}",
            AuditEventKind.HANDSHAKE_SUCCESS, traceId, logicalName, callerId, grantReason);
        append(AuditEventKind.HANDSHAKE_SUCCESS, traceId, logicalName, callerId, grantReason, deadline);
    }

    @Override
    public void logHandshakeFailure(String traceId, String logicalName, String callerId, String reason,
                                    Instant deadline) {
        log.warn("AUDIT kind={} trace={} resource={} caller={} reason={}",
            AuditEventKind.HANDSHAKE_FAILURE, traceId, logicalName, callerId, reason);
        append(AuditEventKind.HANDSHAKE_FAILURE, traceId, logicalName, callerId, reason, deadline);
    }

    @Override
    public void logPointerFailure(String traceId, ConnectionDescriptor descriptor, String callerId, String reason,
                                  Instant deadline) {
        String resource = descriptor.physicalResource();
        if (ValidationResult.POINTER_EXPIRED.equals(reason)) {
            log.warn("AUDIT kind={} trace={} resource={} caller={} reason={}",
                AuditEventKind.POINTER_VALIDATION_FAILURE, traceId, resource, callerId, reason);
        } else {
            // Integrity and replay failures are security incidents
            log.error("AUDIT kind={} trace={} resource={} caller={} reason={}",
                AuditEventKind.POINTER_VALIDATION_FAILURE, traceId, resource, callerId, reason);
        }
        append(AuditEventKind.POINTER_VALIDATION_FAILURE, traceId, resource, callerId, reason, deadline);
    }

    private void append(AuditEventKind kind, String traceId, String resource, String callerId, String reason,
                        Instant deadline) {
        AuditEvent event = AuditEvent.builder()
            .traceId(traceId)
            .timestamp(clock.instant())
            .kind(kind)
            .reason(reason)
            .callerId(callerId != null ? callerId : "unknown")
            .resource(resource)
            .build();
        try {
            storage.logEvent(event, deadline);
        } catch (RuntimeException e) {
            log.error("Audit write failed for trace={} kind={}; decision stands", traceId, kind, e);
        }
    }
}
