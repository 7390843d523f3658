package com.resourcelocator.infrastructure.audit;

import com.resourcelocator.domain.model.AuditEvent;
import com.resourcelocator.domain.model.AuditEventKind;
import com.resourcelocator.domain.model.ConnectionDescriptor;
import com.resourcelocator.domain.model.EncryptedCredential;
import com.resourcelocator.infrastructure.persistence.DeadlineBoundStorage;
import com.resourcelocator.support.FailingStorageAdapter;
import com.resourcelocator.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class DefaultAuditServiceTest {

    private final FailingStorageAdapter adapter = new FailingStorageAdapter();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-13T10:00:00Z"));
    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final DefaultAuditService audit = new DefaultAuditService(
            new DeadlineBoundStorage(adapter, executor, Duration.ofSeconds(1), clock), clock);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void handshake_events_are_appended_with_trace_and_reason() {
        audit.logHandshakeSuccess("t-1", "reports/acct-42", "acct-42",
                "Access granted by claim: {action: 'read', resourceType: 'report'}", null);
        audit.logHandshakeFailure("t-2", "reports/acct-42", "acct-99", "not_found", null);

        List<AuditEvent> events = adapter.getEvents();
        assertEquals(2, events.size());

        AuditEvent success = events.get(0);
        assertEquals("t-1", success.getTraceId());
        assertEquals(AuditEventKind.HANDSHAKE_SUCCESS, success.getKind());
        assertEquals("reports/acct-42", success.getResource());
        assertEquals("acct-42", success.getCallerId());
        assertEquals(clock.instant(), success.getTimestamp());

        AuditEvent failure = events.get(1);
        assertEquals(AuditEventKind.HANDSHAKE_FAILURE, failure.getKind());
        assertEquals("not_found", failure.getReason());
    }

    @Test
    void pointer_failures_record_the_physical_resource_without_credentials() {
        ConnectionDescriptor descriptor = new ConnectionDescriptor("sql", "reports_db/acct-42",
                new EncryptedCredential("enc:v1:top-secret"));

        audit.logPointerFailure("t-3", descriptor, "acct-42", "integrity_check_failed", null);

        AuditEvent event = adapter.getEvents().get(0);
        assertEquals(AuditEventKind.POINTER_VALIDATION_FAILURE, event.getKind());
        assertEquals("sql://reports_db/acct-42", event.getResource());
        assertEquals("integrity_check_failed", event.getReason());
        assertFalse(event.toString().contains("top-secret"));
    }

    @Test
    void write_failures_are_swallowed() {
        adapter.failAudit(true);

        assertDoesNotThrow(() -> audit.logHandshakeFailure("t-4", "reports/a", "acct-1", "denied", null));
        assertTrue(adapter.getEvents().isEmpty());
    }

    @Test
    void missing_caller_is_recorded_as_unknown() {
        audit.logHandshakeFailure("t-5", "reports/a", null, "denied", null);

        assertEquals("unknown", adapter.getEvents().get(0).getCallerId());
    }
}
