package com.resourcelocator.infrastructure.persistence;

import com.resourcelocator.domain.model.AuditEvent;
import com.resourcelocator.domain.model.AuditEventKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStorageAdapterTest {

    private static AuditEvent event(int n) {
        return AuditEvent.builder()
                .traceId("trace-" + n)
                .timestamp(Instant.parse("2024-03-13T10:00:00Z").plusSeconds(n))
                .kind(AuditEventKind.HANDSHAKE_SUCCESS)
                .callerId("acct-42")
                .resource("reports/acct-42")
                .build();
    }

    @Test
    void audit_trail_keeps_only_the_newest_events() {
        InMemoryStorageAdapter adapter = new InMemoryStorageAdapter(3);

        for (int i = 1; i <= 5; i++) {
            adapter.logEvent(event(i));
        }

        List<AuditEvent> events = adapter.getEvents();
        assertEquals(3, events.size());
        assertEquals("trace-3", events.get(0).getTraceId());
        assertEquals("trace-5", events.get(2).getTraceId());
    }

    @Test
    void snapshot_is_detached_from_later_appends() {
        InMemoryStorageAdapter adapter = new InMemoryStorageAdapter();
        adapter.logEvent(event(1));

        List<AuditEvent> snapshot = adapter.getEvents();
        adapter.logEvent(event(2));

        assertEquals(1, snapshot.size());
        assertEquals(2, adapter.getEvents().size());
    }

    @Test
    void retention_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryStorageAdapter(0));
    }
}
