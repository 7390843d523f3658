package com.resourcelocator.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * Append-only record of one authorization decision or token validation failure.
 *
 * <p>{@code resource} is either a logical name or a credential-free physical
 * resource rendering; it never contains credential material.
 */
@Value
@Builder
public class AuditEvent {
    @NonNull String traceId;
    @NonNull Instant timestamp;
    @NonNull AuditEventKind kind;
    String reason;
    @NonNull String callerId;
    @NonNull String resource;
}
