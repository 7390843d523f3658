package com.resourcelocator.domain.model;

public enum AuditEventKind {
    HANDSHAKE_SUCCESS,
    HANDSHAKE_FAILURE,
    POINTER_VALIDATION_FAILURE
}
