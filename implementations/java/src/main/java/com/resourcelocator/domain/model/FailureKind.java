package com.resourcelocator.domain.model;

/**
 * Failure taxonomy shared by resolution and token validation results.
 */
public enum FailureKind {
    /** Unknown logical name. */
    NOT_FOUND,

    /** Boolean or vector evaluator rejected the caller. */
    POLICY_DENIED,

    /** Policy could not be evaluated (unknown operator, condition, value map...). Fails closed. */
    MALFORMED_POLICY,

    /** Storage adapter I/O failure or timeout. Never reported as a denial. */
    STORAGE_UNAVAILABLE,

    /** Token digest mismatch. Treated as a security incident. */
    TOKEN_INTEGRITY_FAILURE,

    /** Token past its expiration instant. Expected under normal operation. */
    TOKEN_EXPIRED,

    /** Token presented for redemption more than once. */
    TOKEN_REPLAYED
}
