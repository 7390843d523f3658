package com.resourcelocator.infrastructure.token;

import com.resourcelocator.domain.model.FailureKind;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Result of validating a capability token: valid, or invalid with a reason code.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    public static final String INTEGRITY_CHECK_FAILED = "integrity_check_failed";
    public static final String POINTER_EXPIRED = "pointer_expired";
    public static final String POINTER_REPLAYED = "pointer_replayed";

    private static final ValidationResult VALID = new ValidationResult(true, null, null);

    boolean valid;
    FailureKind failure;
    String reason;

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult integrityFailure() {
        return new ValidationResult(false, FailureKind.TOKEN_INTEGRITY_FAILURE, INTEGRITY_CHECK_FAILED);
    }

    public static ValidationResult expired() {
        return new ValidationResult(false, FailureKind.TOKEN_EXPIRED, POINTER_EXPIRED);
    }

    public static ValidationResult replayed() {
        return new ValidationResult(false, FailureKind.TOKEN_REPLAYED, POINTER_REPLAYED);
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    public Optional<FailureKind> getFailure() {
        return Optional.ofNullable(failure);
    }
}
