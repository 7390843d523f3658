package com.resourcelocator.application;

import com.resourcelocator.infrastructure.token.ValidationResult;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of redeeming a capability token: the granted {@link Capability}, or the
 * validation failure that blocked it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Redemption {

    ValidationResult validation;
    Capability capability;

    static Redemption accepted(Capability capability) {
        return new Redemption(ValidationResult.valid(), capability);
    }

    static Redemption rejected(ValidationResult validation) {
        return new Redemption(validation, null);
    }

    public boolean isAccepted() {
        return capability != null;
    }

    public Optional<Capability> getCapability() {
        return Optional.ofNullable(capability);
    }
}
