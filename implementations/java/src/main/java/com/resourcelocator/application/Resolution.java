package com.resourcelocator.application;

import com.resourcelocator.domain.model.CapabilityKind;
import com.resourcelocator.domain.model.Claim;
import com.resourcelocator.domain.model.ConnectionDescriptor;
import com.resourcelocator.domain.model.FailureKind;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of {@link SecureResourceLocator#resolve}: a granted connection descriptor,
 * or a typed failure with an audit-grade reason.
 *
 * <p>Reasons never contain credential material.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Resolution {

    String traceId;
    String logicalName;
    String callerId;
    ConnectionDescriptor descriptor;
    CapabilityKind capability;
    Claim satisfiedBy;
    FailureKind failure;
    String reason;

    static Resolution granted(String traceId, String logicalName, String callerId, ConnectionDescriptor descriptor,
                              CapabilityKind capability, Claim satisfiedBy, String reason) {
        return new Resolution(traceId, logicalName, callerId, descriptor, capability, satisfiedBy, null, reason);
    }

    static Resolution failed(String traceId, String logicalName, String callerId, FailureKind failure,
                             String reason) {
        return new Resolution(traceId, logicalName, callerId, null, null, null, failure, reason);
    }

    public boolean isGranted() {
        return failure == null;
    }

    public Optional<ConnectionDescriptor> getDescriptor() {
        return Optional.ofNullable(descriptor);
    }

    public Optional<CapabilityKind> getCapability() {
        return Optional.ofNullable(capability);
    }

    public Optional<Claim> getSatisfiedBy() {
        return Optional.ofNullable(satisfiedBy);
    }

    public Optional<FailureKind> getFailure() {
        return Optional.ofNullable(failure);
    }
}
