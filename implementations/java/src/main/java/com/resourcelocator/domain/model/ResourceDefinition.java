package com.resourcelocator.domain.model;

import com.resourcelocator.domain.policy.AccessPolicy;
import lombok.Builder;
import lombok.Value;
import org.owasp.encoder.Encode;

import java.util.Objects;

/**
 * Resource registered under a unique logical name.
 *
 * <p>Immutable. Updates go through the storage adapter and replace the whole
 * definition; the locator evicts any cached copy when that happens.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Value
public class ResourceDefinition {

    private static final int MAX_LOGICAL_NAME_LENGTH = 512;

    String logicalName;
    ConnectionDescriptor connection;
    CapabilityKind capability;
    AccessPolicy requiredPolicy;
    String description;

    @Builder(toBuilder = true)
    public ResourceDefinition(
            String logicalName,
            ConnectionDescriptor connection,
            CapabilityKind capability,
            AccessPolicy requiredPolicy,
            String description) {

        this.logicalName = validateLogicalName(logicalName);
        this.connection = Objects.requireNonNull(connection, "Connection descriptor must not be null");
        this.capability = capability != null ? capability : CapabilityKind.READ;
        this.requiredPolicy = Objects.requireNonNull(requiredPolicy, "Required policy must not be null");
        this.description = description;
    }

    public static String validateLogicalName(String logicalName) {
        if (logicalName == null || logicalName.isBlank()) {
            throw new IllegalArgumentException("Logical name must not be null or blank");
        }
        if (logicalName.length() > MAX_LOGICAL_NAME_LENGTH) {
            throw new IllegalArgumentException("Logical name too long (max 512 characters)");
        }
        if (logicalName.chars().anyMatch(Character::isISOControl)) {
            throw new IllegalArgumentException(
                "Logical name contains control characters: " + Encode.forJava(logicalName)
            );
        }
        return logicalName;
    }
}
