package com.resourcelocator.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.owasp.encoder.Encode;

import java.util.Objects;
import java.util.Optional;

/**
 * Reusable pointer to a physical resource: protocol tag, address and an optional
 * encrypted credential reference.
 *
 * <p>The address may be a template containing {@code {resourceId}} or {@code {ownerId}}
 * placeholders while it sits in storage; the locator substitutes them before handing
 * a descriptor to a caller.
 *
 * <p>Immutable value object. {@link #toString()} omits credential material.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode
public final class ConnectionDescriptor {

    private final String protocol;

    private final String address;

    @Getter(lombok.AccessLevel.NONE)
    private final EncryptedCredential encryptedCredential;

    public ConnectionDescriptor(String protocol, String address, EncryptedCredential encryptedCredential) {
        this.protocol = validateProtocol(protocol);
        this.address = Objects.requireNonNull(address, "Address must not be null");
        if (address.isBlank()) {
            throw new IllegalArgumentException("Address must not be blank");
        }
        this.encryptedCredential = encryptedCredential;
    }

    public ConnectionDescriptor(String protocol, String address) {
        this(protocol, address, null);
    }

    public Optional<EncryptedCredential> getEncryptedCredential() {
        return Optional.ofNullable(encryptedCredential);
    }

    /**
     * Returns a descriptor identical to this one except for the address.
     */
    public ConnectionDescriptor withAddress(String newAddress) {
        return new ConnectionDescriptor(protocol, newAddress, encryptedCredential);
    }

    /**
     * Returns an independent instance carrying the same values.
     */
    public ConnectionDescriptor copy() {
        return new ConnectionDescriptor(protocol, address, encryptedCredential);
    }

    /**
     * Credential-free rendering used in audit records, e.g. {@code sql://reports/acct-42}.
     */
    public String physicalResource() {
        return protocol + "://" + address;
    }

    private static String validateProtocol(String protocol) {
        if (protocol == null || protocol.isBlank()) {
            throw new IllegalArgumentException("Protocol must not be null or blank");
        }
        if (!protocol.matches("^[a-z][a-z0-9+.-]*$")) {
            throw new IllegalArgumentException(
                "Invalid protocol tag (lowercase scheme characters only): " + Encode.forJava(protocol)
            );
        }
        return protocol;
    }

    @Override
    public String toString() {
        return String.format(
            "ConnectionDescriptor[protocol=%s, address=%s, credential=%s]",
            protocol,
            address,
            encryptedCredential != null ? "present" : "none"
        );
    }
}
