package com.resourcelocator.domain.model;

import lombok.EqualsAndHashCode;

import java.util.Objects;

/**
 * Opaque, already-encrypted credential reference attached to a connection.
 *
 * <p>The locator never decrypts this value. It is carried to the resource-access
 * dispatcher inside a validated capability and nowhere else.
 *
 * <p><strong>Security Guarantees:</strong>
 * <ul>
 *   <li>Immutable - cannot be modified after creation</li>
 *   <li>{@link #toString()} never exposes the blob, so it is safe in log statements</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@EqualsAndHashCode
public final class EncryptedCredential {

    private final String blob;

    public EncryptedCredential(String blob) {
        this.blob = Objects.requireNonNull(blob, "Credential blob must not be null");
        if (blob.isBlank()) {
            throw new IllegalArgumentException("Credential blob must not be blank");
        }
    }

    /**
     * Returns the opaque blob. Callers must not log or echo it.
     *
     * @return encrypted credential material
     */
    public String reveal() {
        return blob;
    }

    @Override
    public String toString() {
        return "EncryptedCredential[****]";
    }
}
