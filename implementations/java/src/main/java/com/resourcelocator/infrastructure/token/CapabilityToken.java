package com.resourcelocator.infrastructure.token;

import com.resourcelocator.domain.model.ConnectionDescriptor;
import com.resourcelocator.infrastructure.crypto.CryptoService;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Ephemeral, integrity-checked, time-boxed wrapper around one resolved connection.
 *
 * <p>The digest is a MAC over {descriptor, nonce, expiration} computed at issuance and
 * recomputed on every {@link #validate()}. Any change to those fields after issuance,
 * however it happens, makes the token fail its integrity check.
 *
 * <p>{@link #getDescriptor()} hands out an independent copy, never the instance the
 * digest was computed over.
 *
 * <p>Tokens are never persisted and hold no shared mutable state; one owner creates,
 * validates and discards each token.
 *
 * @since 1.0.0
 */
public final class CapabilityToken {

    private static final int NONCE_BYTES = 16;

    private final ConnectionDescriptor descriptor;
    private final String nonce;
    private final Instant expiresAt;
    private final byte[] digest;

    private final CryptoService cryptoService;
    private final Clock clock;

    private CapabilityToken(ConnectionDescriptor descriptor, String nonce, Instant expiresAt,
                            CryptoService cryptoService, Clock clock) {
        this.descriptor = descriptor.copy();
        this.nonce = nonce;
        this.expiresAt = expiresAt;
        this.cryptoService = cryptoService;
        this.clock = clock;
        this.digest = cryptoService.mac(digestInput());
    }

    /**
     * Sign a descriptor. Pure construction: no I/O.
     *
     * @param descriptor Resolved connection
     * @param lifetime Time until expiration, must be positive
     * @param cryptoService MAC provider
     * @param clock Time source
     * @return New token
     */
    public static CapabilityToken issue(ConnectionDescriptor descriptor, Duration lifetime,
                                        CryptoService cryptoService, Clock clock) {
        Objects.requireNonNull(descriptor, "Descriptor must not be null");
        Objects.requireNonNull(lifetime, "Lifetime must not be null");
        if (lifetime.isNegative() || lifetime.isZero()) {
            throw new IllegalArgumentException("Token lifetime must be positive");
        }
        String nonce = HexFormat.of().formatHex(cryptoService.randomBytes(NONCE_BYTES));
        return new CapabilityToken(descriptor, nonce, clock.instant().plus(lifetime), cryptoService, clock);
    }

    /**
     * Check integrity first, then expiration. A token that is both tampered and expired
     * reports the integrity failure. Repeated calls after expiry return the same result.
     */
    public ValidationResult validate() {
        if (!cryptoService.verifyMac(digestInput(), digest)) {
            return ValidationResult.integrityFailure();
        }
        if (clock.instant().isAfter(expiresAt)) {
            return ValidationResult.expired();
        }
        return ValidationResult.valid();
    }

    /**
     * Copy of the wrapped descriptor; changes to it cannot reach the signed state.
     */
    public ConnectionDescriptor getDescriptor() {
        return descriptor.copy();
    }

    public String getNonce() {
        return nonce;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * Credential-free rendering of the target, for audit records.
     */
    public String physicalResource() {
        return descriptor.physicalResource();
    }

    private byte[] digestInput() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            writeField(out, descriptor.getProtocol());
            writeField(out, descriptor.getAddress());
            writeField(out, descriptor.getEncryptedCredential().map(c -> c.reveal()).orElse(""));
            writeField(out, nonce);
            out.writeLong(expiresAt.getEpochSecond());
            out.writeInt(expiresAt.getNano());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode token fields", e);
        }
        return bytes.toByteArray();
    }

    private static void writeField(DataOutputStream out, String value) throws IOException {
        byte[] encoded = value.getBytes(StandardCharsets.UTF_8);
        out.writeInt(encoded.length);
        out.write(encoded);
    }

    @Override
    public String toString() {
        return "CapabilityToken[resource=" + descriptor.physicalResource() + ", expiresAt=" + expiresAt + "]";
    }
}
