package com.resourcelocator.infrastructure.crypto;

/**
 * Cryptographic service interface.
 *
 * <p>Implementations hold the key material; callers only ever see digests.
 *
 * @author Security Team
 * @since 1.0.0
 */
public interface CryptoService {

    /**
     * Keyed message authentication code over {@code data}.
     *
     * @param data Bytes to authenticate
     * @return MAC bytes
     */
    byte[] mac(byte[] data);

    /**
     * Constant-time check that {@code expected} is the MAC of {@code data}.
     */
    boolean verifyMac(byte[] data, byte[] expected);

    /**
     * Hash data (SHA-256).
     */
    byte[] hash(byte[] data);

    /**
     * Fresh random bytes from a cryptographically strong source.
     */
    byte[] randomBytes(int length);

    /**
     * Exception thrown when cryptographic operations fail.
     */
    class CryptoException extends RuntimeException {
        public CryptoException(String message) {
            super(message);
        }

        public CryptoException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
