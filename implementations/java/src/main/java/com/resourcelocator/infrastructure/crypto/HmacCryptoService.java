package com.resourcelocator.infrastructure.crypto;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.KeyGenerator;
import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * HMAC-SHA256 implementation of {@link CryptoService}.
 *
 * <p>The key is either supplied (Base64, at least 256 bits) or generated at startup.
 * A generated key lives only in this process, so tokens signed before a restart
 * no longer validate afterwards.
 *
 * <p>{@link Mac} instances are not thread-safe; one is created per call.
 */
@Slf4j
public class HmacCryptoService implements CryptoService {

    private static final String MAC_ALGORITHM = "HmacSHA256";
    private static final String HASH_ALGORITHM = "SHA-256";
    private static final int MIN_KEY_BYTES = 32;

    private final SecretKey key;
    private final SecureRandom secureRandom;

    public HmacCryptoService(SecretKey key, SecureRandom secureRandom) {
        if (key.getEncoded() == null || key.getEncoded().length < MIN_KEY_BYTES) {
            throw new IllegalArgumentException("HMAC key must be at least 256 bits");
        }
        this.key = key;
        this.secureRandom = secureRandom;
    }

    /**
     * Build from a Base64 secret, or generate a random key when the secret is blank.
     */
    public static HmacCryptoService fromSecret(String base64Secret, SecureRandom secureRandom) {
        if (base64Secret == null || base64Secret.isBlank()) {
            log.warn("No token secret configured; generating an ephemeral HMAC key");
            return new HmacCryptoService(generateKey(secureRandom), secureRandom);
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(base64Secret.trim());
        } catch (IllegalArgumentException e) {
            throw new CryptoException("Token secret is not valid Base64", e);
        }
        return new HmacCryptoService(new SecretKeySpec(decoded, MAC_ALGORITHM), secureRandom);
    }

    @Override
    public byte[] mac(byte[] data) {
        try {
            Mac mac = Mac.getInstance(MAC_ALGORITHM);
            mac.init(key);
            return mac.doFinal(data);
        } catch (GeneralSecurityException e) {
            log.error("MAC computation failed", e);
            throw new CryptoException("Failed to compute MAC", e);
        }
    }

    @Override
    public boolean verifyMac(byte[] data, byte[] expected) {
        return expected != null && MessageDigest.isEqual(mac(data), expected);
    }

    @Override
    public byte[] hash(byte[] data) {
        try {
            return MessageDigest.getInstance(HASH_ALGORITHM).digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new CryptoException("Failed to hash data", e);
        }
    }

    @Override
    public byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        secureRandom.nextBytes(bytes);
        return bytes;
    }

    private static SecretKey generateKey(SecureRandom secureRandom) {
        try {
            KeyGenerator generator = KeyGenerator.getInstance(MAC_ALGORITHM);
            generator.init(256, secureRandom);
            return generator.generateKey();
        } catch (NoSuchAlgorithmException e) {
            throw new CryptoException("Failed to generate HMAC key", e);
        }
    }
}
