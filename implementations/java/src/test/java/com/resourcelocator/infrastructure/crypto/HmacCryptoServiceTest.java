package com.resourcelocator.infrastructure.crypto;

import org.junit.jupiter.api.Test;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class HmacCryptoServiceTest {

    private static final String SECRET = Base64.getEncoder()
            .encodeToString("0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.US_ASCII));

    private final HmacCryptoService crypto = HmacCryptoService.fromSecret(SECRET, new SecureRandom());

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void mac_is_deterministic_for_one_key_and_verifies() {
        byte[] mac = crypto.mac(bytes("payload"));

        assertArrayEquals(mac, crypto.mac(bytes("payload")));
        assertEquals(32, mac.length);
        assertTrue(crypto.verifyMac(bytes("payload"), mac));
        assertFalse(crypto.verifyMac(bytes("payload!"), mac));
        assertFalse(crypto.verifyMac(bytes("payload"), null));
    }

    @Test
    void same_secret_gives_same_mac_across_instances() {
        HmacCryptoService other = HmacCryptoService.fromSecret(SECRET, new SecureRandom());

        assertArrayEquals(crypto.mac(bytes("payload")), other.mac(bytes("payload")));
    }

    @Test
    void generated_keys_differ() {
        HmacCryptoService first = HmacCryptoService.fromSecret("", new SecureRandom());
        HmacCryptoService second = HmacCryptoService.fromSecret(null, new SecureRandom());

        assertFalse(second.verifyMac(bytes("payload"), first.mac(bytes("payload"))));
    }

    @Test
    void short_or_invalid_keys_are_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new HmacCryptoService(new SecretKeySpec(new byte[16], "HmacSHA256"), new SecureRandom()));
        assertThrows(CryptoService.CryptoException.class,
                () -> HmacCryptoService.fromSecret("***not base64***", new SecureRandom()));
    }

    @Test
    void random_bytes_have_requested_length() {
        assertEquals(16, crypto.randomBytes(16).length);
        assertEquals(32, crypto.hash(bytes("x")).length);
    }
}
