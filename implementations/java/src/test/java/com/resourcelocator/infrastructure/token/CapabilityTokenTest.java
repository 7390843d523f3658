package com.resourcelocator.infrastructure.token;

import com.resourcelocator.domain.model.ConnectionDescriptor;
import com.resourcelocator.domain.model.EncryptedCredential;
import com.resourcelocator.domain.model.FailureKind;
import com.resourcelocator.infrastructure.crypto.CryptoService;
import com.resourcelocator.infrastructure.crypto.HmacCryptoService;
import com.resourcelocator.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityTokenTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-13T10:00:00Z"));
    private final CryptoService crypto = HmacCryptoService.fromSecret(null, new SecureRandom());

    private final ConnectionDescriptor descriptor = new ConnectionDescriptor(
            "sql", "reports_db/acct-42", new EncryptedCredential("enc:v1:abc"));

    private CapabilityToken issue(Duration lifetime) {
        return CapabilityToken.issue(descriptor, lifetime, crypto, clock);
    }

    private static void setField(Object target, String name, Object value) throws Exception {
        Field field = target.getClass().getDeclaredField(name);
        field.setAccessible(true);
        field.set(target, value);
    }

    private static Object getField(Object target, String name) throws Exception {
        Field field = target.getClass().getDeclaredField(name);
        field.setAccessible(true);
        return field.get(target);
    }

    @Test
    void fresh_token_is_valid() {
        CapabilityToken token = issue(Duration.ofSeconds(60));

        ValidationResult result = token.validate();

        assertTrue(result.isValid());
        assertTrue(result.getReason().isEmpty());
        assertEquals(clock.instant().plusSeconds(60), token.getExpiresAt());
    }

    @Test
    void token_is_valid_up_to_and_including_its_expiration_instant() {
        CapabilityToken token = issue(Duration.ofSeconds(60));

        clock.advance(Duration.ofSeconds(60));
        assertTrue(token.validate().isValid(), "valid at exactly expiresAt");

        clock.advance(Duration.ofMillis(1));
        ValidationResult expired = token.validate();
        assertFalse(expired.isValid());
        assertEquals(FailureKind.TOKEN_EXPIRED, expired.getFailure().orElseThrow());
        assertEquals("pointer_expired", expired.getReason().orElseThrow());
    }

    @Test
    void repeated_validation_after_expiry_is_stable() {
        CapabilityToken token = issue(Duration.ofSeconds(5));
        clock.advance(Duration.ofMinutes(1));

        ValidationResult first = token.validate();
        ValidationResult second = token.validate();
        clock.advance(Duration.ofHours(1));
        ValidationResult third = token.validate();

        assertEquals(first, second);
        assertEquals(first, third);
        assertEquals(FailureKind.TOKEN_EXPIRED, third.getFailure().orElseThrow());
    }

    @Test
    void mutating_the_wrapped_address_breaks_integrity() throws Exception {
        CapabilityToken token = issue(Duration.ofMinutes(5));

        Object internal = getField(token, "descriptor");
        setField(internal, "address", "reports_db/acct-99");

        ValidationResult result = token.validate();
        assertFalse(result.isValid());
        assertEquals(FailureKind.TOKEN_INTEGRITY_FAILURE, result.getFailure().orElseThrow());
        assertEquals("integrity_check_failed", result.getReason().orElseThrow());
    }

    @Test
    void extending_the_expiration_breaks_integrity() throws Exception {
        CapabilityToken token = issue(Duration.ofSeconds(1));

        setField(token, "expiresAt", clock.instant().plus(Duration.ofDays(365)));

        assertEquals(FailureKind.TOKEN_INTEGRITY_FAILURE, token.validate().getFailure().orElseThrow());
    }

    @Test
    void tampered_and_expired_token_reports_tampering() throws Exception {
        CapabilityToken token = issue(Duration.ofSeconds(1));
        setField(getField(token, "descriptor"), "protocol", "https");
        clock.advance(Duration.ofMinutes(10));

        assertEquals("integrity_check_failed", token.validate().getReason().orElseThrow());
    }

    @Test
    void descriptor_accessor_returns_an_independent_copy() throws Exception {
        CapabilityToken token = issue(Duration.ofMinutes(5));

        ConnectionDescriptor exposed = token.getDescriptor();
        assertEquals(descriptor, exposed);
        assertNotSame(getField(token, "descriptor"), exposed);

        setField(exposed, "address", "elsewhere");

        assertTrue(token.validate().isValid(), "mutating the exposed copy must not affect the token");
        assertEquals("reports_db/acct-42", token.getDescriptor().getAddress());
    }

    @Test
    void mutating_the_original_descriptor_after_signing_does_not_affect_the_token() throws Exception {
        ConnectionDescriptor original = new ConnectionDescriptor("sql", "reports_db/acct-42");
        CapabilityToken token = CapabilityToken.issue(original, Duration.ofMinutes(5), crypto, clock);

        setField(original, "address", "reports_db/acct-99");

        assertTrue(token.validate().isValid());
        assertEquals("reports_db/acct-42", token.getDescriptor().getAddress());
    }

    @Test
    void each_token_has_its_own_nonce() {
        CapabilityToken first = issue(Duration.ofSeconds(60));
        CapabilityToken second = issue(Duration.ofSeconds(60));

        assertNotEquals(first.getNonce(), second.getNonce());
        assertEquals(32, first.getNonce().length(), "16 random bytes as hex");
    }

    @Test
    void token_signed_under_another_key_does_not_validate_here() throws Exception {
        CapabilityToken foreign = CapabilityToken.issue(descriptor, Duration.ofSeconds(60),
                HmacCryptoService.fromSecret(null, new SecureRandom()), clock);

        setField(foreign, "cryptoService", crypto);

        assertEquals(FailureKind.TOKEN_INTEGRITY_FAILURE, foreign.validate().getFailure().orElseThrow());
    }

    @Test
    void non_positive_lifetime_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> issue(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> issue(Duration.ofSeconds(-1)));
    }

    @Test
    void string_form_never_contains_the_credential() {
        CapabilityToken token = issue(Duration.ofSeconds(60));

        assertFalse(token.toString().contains("enc:v1:abc"));
        assertFalse(token.getDescriptor().toString().contains("enc:v1:abc"));
    }
}
