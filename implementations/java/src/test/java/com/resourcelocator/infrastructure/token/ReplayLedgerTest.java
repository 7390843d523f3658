package com.resourcelocator.infrastructure.token;

import com.resourcelocator.support.ManualTicker;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ReplayLedgerTest {

    @Test
    void nonce_is_accepted_once() {
        ReplayLedger ledger = new ReplayLedger(Duration.ofMinutes(10));

        assertTrue(ledger.markRedeemed("a1"));
        assertFalse(ledger.markRedeemed("a1"));
        assertTrue(ledger.markRedeemed("b2"));
    }

    @Test
    void entries_are_forgotten_after_retention() {
        ManualTicker ticker = new ManualTicker();
        ReplayLedger ledger = new ReplayLedger(Duration.ofMinutes(10), ticker);

        ledger.markRedeemed("a1");
        ticker.advance(Duration.ofMinutes(11));

        assertTrue(ledger.markRedeemed("a1"));
    }
}
