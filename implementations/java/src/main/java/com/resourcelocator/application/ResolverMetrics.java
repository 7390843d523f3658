package com.resourcelocator.application;

import com.resourcelocator.domain.model.CapabilityKind;
import com.resourcelocator.domain.model.FailureKind;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Counters for resolution and redemption outcomes. No caller ids or resource names
 * are used as tags.
 */
@Component
@Slf4j
public class ResolverMetrics {

    private final MeterRegistry meterRegistry;

    public ResolverMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        log.info("Initialized resolver metrics");
    }

    public void recordGranted(String policyKind) {
        meterRegistry.counter("locator.resolutions", "outcome", "granted", "policy", policyKind).increment();
    }

    public void recordFailure(FailureKind failure) {
        meterRegistry.counter("locator.resolutions", "outcome", failure.name().toLowerCase(Locale.ROOT)).increment();
    }

    public void recordRedeemed(CapabilityKind capability) {
        meterRegistry.counter("locator.redemptions", "outcome", "accepted",
            "capability", capability.name().toLowerCase(Locale.ROOT)).increment();
    }

    public void recordTokenFailure(FailureKind failure) {
        meterRegistry.counter("locator.redemptions", "outcome", failure.name().toLowerCase(Locale.ROOT)).increment();
    }
}
