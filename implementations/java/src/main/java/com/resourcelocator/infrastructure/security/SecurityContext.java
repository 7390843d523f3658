package com.resourcelocator.infrastructure.security;

import com.resourcelocator.domain.model.Claim;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

/**
 * Immutable security context for one request.
 *
 * <p>Built by a front end from its transport payload and handed to the locator.
 * Never persisted.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class SecurityContext {

    /** Caller identity. */
    @NonNull String callerId;

    /** Claims held by the caller, in the order they should be tried. */
    @Singular List<Claim> claims;

    /** Caller's wall-clock time; the locator's clock and zone are used when absent. */
    ZonedDateTime requestedAt;

    boolean onCall;

    /** Custom ambient attributes projected by vector policies. */
    @Singular Map<String, Object> attributes;

    /** Request deadline bounding storage and audit I/O for this call. Optional. */
    Instant deadline;

    public SecurityContext withDeadline(Instant newDeadline) {
        return toBuilder().deadline(newDeadline).build();
    }
}
