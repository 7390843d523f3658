package com.resourcelocator.infrastructure.security;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.DayOfWeek;
import java.util.Map;
import java.util.Optional;

/**
 * Flattened view of a request used by the policy evaluators: caller attributes,
 * attributes derived from the resource, and time of day.
 */
@Value
@Builder
public class EvaluationContext {

    @NonNull String callerId;

    /** Owner id parsed from the logical name, if the name follows the owner convention. */
    String resourceOwnerId;

    @NonNull DayOfWeek dayOfWeek;

    int hour;

    boolean onCall;

    @Singular Map<String, Object> attributes;

    public Optional<String> getResourceOwnerId() {
        return Optional.ofNullable(resourceOwnerId);
    }
}
