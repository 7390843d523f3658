package com.resourcelocator.domain.model;

import com.resourcelocator.domain.policy.PolicyNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;
import java.util.Optional;

/**
 * Assertion held by a caller: {@code {action, resourceType, condition?}}.
 *
 * <p>{@code action} and {@code resourceType} accept the wildcard {@code *}.
 * A resource type of the form {@code regex:<pattern>} matches any requested type
 * the pattern fully matches; a pattern that does not compile matches nothing.
 */
@Getter
@EqualsAndHashCode
public final class Claim {

    public static final String WILDCARD = "*";
    public static final String REGEX_PREFIX = "regex:";

    private final String action;
    private final String resourceType;

    @Getter(lombok.AccessLevel.NONE)
    private final PolicyNode condition;

    public Claim(String action, String resourceType, PolicyNode condition) {
        this.action = Objects.requireNonNull(action, "Claim action must not be null");
        this.resourceType = Objects.requireNonNull(resourceType, "Claim resourceType must not be null");
        this.condition = condition;
    }

    public static Claim of(String action, String resourceType) {
        return new Claim(action, resourceType, null);
    }

    public Claim withCondition(PolicyNode newCondition) {
        return new Claim(action, resourceType, newCondition);
    }

    public Optional<PolicyNode> getCondition() {
        return Optional.ofNullable(condition);
    }

    @Override
    public String toString() {
        String base = "{action: '" + action + "', resourceType: '" + resourceType + "'";
        return condition == null ? base + "}" : base + ", condition: " + condition + "}";
    }
}
