package com.resourcelocator.domain.policy;

import java.util.Optional;

/**
 * Condition tags understood by the boolean evaluator.
 */
public enum ConditionTag {
    /** Caller id equals the owner id derived from the logical name. */
    IS_OWNER("isOwner"),

    /** Monday to Friday, hour in [9, 17). */
    IS_BUSINESS_HOURS("isBusinessHours"),

    /** Saturday or Sunday. */
    IS_WEEKEND("isWeekend"),

    /** Ambient on-call flag is set. */
    IS_ON_CALL("isOnCall");

    private final String tag;

    ConditionTag(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static Optional<ConditionTag> fromTag(String tag) {
        for (ConditionTag candidate : values()) {
            if (candidate.tag.equals(tag)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
