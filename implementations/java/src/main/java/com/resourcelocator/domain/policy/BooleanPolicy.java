package com.resourcelocator.domain.policy;

import lombok.NonNull;
import lombok.Value;

@Value
public class BooleanPolicy implements AccessPolicy {

    @NonNull PolicyNode requirement;

    public static BooleanPolicy of(PolicyNode requirement) {
        return new BooleanPolicy(requirement);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBoolean(this);
    }
}
