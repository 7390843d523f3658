package com.resourcelocator.domain.policy;

/**
 * Required-policy expression of a resource definition.
 *
 * <p>Exactly one kind per resource: a {@link BooleanPolicy} tree or a
 * {@link VectorPolicy}. The two kinds are independent; there is no fallback
 * from one to the other.
 */
public interface AccessPolicy {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitBoolean(BooleanPolicy policy);

        R visitVector(VectorPolicy policy);
    }
}
