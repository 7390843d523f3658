package com.resourcelocator.domain.policy;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * Node of a boolean access-policy tree.
 *
 * <p>The tree is a closed union: {@link Leaf} (a claim requirement), {@link Condition}
 * (a named context predicate), {@link And}, {@link Or}, and {@link Malformed} for input
 * that could not be understood (for example an unknown operator read from storage).
 * Dispatch goes through {@link Visitor}, so every evaluator must handle every variant.
 *
 * @since 1.0.0
 */
public abstract class PolicyNode {

    private PolicyNode() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public static Leaf leaf(String action, String resourceType) {
        return new Leaf(action, resourceType);
    }

    public static Condition condition(String tag) {
        return new Condition(tag);
    }

    public static And and(PolicyNode... clauses) {
        return new And(List.of(clauses));
    }

    public static Or or(PolicyNode... clauses) {
        return new Or(List.of(clauses));
    }

    public static And and(List<PolicyNode> clauses) {
        return new And(clauses);
    }

    public static Or or(List<PolicyNode> clauses) {
        return new Or(clauses);
    }

    public static Malformed malformed(String description) {
        return new Malformed(description);
    }

    public interface Visitor<R> {
        R visitLeaf(Leaf leaf);

        R visitCondition(Condition condition);

        R visitAnd(And and);

        R visitOr(Or or);

        R visitMalformed(Malformed malformed);
    }

    /**
     * Requires a held claim with a matching action and resource type.
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Leaf extends PolicyNode {
        private final String action;
        private final String resourceType;

        private Leaf(String action, String resourceType) {
            this.action = requireText(action, "action");
            this.resourceType = requireText(resourceType, "resourceType");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLeaf(this);
        }

        @Override
        public String toString() {
            return "{action: '" + action + "', resourceType: '" + resourceType + "'}";
        }
    }

    /**
     * Named predicate over the evaluation context, e.g. {@code isOwner}.
     * Unknown tags are representable and evaluate to a denial.
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Condition extends PolicyNode {
        private final String tag;

        private Condition(String tag) {
            this.tag = requireText(tag, "tag");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCondition(this);
        }

        @Override
        public String toString() {
            return tag;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class And extends PolicyNode {
        private final List<PolicyNode> clauses;

        private And(List<PolicyNode> clauses) {
            this.clauses = List.copyOf(clauses);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnd(this);
        }

        @Override
        public String toString() {
            return "AND" + clauses;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Or extends PolicyNode {
        private final List<PolicyNode> clauses;

        private Or(List<PolicyNode> clauses) {
            this.clauses = List.copyOf(clauses);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOr(this);
        }

        @Override
        public String toString() {
            return "OR" + clauses;
        }
    }

    /**
     * Placeholder for an expression that could not be parsed. Always fails closed.
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Malformed extends PolicyNode {
        private final String description;

        private Malformed(String description) {
            this.description = Objects.requireNonNull(description, "description");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMalformed(this);
        }

        @Override
        public String toString() {
            return "MALFORMED(" + description + ")";
        }
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value;
    }
}
