package com.resourcelocator.infrastructure.security;

import com.resourcelocator.domain.model.Claim;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of evaluating a policy or a policy sub-tree.
 *
 * <p>{@code malformed} marks failures caused by the policy itself (unknown operator,
 * unknown condition, unknown value map, incomplete vector) rather than by the caller.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EvaluationResult {

    private static final EvaluationResult MET = new EvaluationResult(true, null, null, false);

    boolean met;
    String reason;
    Claim satisfiedBy;
    boolean malformed;

    public static EvaluationResult met() {
        return MET;
    }

    public static EvaluationResult met(String reason) {
        return new EvaluationResult(true, reason, null, false);
    }

    public static EvaluationResult metBy(Claim claim) {
        return new EvaluationResult(true, null, claim, false);
    }

    public static EvaluationResult failed(String reason) {
        return new EvaluationResult(false, reason, null, false);
    }

    public static EvaluationResult malformed(String reason) {
        return new EvaluationResult(false, reason, null, true);
    }

    public Optional<Claim> getSatisfiedBy() {
        return Optional.ofNullable(satisfiedBy);
    }

    EvaluationResult withSatisfiedBy(Claim claim) {
        return new EvaluationResult(met, reason, claim, malformed);
    }

    EvaluationResult withReason(String newReason) {
        return new EvaluationResult(met, newReason, satisfiedBy, malformed);
    }
}
