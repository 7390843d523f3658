package com.resourcelocator.infrastructure.security;

import com.resourcelocator.domain.model.Claim;
import com.resourcelocator.domain.policy.ConditionTag;
import com.resourcelocator.domain.policy.PolicyNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates boolean policy trees against a caller's claims and request context.
 *
 * <p>Evaluation is total: every node variant produces a result, and anything the
 * evaluator does not understand (unknown condition tag, unknown operator, empty
 * operator block, uncompilable claim pattern) fails closed with a readable reason.
 * Nothing here throws for bad policy input.
 *
 * <p>Reason strings are written for the audit trail:
 * <ul>
 *   <li>{@code Missing required claim: {action: 'read', resourceType: 'report'}}</li>
 *   <li>{@code Condition 'isOwner' failed}</li>
 *   <li>{@code AND clause failed: <reason of the first failing clause>}</li>
 *   <li>{@code OR block failed: [<reason>, <reason>]}</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Component
@Slf4j
public class BooleanPolicyEvaluator {

    private static final int BUSINESS_DAY_START_HOUR = 9;
    private static final int BUSINESS_DAY_END_HOUR = 17;

    /**
     * Check whether the caller's claims satisfy a resource requirement.
     *
     * <p>A bare leaf requirement is satisfied by the first held claim whose action and
     * resource type match and whose own condition (if any) holds; that claim is reported
     * back. Composite requirements report the first claim that satisfied one of their leaves.
     *
     * @param requirement Required policy tree
     * @param claims Claims held by the caller
     * @param context Evaluation context
     * @return result carrying the satisfying claim when met, the reason otherwise
     */
    public EvaluationResult checkPermission(PolicyNode requirement, List<Claim> claims, EvaluationContext context) {
        Objects.requireNonNull(requirement, "requirement");
        EvaluationResult result = evaluateConditions(requirement, context, claims);

        if (!result.isMet() && requirement instanceof PolicyNode.Leaf) {
            return result.withReason("No claim satisfied requirement: " + requirement
                + detailSuffix(result.getReason()));
        }
        return result;
    }

    /**
     * Evaluate a node recursively. A {@code null} node has no conditions and passes.
     */
    public EvaluationResult evaluateConditions(PolicyNode node, EvaluationContext context, List<Claim> claims) {
        if (node == null) {
            return EvaluationResult.met();
        }
        return node.accept(new NodeEvaluator(context, claims != null ? claims : List.of()));
    }

    /**
     * Match a requested action/resource type against a single claim.
     */
    boolean claimMatches(Claim claim, String action, String resourceType) {
        boolean actionMatch = Claim.WILDCARD.equals(claim.getAction()) || claim.getAction().equals(action);
        if (!actionMatch) {
            return false;
        }

        String claimedType = claim.getResourceType();
        if (claimedType.startsWith(Claim.REGEX_PREFIX)) {
            try {
                return Pattern.compile(claimedType.substring(Claim.REGEX_PREFIX.length()))
                    .matcher(resourceType)
                    .matches();
            } catch (PatternSyntaxException e) {
                log.warn("Invalid regex in claim resourceType, treating as no match: {}", e.getDescription());
                return false;
            }
        }
        return Claim.WILDCARD.equals(claimedType) || claimedType.equals(resourceType);
    }

    private static String detailSuffix(String reason) {
        return reason != null && reason.contains(";") ? reason.substring(reason.indexOf(';')) : "";
    }

    private final class NodeEvaluator implements PolicyNode.Visitor<EvaluationResult> {

        private final EvaluationContext context;
        private final List<Claim> claims;

        private NodeEvaluator(EvaluationContext context, List<Claim> claims) {
            this.context = context;
            this.claims = claims;
        }

        @Override
        public EvaluationResult visitLeaf(PolicyNode.Leaf leaf) {
            List<String> conditionFailures = new ArrayList<>();

            for (Claim claim : claims) {
                if (!claimMatches(claim, leaf.getAction(), leaf.getResourceType())) {
                    continue;
                }
                // Claim conditions are context predicates; they are evaluated without claims
                // so a claim can never vouch for itself.
                EvaluationResult conditionResult = claim.getCondition()
                    .map(condition -> evaluateConditions(condition, context, List.of()))
                    .orElse(EvaluationResult.met());

                if (conditionResult.isMet()) {
                    log.debug("Leaf {} satisfied by claim {}", leaf, claim);
                    return EvaluationResult.metBy(claim);
                }
                conditionFailures.add("claim " + claim + " condition failed: " + conditionResult.getReason());
            }

            String reason = "Missing required claim: " + leaf;
            if (!conditionFailures.isEmpty()) {
                reason += "; " + String.join("; ", conditionFailures);
            }
            return EvaluationResult.failed(reason);
        }

        @Override
        public EvaluationResult visitCondition(PolicyNode.Condition condition) {
            ConditionTag tag = ConditionTag.fromTag(condition.getTag()).orElse(null);
            if (tag == null) {
                log.warn("Unknown condition tag in policy: {}", condition.getTag());
                return EvaluationResult.malformed("Unknown condition '" + condition.getTag() + "'");
            }

            boolean conditionMet;
            switch (tag) {
                case IS_OWNER:
                    conditionMet = context.getResourceOwnerId()
                        .map(owner -> owner.equals(context.getCallerId()))
                        .orElse(false);
                    break;
                case IS_BUSINESS_HOURS:
                    conditionMet = isWeekday(context.getDayOfWeek())
                        && context.getHour() >= BUSINESS_DAY_START_HOUR
                        && context.getHour() < BUSINESS_DAY_END_HOUR;
                    break;
                case IS_WEEKEND:
                    conditionMet = !isWeekday(context.getDayOfWeek());
                    break;
                case IS_ON_CALL:
                    conditionMet = context.isOnCall();
                    break;
                default:
                    return EvaluationResult.malformed("Unhandled condition '" + condition.getTag() + "'");
            }

            return conditionMet
                ? EvaluationResult.met()
                : EvaluationResult.failed("Condition '" + condition.getTag() + "' failed");
        }

        @Override
        public EvaluationResult visitAnd(PolicyNode.And and) {
            if (and.getClauses().isEmpty()) {
                return EvaluationResult.malformed("Empty AND block");
            }

            Claim satisfiedBy = null;
            for (PolicyNode clause : and.getClauses()) {
                EvaluationResult result = clause.accept(this);
                if (!result.isMet()) {
                    return result.withReason("AND clause failed: " + result.getReason());
                }
                if (satisfiedBy == null) {
                    satisfiedBy = result.getSatisfiedBy().orElse(null);
                }
            }
            return EvaluationResult.met().withSatisfiedBy(satisfiedBy);
        }

        @Override
        public EvaluationResult visitOr(PolicyNode.Or or) {
            if (or.getClauses().isEmpty()) {
                return EvaluationResult.malformed("Empty OR block");
            }

            List<String> failureReasons = new ArrayList<>();
            boolean malformed = false;
            for (PolicyNode clause : or.getClauses()) {
                EvaluationResult result = clause.accept(this);
                if (result.isMet()) {
                    return result;
                }
                failureReasons.add(result.getReason());
                malformed |= result.isMalformed();
            }

            String reason = "OR block failed: [" + String.join(", ", failureReasons) + "]";
            return malformed ? EvaluationResult.malformed(reason) : EvaluationResult.failed(reason);
        }

        @Override
        public EvaluationResult visitMalformed(PolicyNode.Malformed malformed) {
            return EvaluationResult.malformed(malformed.getDescription());
        }

        private boolean isWeekday(DayOfWeek day) {
            return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
        }
    }
}
