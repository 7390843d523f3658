package com.resourcelocator.infrastructure.security;

import com.resourcelocator.domain.policy.Dimension;
import com.resourcelocator.domain.policy.VectorPolicy;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VectorPolicyEvaluatorTest {

    private final VectorPolicyEvaluator evaluator = new VectorPolicyEvaluator(new VectorValueMaps(Map.of(
            "clearance", Map.of("public", 1.0, "internal", 2.0, "secret", 3.0))));

    private static final List<Dimension> XYZ = List.of(
            Dimension.numeric("x"), Dimension.numeric("y"), Dimension.numeric("z"));

    private EvaluationContext ctx(Map<String, Object> attributes) {
        return EvaluationContext.builder()
                .callerId("analyst-7")
                .dayOfWeek(DayOfWeek.WEDNESDAY)
                .hour(10)
                .attributes(attributes)
                .build();
    }

    @Test
    void identical_vector_is_granted_with_similarity_in_reason() {
        VectorPolicy policy = new VectorPolicy(XYZ, new double[]{3, 1, 1}, 0.99);

        EvaluationResult result = evaluator.evaluate(policy, ctx(Map.of("x", 3, "y", 1, "z", 1)));

        assertTrue(result.isMet());
        assertEquals("Similarity 1.000 meets threshold 0.99", result.getReason());
    }

    @Test
    void nearby_vector_below_threshold_is_denied_with_similarity_in_reason() {
        VectorPolicy policy = new VectorPolicy(XYZ, new double[]{3, 1, 1}, 0.99);

        EvaluationResult result = evaluator.evaluate(policy, ctx(Map.of("x", 3, "y", 2, "z", 1)));

        assertFalse(result.isMet());
        assertFalse(result.isMalformed());
        assertEquals("Similarity 0.967 is below threshold 0.99", result.getReason());
    }

    @Test
    void categorical_dimension_uses_value_map() {
        VectorPolicy policy = new VectorPolicy(
                List.of(Dimension.categorical("clearance", "clearance"), Dimension.numeric("seniority")),
                new double[]{3, 5}, 0.99);

        assertTrue(evaluator.evaluate(policy, ctx(Map.of("clearance", "secret", "seniority", 5))).isMet());
        assertFalse(evaluator.evaluate(policy, ctx(Map.of("clearance", "public", "seniority", 5))).isMet());
    }

    @Test
    void value_missing_from_map_projects_to_zero() {
        VectorPolicy policy = new VectorPolicy(List.of(Dimension.categorical("clearance", "clearance")),
                new double[]{1}, 0.5);

        EvaluationResult result = evaluator.evaluate(policy, ctx(Map.of("clearance", "cosmic")));

        assertEquals("Similarity 0.000 is below threshold 0.5", result.getReason());
    }

    @Test
    void unknown_value_map_is_malformed() {
        VectorPolicy policy = new VectorPolicy(List.of(Dimension.categorical("region", "regions")),
                new double[]{1}, 0.5);

        EvaluationResult result = evaluator.evaluate(policy, ctx(Map.of("region", "emea")));

        assertFalse(result.isMet());
        assertTrue(result.isMalformed());
        assertEquals("Unknown vector map 'regions' for dimension 'region'", result.getReason());
    }

    @Test
    void missing_and_non_numeric_attributes_project_to_zero() {
        VectorPolicy policy = new VectorPolicy(XYZ, new double[]{1, 0, 0}, 0.99);

        EvaluationResult result = evaluator.evaluate(policy, ctx(Map.of("x", "1.0", "y", "tall")));

        assertTrue(result.isMet(), "string '1.0' parses, 'tall' and the absent z project to 0");
    }

    @Test
    void zero_caller_vector_has_zero_similarity() {
        VectorPolicy policy = new VectorPolicy(XYZ, new double[]{3, 1, 1}, 0.1);

        EvaluationResult result = evaluator.evaluate(policy, ctx(Map.of()));

        assertFalse(result.isMet());
        assertEquals("Similarity 0.000 is below threshold 0.1", result.getReason());
    }

    @Test
    void dimension_mismatch_is_an_explicit_denial() {
        VectorPolicy policy = new VectorPolicy(List.of(Dimension.numeric("x"), Dimension.numeric("y")),
                new double[]{3, 1, 1}, 0.9);

        EvaluationResult result = evaluator.evaluate(policy, ctx(Map.of("x", 3, "y", 1)));

        assertFalse(result.isMet());
        assertTrue(result.isMalformed());
        assertEquals("Vector dimension mismatch. Expected 3, got 2.", result.getReason());
    }

    @Test
    void incomplete_policy_is_malformed() {
        EvaluationResult noThreshold = evaluator.evaluate(new VectorPolicy(XYZ, new double[]{1, 1, 1}, null),
                ctx(Map.of()));
        EvaluationResult noPosition = evaluator.evaluate(new VectorPolicy(XYZ, null, 0.5), ctx(Map.of()));

        assertTrue(noThreshold.isMalformed());
        assertTrue(noPosition.isMalformed());
    }

    @Test
    void threshold_is_printed_without_trailing_zeros() {
        VectorPolicy policy = new VectorPolicy(List.of(Dimension.numeric("x")), new double[]{1}, 1.0);

        assertEquals("Similarity 1.000 meets threshold 1",
                evaluator.evaluate(policy, ctx(Map.of("x", 2))).getReason());
    }

    @Test
    void cosine_similarity_edge_cases() {
        assertEquals(1.0, VectorPolicyEvaluator.cosineSimilarity(new double[]{1, 2}, new double[]{2, 4}), 1e-9);
        assertEquals(0.0, VectorPolicyEvaluator.cosineSimilarity(new double[]{1, 0}, new double[]{0, 1}), 1e-9);
        assertEquals(-1.0, VectorPolicyEvaluator.cosineSimilarity(new double[]{1, 0}, new double[]{-1, 0}), 1e-9);
        assertEquals(0.0, VectorPolicyEvaluator.cosineSimilarity(new double[]{1, 2}, new double[]{1, 2, 3}));
        assertEquals(0.0, VectorPolicyEvaluator.cosineSimilarity(new double[]{0, 0}, new double[]{1, 2}));
    }

    @Test
    void non_finite_target_coordinates_are_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new VectorPolicy(XYZ, new double[]{1, Double.NaN, 1}, 0.5));
    }
}
