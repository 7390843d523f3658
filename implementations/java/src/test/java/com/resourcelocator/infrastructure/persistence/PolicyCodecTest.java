package com.resourcelocator.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resourcelocator.domain.model.Claim;
import com.resourcelocator.domain.policy.AccessPolicy;
import com.resourcelocator.domain.policy.BooleanPolicy;
import com.resourcelocator.domain.policy.Dimension;
import com.resourcelocator.domain.policy.PolicyNode;
import com.resourcelocator.domain.policy.VectorPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolicyCodecTest {

    private final PolicyCodec codec = new PolicyCodec(new ObjectMapper());

    private PolicyNode requirement(String json) {
        AccessPolicy policy = codec.decodePolicy(json);
        assertTrue(policy instanceof BooleanPolicy, "expected a boolean policy for " + json);
        return ((BooleanPolicy) policy).getRequirement();
    }

    @Test
    void decodes_the_stored_and_shape() {
        PolicyNode node = requirement(
                "{\"operator\":\"AND\",\"clauses\":[{\"action\":\"read\",\"resourceType\":\"task-list\"},\"isOwner\"]}");

        assertEquals(PolicyNode.and(PolicyNode.leaf("read", "task-list"), PolicyNode.condition("isOwner")), node);
    }

    @Test
    void decodes_nested_or_and_bare_conditions() {
        PolicyNode node = requirement(
                "{\"operator\":\"OR\",\"clauses\":[\"isOnCall\",{\"operator\":\"AND\",\"clauses\":[\"isBusinessHours\"]}]}");

        assertEquals(PolicyNode.or(PolicyNode.condition("isOnCall"),
                PolicyNode.and(PolicyNode.condition("isBusinessHours"))), node);
        assertEquals(PolicyNode.condition("isWeekend"), requirement("\"isWeekend\""));
    }

    @Test
    void unknown_operator_decodes_to_malformed_node() {
        PolicyNode node = requirement("{\"operator\":\"XOR\",\"clauses\":[\"isOwner\"]}");

        assertTrue(node instanceof PolicyNode.Malformed);
        assertEquals("Unknown operator 'XOR'", ((PolicyNode.Malformed) node).getDescription());
    }

    @Test
    void garbage_decodes_to_malformed_instead_of_throwing() {
        assertTrue(requirement("{not json") instanceof PolicyNode.Malformed);
        assertTrue(requirement("42") instanceof PolicyNode.Malformed);
        assertTrue(requirement("{\"action\":\"read\"}") instanceof PolicyNode.Malformed);
        assertTrue(requirement("{\"operator\":\"AND\"}") instanceof PolicyNode.Malformed);
        assertTrue(requirement("\"\"") instanceof PolicyNode.Malformed);
    }

    @Test
    void decodes_vector_policy_including_legacy_map_type() {
        AccessPolicy policy = codec.decodePolicy(
                "{\"dimensions\":[{\"name\":\"clearance\",\"type\":\"map\",\"map\":\"clearance\"},"
                        + "{\"name\":\"seniority\",\"type\":\"numeric\"}],"
                        + "\"position\":[3,5],\"threshold\":0.99}");

        assertTrue(policy instanceof VectorPolicy);
        VectorPolicy vector = (VectorPolicy) policy;
        assertEquals(List.of(Dimension.categorical("clearance", "clearance"), Dimension.numeric("seniority")),
                vector.getDimensions().orElseThrow());
        assertArrayEquals(new double[]{3, 5}, vector.getPosition().orElseThrow());
        assertEquals(0.99, vector.getThreshold().orElseThrow());
    }

    @Test
    void incomplete_vector_policy_stays_vector_with_missing_parts() {
        AccessPolicy policy = codec.decodePolicy("{\"position\":[1,2]}");

        assertTrue(policy instanceof VectorPolicy);
        assertTrue(((VectorPolicy) policy).getThreshold().isEmpty());
        assertTrue(((VectorPolicy) policy).getDimensions().isEmpty());
    }

    @Test
    void unknown_dimension_type_is_malformed() {
        PolicyNode node = requirement("{\"dimensions\":[{\"name\":\"x\",\"type\":\"polar\"}],"
                + "\"position\":[1],\"threshold\":0.5}");

        assertEquals("Unknown vector dimension type 'polar' for dimension 'x'",
                ((PolicyNode.Malformed) node).getDescription());
    }

    @Test
    void encoded_policies_decode_to_equal_values() {
        AccessPolicy booleanPolicy = BooleanPolicy.of(PolicyNode.or(
                PolicyNode.and(PolicyNode.leaf("read", "report"), PolicyNode.condition("isOwner")),
                PolicyNode.condition("isOnCall")));
        AccessPolicy vectorPolicy = new VectorPolicy(
                List.of(Dimension.numeric("x"), Dimension.categorical("c", "clearance")), new double[]{1, 2}, 0.8);

        assertEquals(booleanPolicy, codec.decodePolicy(codec.encodePolicy(booleanPolicy)));
        assertEquals(vectorPolicy, codec.decodePolicy(codec.encodePolicy(vectorPolicy)));
    }

    @Test
    void decodes_claims_with_condition_or_legacy_conditions() {
        List<Claim> claims = codec.decodeClaims("["
                + "{\"action\":\"read\",\"resourceType\":\"report\"},"
                + "{\"action\":\"*\",\"resourceType\":\"regex:task-.*\",\"condition\":\"isOnCall\"},"
                + "{\"action\":\"write\",\"resourceType\":\"task\",\"conditions\":"
                + "{\"operator\":\"AND\",\"clauses\":[\"isBusinessHours\"]}}]");

        assertEquals(3, claims.size());
        assertTrue(claims.get(0).getCondition().isEmpty());
        assertEquals(PolicyNode.condition("isOnCall"), claims.get(1).getCondition().orElseThrow());
        assertEquals(PolicyNode.and(PolicyNode.condition("isBusinessHours")),
                claims.get(2).getCondition().orElseThrow());
    }

    @Test
    void claims_must_be_an_array_of_complete_claims() {
        assertThrows(IllegalArgumentException.class, () -> codec.decodeClaims("{}"));
        assertThrows(IllegalArgumentException.class, () -> codec.decodeClaims("[{\"action\":\"read\"}]"));
    }
}
