package com.resourcelocator.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.resourcelocator.domain.model.Claim;
import com.resourcelocator.domain.policy.AccessPolicy;
import com.resourcelocator.domain.policy.BooleanPolicy;
import com.resourcelocator.domain.policy.Dimension;
import com.resourcelocator.domain.policy.PolicyNode;
import com.resourcelocator.domain.policy.VectorPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of policy expressions and claims, as stored in the {@code required_policy}
 * column and written in catalog configuration.
 *
 * <pre>
 * "isOwner"                                             condition
 * {"action": "read", "resourceType": "report"}          leaf
 * {"operator": "AND", "clauses": [ ... ]}               composite
 * {"dimensions": [...], "position": [...], "threshold": 0.9}   vector policy
 * </pre>
 *
 * <p>Decoding is total. Input the evaluators cannot understand (bad JSON, unknown
 * operator, a node of the wrong shape) becomes a {@link PolicyNode.Malformed} node,
 * which denies every request with a descriptive reason.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PolicyCodec {

    private static final String OPERATOR = "operator";
    private static final String CLAUSES = "clauses";
    private static final String ACTION = "action";
    private static final String RESOURCE_TYPE = "resourceType";
    private static final String CONDITION = "condition";
    private static final String LEGACY_CONDITIONS = "conditions";
    private static final String MALFORMED = "malformed";
    private static final String DIMENSIONS = "dimensions";
    private static final String POSITION = "position";
    private static final String THRESHOLD = "threshold";

    private final ObjectMapper objectMapper;

    public AccessPolicy decodePolicy(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Stored policy is not valid JSON; resource will deny all requests");
            return BooleanPolicy.of(PolicyNode.malformed("Unparseable policy expression"));
        }
        if (root == null || root.isNull() || root.isMissingNode()) {
            return BooleanPolicy.of(PolicyNode.malformed("Empty policy expression"));
        }
        if (isVector(root)) {
            return decodeVector(root);
        }
        return BooleanPolicy.of(decodeNode(root));
    }

    public String encodePolicy(AccessPolicy policy) {
        JsonNode node = policy.accept(new AccessPolicy.Visitor<JsonNode>() {
            @Override
            public JsonNode visitBoolean(BooleanPolicy booleanPolicy) {
                return encodeNode(booleanPolicy.getRequirement());
            }

            @Override
            public JsonNode visitVector(VectorPolicy vectorPolicy) {
                return encodeVector(vectorPolicy);
            }
        });
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode policy", e);
        }
    }

    /**
     * Decode a single boolean node.
     */
    public PolicyNode decodeNode(JsonNode node) {
        if (node == null || node.isNull()) {
            return PolicyNode.malformed("Missing policy node");
        }
        if (node.isTextual()) {
            return node.asText().isBlank()
                ? PolicyNode.malformed("Blank condition tag")
                : PolicyNode.condition(node.asText());
        }
        if (!node.isObject()) {
            return PolicyNode.malformed("Unsupported policy node: " + node);
        }
        if (node.has(MALFORMED)) {
            return PolicyNode.malformed(node.get(MALFORMED).asText());
        }
        if (node.has(OPERATOR)) {
            return decodeComposite(node);
        }
        if (hasText(node, ACTION) && hasText(node, RESOURCE_TYPE)) {
            return PolicyNode.leaf(node.get(ACTION).asText(), node.get(RESOURCE_TYPE).asText());
        }
        return PolicyNode.malformed("Unsupported policy node: " + node);
    }

    public JsonNode encodeNode(PolicyNode node) {
        JsonNodeFactory factory = objectMapper.getNodeFactory();
        return node.accept(new PolicyNode.Visitor<JsonNode>() {
            @Override
            public JsonNode visitLeaf(PolicyNode.Leaf leaf) {
                return factory.objectNode()
                    .put(ACTION, leaf.getAction())
                    .put(RESOURCE_TYPE, leaf.getResourceType());
            }

            @Override
            public JsonNode visitCondition(PolicyNode.Condition condition) {
                return factory.textNode(condition.getTag());
            }

            @Override
            public JsonNode visitAnd(PolicyNode.And and) {
                return composite("AND", and.getClauses());
            }

            @Override
            public JsonNode visitOr(PolicyNode.Or or) {
                return composite("OR", or.getClauses());
            }

            @Override
            public JsonNode visitMalformed(PolicyNode.Malformed malformed) {
                return factory.objectNode().put(MALFORMED, malformed.getDescription());
            }

            private JsonNode composite(String operator, List<PolicyNode> clauses) {
                ObjectNode object = factory.objectNode().put(OPERATOR, operator);
                ArrayNode array = object.putArray(CLAUSES);
                clauses.forEach(clause -> array.add(clause.accept(this)));
                return object;
            }
        });
    }

    /**
     * Decode a JSON array of claims. Each claim may carry a {@code condition}
     * (or the older {@code conditions}) node.
     */
    public List<Claim> decodeClaims(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Claims are not valid JSON", e);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Claims must be a JSON array");
        }
        List<Claim> claims = new ArrayList<>();
        root.forEach(node -> claims.add(decodeClaim(node)));
        return claims;
    }

    public Claim decodeClaim(JsonNode node) {
        if (node == null || !node.hasNonNull(ACTION) || !node.hasNonNull(RESOURCE_TYPE)) {
            throw new IllegalArgumentException("A claim needs an action and a resourceType");
        }
        JsonNode condition = node.hasNonNull(CONDITION) ? node.get(CONDITION) : node.get(LEGACY_CONDITIONS);
        return new Claim(
            node.get(ACTION).asText(),
            node.get(RESOURCE_TYPE).asText(),
            condition == null || condition.isNull() ? null : decodeNode(condition));
    }

    private PolicyNode decodeComposite(JsonNode node) {
        String operator = node.get(OPERATOR).asText();
        JsonNode clauses = node.get(CLAUSES);
        if (!"AND".equals(operator) && !"OR".equals(operator)) {
            return PolicyNode.malformed("Unknown operator '" + operator + "'");
        }
        if (clauses == null || !clauses.isArray()) {
            return PolicyNode.malformed(operator + " block has no clauses array");
        }

        List<PolicyNode> decoded = new ArrayList<>();
        clauses.forEach(clause -> decoded.add(decodeNode(clause)));
        return "AND".equals(operator) ? PolicyNode.and(decoded) : PolicyNode.or(decoded);
    }

    private static boolean hasText(JsonNode node, String field) {
        return node.hasNonNull(field) && !node.get(field).asText().isBlank();
    }

    private static boolean isVector(JsonNode root) {
        return root.isObject() && (root.has(DIMENSIONS) || root.has(POSITION) || root.has(THRESHOLD));
    }

    private AccessPolicy decodeVector(JsonNode root) {
        List<Dimension> dimensions = null;
        if (root.hasNonNull(DIMENSIONS)) {
            if (!root.get(DIMENSIONS).isArray()) {
                return BooleanPolicy.of(PolicyNode.malformed("Vector dimensions must be an array"));
            }
            dimensions = new ArrayList<>();
            for (JsonNode dimension : root.get(DIMENSIONS)) {
                String name = dimension.path("name").asText(null);
                String type = dimension.path("type").asText("");
                if (name == null) {
                    return BooleanPolicy.of(PolicyNode.malformed("Vector dimension without a name"));
                }
                switch (type) {
                    case "numeric":
                        dimensions.add(Dimension.numeric(name));
                        break;
                    case "categorical":
                    case "map":
                        dimensions.add(Dimension.categorical(name, dimension.path("map").asText(null)));
                        break;
                    default:
                        return BooleanPolicy.of(PolicyNode.malformed(
                            "Unknown vector dimension type '" + type + "' for dimension '" + name + "'"));
                }
            }
        }

        double[] position = null;
        if (root.hasNonNull(POSITION)) {
            JsonNode array = root.get(POSITION);
            if (!array.isArray()) {
                return BooleanPolicy.of(PolicyNode.malformed("Vector position must be an array"));
            }
            position = new double[array.size()];
            for (int i = 0; i < position.length; i++) {
                if (!array.get(i).isNumber()) {
                    return BooleanPolicy.of(PolicyNode.malformed("Vector position must contain only numbers"));
                }
                position[i] = array.get(i).asDouble();
            }
        }

        Double threshold = null;
        if (root.hasNonNull(THRESHOLD)) {
            if (!root.get(THRESHOLD).isNumber()) {
                return BooleanPolicy.of(PolicyNode.malformed("Vector threshold must be a number"));
            }
            threshold = root.get(THRESHOLD).asDouble();
        }

        return new VectorPolicy(dimensions, position, threshold);
    }

    private JsonNode encodeVector(VectorPolicy policy) {
        ObjectNode root = objectMapper.createObjectNode();
        policy.getDimensions().ifPresent(dimensions -> {
            ArrayNode array = root.putArray(DIMENSIONS);
            for (Dimension dimension : dimensions) {
                ObjectNode object = array.addObject()
                    .put("name", dimension.getName())
                    .put("type", dimension.getType() == Dimension.Type.NUMERIC ? "numeric" : "categorical");
                if (dimension.getMap() != null) {
                    object.put("map", dimension.getMap());
                }
            }
        });
        policy.getPosition().ifPresent(position -> {
            ArrayNode array = root.putArray(POSITION);
            for (double coordinate : position) {
                array.add(coordinate);
            }
        });
        policy.getThreshold().ifPresent(threshold -> root.put(THRESHOLD, threshold));
        return root;
    }
}
