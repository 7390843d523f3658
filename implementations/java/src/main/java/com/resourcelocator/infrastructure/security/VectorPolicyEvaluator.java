package com.resourcelocator.infrastructure.security;

import com.resourcelocator.domain.policy.Dimension;
import com.resourcelocator.domain.policy.VectorPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Grants access when the caller's projected context vector points in nearly the
 * same direction as a resource's target vector.
 *
 * <p>The caller vector is built dimension by dimension from the context's ambient
 * attributes: numeric dimensions pass the attribute through (0 when absent or not a
 * number), categorical dimensions look the attribute up in a named value map (0 when
 * the value is not in the map). Cosine similarity is 0 when either vector has zero
 * magnitude or the lengths differ.
 *
 * <p>Both grant and deny reasons report the similarity to 3 decimal places.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VectorPolicyEvaluator {

    private final VectorValueMaps valueMaps;

    public EvaluationResult evaluate(VectorPolicy policy, EvaluationContext context) {
        Optional<List<Dimension>> dimensions = policy.getDimensions();
        Optional<double[]> target = policy.getPosition();
        Optional<Double> threshold = policy.getThreshold();

        if (dimensions.isEmpty() || target.isEmpty() || threshold.isEmpty()) {
            return EvaluationResult.malformed(
                "Vector policy is incomplete (missing position, threshold, or dimensions)");
        }

        double[] callerVector = new double[dimensions.get().size()];
        for (int i = 0; i < callerVector.length; i++) {
            Dimension dimension = dimensions.get().get(i);
            Object value = context.getAttributes().get(dimension.getName());

            if (dimension.getType() == Dimension.Type.NUMERIC) {
                callerVector[i] = toNumber(value);
            } else {
                Optional<Map<String, Double>> map = valueMaps.get(dimension.getMap());
                if (map.isEmpty()) {
                    return EvaluationResult.malformed("Unknown vector map '" + dimension.getMap()
                        + "' for dimension '" + dimension.getName() + "'");
                }
                callerVector[i] = value == null ? 0 : map.get().getOrDefault(String.valueOf(value), 0.0);
            }
        }

        if (callerVector.length != target.get().length) {
            return EvaluationResult.malformed("Vector dimension mismatch. Expected "
                + target.get().length + ", got " + callerVector.length + ".");
        }

        double similarity = cosineSimilarity(target.get(), callerVector);
        String formatted = String.format(Locale.ROOT, "%.3f", similarity);
        String formattedThreshold = BigDecimal.valueOf(threshold.get()).stripTrailingZeros().toPlainString();

        log.debug("Vector evaluation: caller={}, similarity={}, threshold={}",
            context.getCallerId(), formatted, formattedThreshold);

        if (similarity >= threshold.get()) {
            return EvaluationResult.met("Similarity " + formatted + " meets threshold " + formattedThreshold);
        }
        return EvaluationResult.failed("Similarity " + formatted + " is below threshold " + formattedThreshold);
    }

    /**
     * Cosine of the angle between two vectors; 0 for differing lengths or a zero vector.
     */
    public static double cosineSimilarity(double[] a, double[] b) {
        if (a.length != b.length) {
            return 0;
        }

        double dotProduct = 0;
        double magnitudeA = 0;
        double magnitudeB = 0;
        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            magnitudeA += a[i] * a[i];
            magnitudeB += b[i] * b[i];
        }

        magnitudeA = Math.sqrt(magnitudeA);
        magnitudeB = Math.sqrt(magnitudeB);
        if (magnitudeA == 0 || magnitudeB == 0) {
            return 0;
        }
        return dotProduct / (magnitudeA * magnitudeB);
    }

    private static double toNumber(Object value) {
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            return Double.isFinite(number) ? number : 0;
        }
        if (value instanceof String) {
            try {
                double number = Double.parseDouble((String) value);
                return Double.isFinite(number) ? number : 0;
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }
}
