package com.resourcelocator.domain.policy;

import lombok.EqualsAndHashCode;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Continuous policy: grant when the cosine similarity between {@code position} and
 * the caller's projected vector reaches {@code threshold}.
 *
 * <p>Administrative contract: the order and meaning of {@code dimensions} must stay
 * stable across updates of a resource. Reordering or rescaling an axis silently
 * changes what existing targets mean; the evaluator cannot detect it.
 *
 * <p>Any part may be absent when the policy comes from storage; the evaluator denies
 * incomplete policies.
 */
@EqualsAndHashCode
public final class VectorPolicy implements AccessPolicy {

    private final List<Dimension> dimensions;
    private final double[] position;
    private final Double threshold;

    public VectorPolicy(List<Dimension> dimensions, double[] position, Double threshold) {
        this.dimensions = dimensions != null ? List.copyOf(dimensions) : null;
        this.position = position != null ? position.clone() : null;
        this.threshold = threshold;
        if (this.position != null) {
            for (double coordinate : this.position) {
                if (!Double.isFinite(coordinate)) {
                    throw new IllegalArgumentException("Vector coordinates must be finite");
                }
            }
        }
    }

    public Optional<List<Dimension>> getDimensions() {
        return Optional.ofNullable(dimensions);
    }

    /**
     * Copy of the target vector.
     */
    public Optional<double[]> getPosition() {
        return Optional.ofNullable(position).map(double[]::clone);
    }

    public Optional<Double> getThreshold() {
        return Optional.ofNullable(threshold);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitVector(this);
    }

    @Override
    public String toString() {
        return "VectorPolicy[dimensions=" + dimensions
            + ", position=" + Arrays.toString(position)
            + ", threshold=" + threshold + "]";
    }
}
