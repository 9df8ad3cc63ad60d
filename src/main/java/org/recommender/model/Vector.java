package org.recommender.model;

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * A customer or item embedding. Scores are inner products between a customer
 * embedding and item embeddings of the same dimension.
 */
public final class Vector {

    private final double[] components;

    /**
     * @param components embedding values, copied; must be non-empty
     */
    public Vector(double[] components) {
        Preconditions.checkArgument(components != null, "components must not be null");
        Preconditions.checkArgument(components.length > 0, "embedding must have at least one component");
        this.components = components.clone();
    }

    public int dim() {
        return components.length;
    }

    /**
     * Inner product with an embedding of the same dimension.
     *
     * @throws IllegalArgumentException on a null argument or different dimensions
     */
    public double dot(Vector other) {
        Preconditions.checkArgument(other != null, "other must not be null");
        Preconditions.checkArgument(other.components.length == components.length,
                "cannot score a %s-dimensional embedding against a %s-dimensional one",
                components.length, other.components.length);
        double score = 0.0;
        for (int i = 0; i < components.length; i++) {
            score += components[i] * other.components[i];
        }
        return score;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Vector v && Arrays.equals(components, v.components);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(components);
    }

    @Override
    public String toString() {
        return "Vector" + Arrays.toString(components);
    }
}
