package com.salesanalytics.ledger;

import java.util.Arrays;
import java.util.List;

/**
 * Immutable fixed-dimension embedding.
 */
public final class EmbeddingVector {

    private final double[] components;

    private EmbeddingVector(double[] components) {
        this.components = components;
    }

    public static EmbeddingVector of(double... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("Embedding must have at least one component");
        }
        return new EmbeddingVector(components.clone());
    }

    public static EmbeddingVector of(List<? extends Number> components) {
        if (components == null || components.isEmpty()) {
            throw new IllegalArgumentException("Embedding must have at least one component");
        }
        double[] values = new double[components.size()];
        for (int i = 0; i < values.length; i++) {
            Number value = components.get(i);
            if (value == null) {
                throw new IllegalArgumentException("Embedding component " + i + " is null");
            }
            values[i] = value.doubleValue();
        }
        return new EmbeddingVector(values);
    }

    public int dimension() {
        return components.length;
    }

    public double get(int index) {
        return components[index];
    }

    public double norm() {
        double sum = 0.0;
        for (double component : components) {
            sum += component * component;
        }
        return Math.sqrt(sum);
    }

    public EmbeddingVector negate() {
        double[] negated = new double[components.length];
        for (int i = 0; i < negated.length; i++) {
            negated[i] = -components[i];
        }
        return new EmbeddingVector(negated);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EmbeddingVector other)) {
            return false;
        }
        return Arrays.equals(components, other.components);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(components);
    }

    @Override
    public String toString() {
        return "EmbeddingVector[dimension=" + components.length + "]";
    }
}
