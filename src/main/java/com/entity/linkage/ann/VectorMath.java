package com.entity.linkage.ann;

/**
 * Dense vector helpers shared by vector search, LSH and embeddings.
 */
public final class VectorMath {

    /** Norms below this are treated as zero. */
    public static final double MIN_MAGNITUDE = 1e-10;

    private VectorMath() {
    }

    public static double dot(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimensions differ: " + a.length + " vs " + b.length);
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    public static double norm(double[] v) {
        double sum = 0.0;
        for (double x : v) {
            sum += x * x;
        }
        return Math.sqrt(sum);
    }

    /**
     * Returns a unit-length copy of the vector. A zero vector is returned as a
     * plain copy rather than divided by zero.
     */
    public static double[] normalize(double[] v) {
        double[] result = v.clone();
        double norm = norm(v);
        if (norm < MIN_MAGNITUDE) {
            return result;
        }
        for (int i = 0; i < result.length; i++) {
            result[i] /= norm;
        }
        return result;
    }

    /**
     * Cosine similarity; 0.0 when either vector has zero magnitude.
     */
    public static double cosine(double[] a, double[] b) {
        double normA = norm(a);
        double normB = norm(b);
        if (normA < MIN_MAGNITUDE || normB < MIN_MAGNITUDE) {
            return 0.0;
        }
        return dot(a, b) / (normA * normB);
    }
}
