package com.modelgateway.service.cache;

/**
 * Vector similarity helpers.
 */
public final class VectorSimilarity {

    private VectorSimilarity() {
    }

    /**
     * Cosine similarity in [-1, 1]. Zero for missing, zero-length or
     * dimension-mismatched vectors.
     */
    public static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) {
            return 0.0;
        }

        // Cosine similarity = dot product / (norm1 * norm2)
        double dotProduct = 0.0;
        double norm1 = 0.0;
        double norm2 = 0.0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            norm1 += a[i] * a[i];
            norm2 += b[i] * b[i];
        }

        if (norm1 == 0.0 || norm2 == 0.0) {
            return 0.0;
        }

        return dotProduct / (Math.sqrt(norm1) * Math.sqrt(norm2));
    }
}
