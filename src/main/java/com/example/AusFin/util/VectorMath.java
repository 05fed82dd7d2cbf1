package com.example.AusFin.util;

public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity of two embeddings. Zero vectors have similarity 0.
     */
    public static double cosineSimilarity(float[] v1, float[] v2) {
        if (v1.length != v2.length) {
            throw new IllegalArgumentException(
                    "embedding dimensions differ: " + v1.length + " vs " + v2.length);
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < v1.length; i++) {
            dotProduct += (double) v1[i] * v2[i];
            normA += (double) v1[i] * v1[i];
            normB += (double) v2[i] * v2[i];
        }

        if (normA == 0 || normB == 0) {
            return 0.0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
