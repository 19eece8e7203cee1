package io.kairos.core.vector;

import java.util.ArrayList;
import java.util.List;

public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity in [-1, 1]. Absent, empty or zero-magnitude vectors score 0.
     *
     * @throws DimensionMismatchException when both vectors are present with different lengths
     */
    public static double cosine(List<Double> a, List<Double> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.size() != b.size()) {
            throw new DimensionMismatchException(a.size(), b.size());
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.size(); i++) {
            double x = value(a.get(i));
            double y = value(b.get(i));
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    public static List<Double> normalize(double[] vector) {
        double norm = 0.0;
        for (double value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        List<Double> out = new ArrayList<>(vector.length);
        for (double value : vector) {
            out.add(norm == 0.0 ? 0.0 : value / norm);
        }
        return out;
    }

    private static double value(Double boxed) {
        return boxed == null || boxed.isNaN() ? 0.0 : boxed;
    }
}
