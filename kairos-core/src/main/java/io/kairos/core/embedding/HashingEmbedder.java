package io.kairos.core.embedding;

import io.kairos.core.vector.VectorMath;
import java.util.List;

/**
 * Offline bag-of-words embedder: every token is hashed into one bucket, then the vector is
 * L2-normalised. Text without any token yields the zero vector.
 */
public final class HashingEmbedder implements Embedder {
    public static final int DEFAULT_DIMENSION = 256;

    private final int dimension;

    public HashingEmbedder() {
        this(DEFAULT_DIMENSION);
    }

    public HashingEmbedder(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public List<Double> embed(String text) {
        double[] vector = new double[dimension];
        for (String token : TextTokens.tokenize(text)) {
            vector[Math.floorMod(token.hashCode(), dimension)] += 1.0;
        }
        return VectorMath.normalize(vector);
    }

    @Override
    public int dimension() {
        return dimension;
    }
}
