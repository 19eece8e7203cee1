package io.kairos.core.embedding;

import java.util.List;

/**
 * Turns text into a fixed-length vector.
 */
public interface Embedder {

    /**
     * @throws EmbeddingUnavailableException when no embedding can be produced
     */
    List<Double> embed(String text);

    int dimension();
}
