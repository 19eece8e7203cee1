package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kairos.core.embedding.HashingEmbedder;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingConfig(int dimension) {

    public static EmbeddingConfig defaults() {
        return new EmbeddingConfig(HashingEmbedder.DEFAULT_DIMENSION);
    }
}
