package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KairosConfig(
    MemoryConfig memory,
    ScoringConfig scoring,
    StorageConfig storage,
    EmbeddingConfig embedding
) {
    public KairosConfig {
        memory = memory == null ? MemoryConfig.defaults() : memory;
        scoring = scoring == null ? ScoringConfig.defaults() : scoring;
        storage = storage == null ? StorageConfig.defaults() : storage;
        embedding = embedding == null ? EmbeddingConfig.defaults() : embedding;
    }

    public static KairosConfig defaults() {
        return new KairosConfig(
            MemoryConfig.defaults(),
            ScoringConfig.defaults(),
            StorageConfig.defaults(),
            EmbeddingConfig.defaults()
        );
    }
}
