package io.kairos.core.vector;

import java.util.List;
import java.util.Map;

/**
 * Similarity index over embeddings keyed by memory id.
 */
public interface VectorIndex {

    /**
     * Stores the embedding, replacing any previous entry for {@code id}.
     */
    void insert(String id, List<Double> embedding, IndexMetadata metadata);

    /**
     * Replaces the embedding and merges attributes of an existing entry.
     *
     * @return false when {@code id} is not indexed
     */
    boolean update(String id, List<Double> embedding, Map<String, String> attributes);

    /**
     * Removes the entry. Absent ids are ignored.
     */
    boolean delete(String id);

    /**
     * Returns at most {@code k} entries matching {@code filter}, most similar first. Read-only.
     */
    SearchResult search(List<Double> queryEmbedding, int k, SearchFilter filter);

    boolean contains(String id);

    int size();

    IndexStats stats();
}
