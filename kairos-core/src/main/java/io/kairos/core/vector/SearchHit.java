package io.kairos.core.vector;

public record SearchHit(String id, double similarity, IndexMetadata metadata) {
}
