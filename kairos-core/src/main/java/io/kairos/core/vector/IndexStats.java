package io.kairos.core.vector;

import io.kairos.core.memory.MemoryKind;
import java.util.Map;

public record IndexStats(int totalVectors, int dimension, Map<MemoryKind, Integer> vectorsByKind) {
    public IndexStats {
        vectorsByKind = vectorsByKind == null ? Map.of() : Map.copyOf(vectorsByKind);
    }
}
