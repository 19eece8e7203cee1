package io.kairos.core;

import io.kairos.core.memory.MemoryKind;
import java.util.Map;

public record MemoryStats(
    String ownerId,
    int totalMemories,
    Map<MemoryKind, Integer> byKind,
    int relationships,
    int goals,
    int activeGoals,
    int interests
) {
    public MemoryStats {
        byKind = byKind == null ? Map.of() : Map.copyOf(byKind);
    }

    public int count(MemoryKind kind) {
        return byKind.getOrDefault(kind, 0);
    }
}
