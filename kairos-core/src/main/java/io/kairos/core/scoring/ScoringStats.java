package io.kairos.core.scoring;

import io.kairos.core.memory.MemoryKind;
import java.util.List;

public record ScoringStats(
    int totalMemories,
    double mean,
    double median,
    double min,
    double max,
    Distribution distribution,
    List<TopScore> topMemories
) {
    public ScoringStats {
        topMemories = topMemories == null ? List.of() : List.copyOf(topMemories);
    }

    public static ScoringStats empty() {
        return new ScoringStats(0, 0.0, 0.0, 0.0, 0.0, new Distribution(0, 0, 0), List.of());
    }

    /**
     * Counts of scores above 0.7, in (0.3, 0.7], and at or below 0.3.
     */
    public record Distribution(int high, int medium, int low) {
    }

    public record TopScore(String id, MemoryKind kind, double total) {
    }
}
