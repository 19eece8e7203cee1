package io.kairos.core.extract;

import io.kairos.core.memory.Memory;
import java.util.List;

/**
 * Read-only view of an owner's earlier derived records, used for deduplication.
 */
public record ExtractionHistory(List<Memory> lifeEvents) {
    public ExtractionHistory {
        lifeEvents = lifeEvents == null ? List.of() : List.copyOf(lifeEvents);
    }

    public static ExtractionHistory empty() {
        return new ExtractionHistory(List.of());
    }
}
