package io.kairos.core.store;

import io.kairos.core.memory.Memory;
import java.util.List;

/**
 * Result of storing a memory: the record actually kept (a merge target when the write was
 * folded into an existing topic pattern) and anything evicted to stay within limits.
 */
public record WriteOutcome(Memory stored, boolean merged, List<Memory> evicted) {
    public WriteOutcome {
        evicted = evicted == null ? List.of() : List.copyOf(evicted);
    }
}
