package io.kairos.core;

import io.kairos.core.memory.Emotion;
import io.kairos.core.memory.Memory;
import java.util.List;
import java.util.Map;

/**
 * Emotional history of one owner: totals per primary emotion and the most recent states.
 */
public record EmotionalStats(int totalStates, Map<Emotion, Integer> counts, List<Memory> recent, Emotion dominant) {
    public EmotionalStats {
        counts = counts == null ? Map.of() : Map.copyOf(counts);
        recent = recent == null ? List.of() : List.copyOf(recent);
        dominant = dominant == null ? Emotion.NEUTRAL : dominant;
    }
}
