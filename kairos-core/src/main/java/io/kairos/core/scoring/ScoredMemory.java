package io.kairos.core.scoring;

import io.kairos.core.memory.Memory;

public record ScoredMemory(Memory memory, ScoreResult score) {

    public double total() {
        return score.total();
    }
}
