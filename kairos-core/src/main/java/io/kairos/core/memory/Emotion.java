package io.kairos.core.memory;

import java.util.Locale;

public enum Emotion {
    HAPPY(0.8),
    SAD(-0.7),
    ANGRY(-0.8),
    ANXIOUS(-0.5),
    EXCITED(0.7),
    CALM(0.3),
    NEUTRAL(0.0);

    private final double valence;

    Emotion(double valence) {
        this.valence = valence;
    }

    /**
     * Polarity in [-1, 1] used as the emotion score of derived memories.
     */
    public double valence() {
        return valence;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
