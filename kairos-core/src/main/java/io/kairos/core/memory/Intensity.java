package io.kairos.core.memory;

import java.util.Locale;

public enum Intensity {
    HIGH(0.9, 1.0),
    MEDIUM(0.6, 0.75),
    LOW(0.3, 0.5);

    private final double salience;
    private final double emotionScale;

    Intensity(double salience, double emotionScale) {
        this.salience = salience;
        this.emotionScale = emotionScale;
    }

    public double salience() {
        return salience;
    }

    public double emotionScale() {
        return emotionScale;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
