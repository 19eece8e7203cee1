package io.kairos.core.extract;

import io.kairos.core.memory.Emotion;
import io.kairos.core.memory.Intensity;
import java.util.List;

public record DetectedEmotion(Emotion primary, List<Emotion> secondary, Intensity intensity) {
    public DetectedEmotion {
        primary = primary == null ? Emotion.NEUTRAL : primary;
        secondary = secondary == null ? List.of() : List.copyOf(secondary);
        intensity = intensity == null ? Intensity.MEDIUM : intensity;
    }

    public static DetectedEmotion neutral() {
        return new DetectedEmotion(Emotion.NEUTRAL, List.of(), Intensity.MEDIUM);
    }

    /**
     * Signed emotion score in [-1, 1]: the primary emotion's valence scaled by intensity.
     */
    public double score() {
        return primary.valence() * intensity.emotionScale();
    }
}
