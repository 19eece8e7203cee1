package io.kairos.core.memory;

import java.util.List;

public record EmotionalStatePayload(
    Emotion primary,
    List<Emotion> secondary,
    Intensity intensity,
    String context,
    String conversationId
) implements MemoryPayload {
    public EmotionalStatePayload {
        primary = primary == null ? Emotion.NEUTRAL : primary;
        secondary = secondary == null ? List.of() : List.copyOf(secondary);
        intensity = intensity == null ? Intensity.MEDIUM : intensity;
        context = context == null ? "" : context;
        conversationId = conversationId == null ? "" : conversationId;
    }

    @Override
    public String describe() {
        return primary.label() + " (" + intensity.label() + ")";
    }
}
