package io.kairos.core.memory;

public record LifeEventPayload(
    LifeEventCategory category,
    String description,
    Intensity importance,
    Emotion emotionalImpact,
    String conversationId
) implements MemoryPayload {
    public static final int MAX_DESCRIPTION = 200;

    public LifeEventPayload {
        description = description == null ? "" : description;
        if (description.length() > MAX_DESCRIPTION) {
            description = description.substring(0, MAX_DESCRIPTION);
        }
        importance = importance == null ? Intensity.MEDIUM : importance;
        emotionalImpact = emotionalImpact == null ? Emotion.NEUTRAL : emotionalImpact;
        conversationId = conversationId == null ? "" : conversationId;
    }

    @Override
    public String describe() {
        return description;
    }
}
