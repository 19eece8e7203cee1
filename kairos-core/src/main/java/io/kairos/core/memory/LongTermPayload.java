package io.kairos.core.memory;

public record LongTermPayload(String text, String category, Intensity importance) implements MemoryPayload {
    public LongTermPayload {
        text = text == null ? "" : text.trim();
        category = category == null || category.isBlank() ? "general" : category.trim();
        importance = importance == null ? Intensity.MEDIUM : importance;
    }

    @Override
    public String describe() {
        return text;
    }
}
