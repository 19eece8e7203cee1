package io.kairos.core.memory;

public record FactPayload(String text, String category) implements MemoryPayload {
    public FactPayload {
        text = text == null ? "" : text.trim();
        category = category == null || category.isBlank() ? "general" : category.trim();
    }

    @Override
    public String describe() {
        return text;
    }
}
