package io.kairos.core.memory;

public record PreferencePayload(String key, String value) implements MemoryPayload {
    public PreferencePayload {
        key = key == null ? "" : key.trim();
        value = value == null ? "" : value.trim();
    }

    @Override
    public String describe() {
        return key + ": " + value;
    }
}
