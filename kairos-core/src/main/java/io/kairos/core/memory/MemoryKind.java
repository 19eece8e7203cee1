package io.kairos.core.memory;

public enum MemoryKind {
    CONVERSATION,
    FACT,
    PREFERENCE,
    LIFE_EVENT,
    EMOTIONAL_STATE,
    TOPIC_PATTERN,
    LONG_TERM
}
