package io.kairos.core.memory;

public enum Sentiment {
    POSITIVE,
    NEGATIVE,
    NEUTRAL
}
