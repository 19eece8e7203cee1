package io.kairos.core.store;

public record StoreLimits(int maxConversations, int maxEmotionalStates) {
    public static final int DEFAULT_MAX_CONVERSATIONS = 100;
    public static final int DEFAULT_MAX_EMOTIONAL_STATES = 50;

    public StoreLimits {
        maxConversations = maxConversations <= 0 ? DEFAULT_MAX_CONVERSATIONS : maxConversations;
        maxEmotionalStates = maxEmotionalStates <= 0 ? DEFAULT_MAX_EMOTIONAL_STATES : maxEmotionalStates;
    }

    public static StoreLimits defaults() {
        return new StoreLimits(DEFAULT_MAX_CONVERSATIONS, DEFAULT_MAX_EMOTIONAL_STATES);
    }
}
