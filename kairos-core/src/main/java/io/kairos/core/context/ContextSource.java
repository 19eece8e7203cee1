package io.kairos.core.context;

/**
 * Section of the assembled context an entry belongs to, in emission order.
 */
public enum ContextSource {
    CONVERSATION,
    EMOTIONAL_TREND,
    LIFE_EVENT,
    FACTS,
    PREFERENCES,
    RELATIONSHIPS,
    GOALS,
    INTERESTS
}
