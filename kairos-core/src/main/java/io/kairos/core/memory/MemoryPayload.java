package io.kairos.core.memory;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Kind-specific content of a {@link Memory}. Serialized with a {@code type} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(name = "conversation", value = ConversationPayload.class),
    @JsonSubTypes.Type(name = "fact", value = FactPayload.class),
    @JsonSubTypes.Type(name = "preference", value = PreferencePayload.class),
    @JsonSubTypes.Type(name = "life_event", value = LifeEventPayload.class),
    @JsonSubTypes.Type(name = "emotional_state", value = EmotionalStatePayload.class),
    @JsonSubTypes.Type(name = "topic_pattern", value = TopicPatternPayload.class),
    @JsonSubTypes.Type(name = "long_term", value = LongTermPayload.class)
})
public interface MemoryPayload {

    /**
     * Short text used when the memory is rendered into a context entry.
     */
    String describe();
}
