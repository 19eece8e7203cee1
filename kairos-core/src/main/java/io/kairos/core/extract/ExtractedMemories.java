package io.kairos.core.extract;

import io.kairos.core.memory.Memory;
import io.kairos.core.memory.Topic;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Records derived from one turn. Any of the memories may be null; {@code conversation} is
 * null only when the turn carried no text at all.
 */
public record ExtractedMemories(
    Memory conversation,
    Memory emotionalState,
    Memory lifeEvent,
    Memory topicPattern,
    List<Topic> topics
) {
    public ExtractedMemories {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }

    public static ExtractedMemories empty() {
        return new ExtractedMemories(null, null, null, null, List.of());
    }

    public Optional<Memory> findConversation() {
        return Optional.ofNullable(conversation);
    }

    public Optional<Memory> findEmotionalState() {
        return Optional.ofNullable(emotionalState);
    }

    public Optional<Memory> findLifeEvent() {
        return Optional.ofNullable(lifeEvent);
    }

    public Optional<Memory> findTopicPattern() {
        return Optional.ofNullable(topicPattern);
    }

    /**
     * Derived records in storage order: emotional state, life event, topic pattern.
     */
    public List<Memory> derived() {
        List<Memory> out = new ArrayList<>(3);
        findEmotionalState().ifPresent(out::add);
        findLifeEvent().ifPresent(out::add);
        findTopicPattern().ifPresent(out::add);
        return out;
    }
}
