package io.kairos.core.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

public record TopicPatternPayload(
    List<Topic> topics,
    Emotion emotionalState,
    int frequency,
    List<String> relatedConversations,
    Instant lastSeenAt
) implements MemoryPayload {
    public TopicPatternPayload {
        topics = topics == null ? List.of() : List.copyOf(new LinkedHashSet<>(topics));
        emotionalState = emotionalState == null ? Emotion.NEUTRAL : emotionalState;
        frequency = Math.max(1, frequency);
        relatedConversations = relatedConversations == null ? List.of() : List.copyOf(relatedConversations);
        lastSeenAt = lastSeenAt == null ? Instant.EPOCH : lastSeenAt;
    }

    public boolean mergeableWith(TopicPatternPayload other) {
        return emotionalState == other.emotionalState && sharesTopic(other.topics);
    }

    public boolean sharesTopic(Collection<Topic> candidates) {
        for (Topic topic : candidates) {
            if (topics.contains(topic)) {
                return true;
            }
        }
        return false;
    }

    public TopicPatternPayload mergedWith(TopicPatternPayload other) {
        LinkedHashSet<Topic> mergedTopics = new LinkedHashSet<>(topics);
        mergedTopics.addAll(other.topics);
        List<String> conversations = new ArrayList<>(relatedConversations);
        conversations.addAll(other.relatedConversations);
        Instant lastSeen = lastSeenAt.isAfter(other.lastSeenAt) ? lastSeenAt : other.lastSeenAt;
        return new TopicPatternPayload(
            new ArrayList<>(mergedTopics),
            emotionalState,
            frequency + other.frequency,
            conversations,
            lastSeen
        );
    }

    @Override
    public String describe() {
        String joined = topics.stream().map(Topic::label).collect(Collectors.joining(", "));
        return joined + " while " + emotionalState.label() + " (x" + frequency + ")";
    }
}
