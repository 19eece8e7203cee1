package io.kairos.core.memory;

import java.util.List;

public record ConversationPayload(
    String userMessage,
    String assistantMessage,
    String summary,
    Emotion primaryEmotion,
    List<Topic> topics,
    Sentiment sentiment
) implements MemoryPayload {
    public ConversationPayload {
        userMessage = userMessage == null ? "" : userMessage;
        assistantMessage = assistantMessage == null ? "" : assistantMessage;
        summary = summary == null ? "" : summary;
        primaryEmotion = primaryEmotion == null ? Emotion.NEUTRAL : primaryEmotion;
        topics = topics == null ? List.of() : List.copyOf(topics);
        sentiment = sentiment == null ? Sentiment.NEUTRAL : sentiment;
    }

    @Override
    public String describe() {
        return summary;
    }
}
