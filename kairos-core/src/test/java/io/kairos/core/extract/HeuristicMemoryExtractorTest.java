package io.kairos.core.extract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.kairos.core.memory.ConversationPayload;
import io.kairos.core.memory.Emotion;
import io.kairos.core.memory.EmotionalStatePayload;
import io.kairos.core.memory.Intensity;
import io.kairos.core.memory.LifeEventCategory;
import io.kairos.core.memory.LifeEventPayload;
import io.kairos.core.memory.Memory;
import io.kairos.core.memory.MemoryKind;
import io.kairos.core.memory.Sentiment;
import io.kairos.core.memory.Topic;
import io.kairos.core.memory.TopicPatternPayload;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class HeuristicMemoryExtractorTest {
    private static final Instant T0 = Instant.parse("2026-04-02T09:00:00Z");

    @Test
    void shouldDetectCareerLifeEventAndSkipRepeatWithinADay() {
        ExtractedMemories first = extractorAt(T0).extract(turn("I just got a new job", "Congratulations!"), ExtractionHistory.empty());

        Memory event = first.findLifeEvent().orElseThrow();
        LifeEventPayload payload = (LifeEventPayload) event.payload();
        assertThat(payload.category()).isEqualTo(LifeEventCategory.CAREER);
        assertThat(payload.importance()).isEqualTo(Intensity.MEDIUM);
        assertThat(payload.description()).isEqualTo("I just got a new job");
        assertThat(payload.conversationId()).isEqualTo(first.conversation().id());
        assertThat(event.salience()).isEqualTo(Intensity.MEDIUM.salience());

        ExtractionHistory history = new ExtractionHistory(List.of(event));
        ExtractedMemories repeat = extractorAt(T0.plus(Duration.ofHours(6)))
            .extract(turn("I got a new job", "That is great news"), history);

        assertThat(repeat.findLifeEvent()).isEmpty();
        assertThat(repeat.findConversation()).isPresent();
    }

    @Test
    void shouldAcceptSameCategoryOnceTheWindowHasPassed() {
        ExtractedMemories first = extractorAt(T0).extract(turn("I just got a new job", ""), ExtractionHistory.empty());
        ExtractionHistory history = new ExtractionHistory(List.of(first.lifeEvent()));

        ExtractedMemories later = extractorAt(T0.plus(Duration.ofHours(25)))
            .extract(turn("My boss offered me a promotion", ""), history);

        assertThat(later.findLifeEvent()).isPresent();
        assertThat(((LifeEventPayload) later.lifeEvent().payload()).category()).isEqualTo(LifeEventCategory.CAREER);
    }

    @Test
    void shouldClassifyEmotionWithIntensity() {
        ExtractedMemories extracted = extractorAt(T0)
            .extract(turn("I'm really excited and a bit nervous about the trip", "Sounds amazing"), ExtractionHistory.empty());

        Memory state = extracted.findEmotionalState().orElseThrow();
        EmotionalStatePayload payload = (EmotionalStatePayload) state.payload();
        assertThat(payload.primary()).isEqualTo(Emotion.ANXIOUS);
        assertThat(payload.secondary()).containsExactly(Emotion.EXCITED);
        assertThat(payload.intensity()).isEqualTo(Intensity.HIGH);
        assertThat(state.emotionScore()).isCloseTo(-0.5, within(1e-9));
        assertThat(payload.conversationId()).isEqualTo(extracted.conversation().id());
    }

    @Test
    void shouldDefaultToNeutralMediumWhenNothingMatches() {
        ExtractedMemories extracted = extractorAt(T0)
            .extract(turn("The meeting moved to Tuesday", "Noted"), ExtractionHistory.empty());

        EmotionalStatePayload payload = (EmotionalStatePayload) extracted.emotionalState().payload();
        assertThat(payload.primary()).isEqualTo(Emotion.NEUTRAL);
        assertThat(payload.intensity()).isEqualTo(Intensity.MEDIUM);
        assertThat(extracted.emotionalState().emotionScore()).isZero();
    }

    @Test
    void shouldEmitTopicPatternLinkedToConversation() {
        ExtractedMemories extracted = extractorAt(T0)
            .extract(turn("Work stress is killing me, my project deadline moved", "Try to rest"), ExtractionHistory.empty());

        assertThat(extracted.topics()).containsExactly(Topic.WORK, Topic.EMOTIONS);
        TopicPatternPayload pattern = (TopicPatternPayload) extracted.findTopicPattern().orElseThrow().payload();
        assertThat(pattern.topics()).containsExactly(Topic.WORK, Topic.EMOTIONS);
        assertThat(pattern.frequency()).isEqualTo(1);
        assertThat(pattern.emotionalState()).isEqualTo(Emotion.ANXIOUS);
        assertThat(pattern.relatedConversations()).containsExactly(extracted.conversation().id());
    }

    @Test
    void shouldSkipTopicPatternWithoutTopics() {
        ExtractedMemories extracted = extractorAt(T0).extract(turn("Hello there", "Hi!"), ExtractionHistory.empty());

        assertThat(extracted.findTopicPattern()).isEmpty();
        assertThat(extracted.derived()).extracting(Memory::kind).containsExactly(MemoryKind.EMOTIONAL_STATE);
    }

    @Test
    void shouldSummarizeAndScoreConversation() {
        String longMessage = "x".repeat(150);
        ExtractedMemories extracted = extractorAt(T0)
            .extract(turn(longMessage, "I am glad, thanks for the great update"), ExtractionHistory.empty());

        Memory conversation = extracted.conversation();
        ConversationPayload payload = (ConversationPayload) conversation.payload();
        assertThat(conversation.kind()).isEqualTo(MemoryKind.CONVERSATION);
        assertThat(conversation.id()).startsWith("conv_");
        assertThat(payload.summary())
            .isEqualTo("User: \"" + "x".repeat(100) + "...\" | Assistant: \"I am glad, thanks for the great update\"");
        assertThat(payload.sentiment()).isEqualTo(Sentiment.POSITIVE);
        assertThat(conversation.emotionScore()).isEqualTo(1.0);
        assertThat(conversation.createdAt()).isEqualTo(T0);
    }

    @Test
    void shouldReturnOnlyNeutralConversationForEmptyUserMessage() {
        ExtractedMemories extracted = extractorAt(T0).extract(turn("   ", "I got a new job and I am happy"), ExtractionHistory.empty());

        assertThat(extracted.findConversation()).isPresent();
        assertThat(((ConversationPayload) extracted.conversation().payload()).primaryEmotion()).isEqualTo(Emotion.NEUTRAL);
        assertThat(extracted.derived()).isEmpty();
        assertThat(extracted.topics()).isEmpty();
    }

    @Test
    void shouldReturnNothingForMissingOwnerOrText() {
        HeuristicMemoryExtractor extractor = extractorAt(T0);

        assertThat(extractor.extract(new ConversationTurn("", "I got a new job", ""), ExtractionHistory.empty()))
            .isEqualTo(ExtractedMemories.empty());
        assertThat(extractor.extract(turn("", ""), null)).isEqualTo(ExtractedMemories.empty());
        assertThat(extractor.extract(null, null)).isEqualTo(ExtractedMemories.empty());
    }

    private static HeuristicMemoryExtractor extractorAt(Instant instant) {
        return new HeuristicMemoryExtractor(Clock.fixed(instant, ZoneOffset.UTC));
    }

    private static ConversationTurn turn(String user, String assistant) {
        return new ConversationTurn("u1", user, assistant);
    }
}
