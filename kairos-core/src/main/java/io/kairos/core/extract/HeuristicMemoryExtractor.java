package io.kairos.core.extract;

import io.kairos.core.memory.ConversationPayload;
import io.kairos.core.memory.EmotionalStatePayload;
import io.kairos.core.memory.LifeEventPayload;
import io.kairos.core.memory.Memory;
import io.kairos.core.memory.MemoryKind;
import io.kairos.core.memory.Sentiment;
import io.kairos.core.memory.Topic;
import io.kairos.core.memory.TopicPatternPayload;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HeuristicMemoryExtractor implements MemoryExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(HeuristicMemoryExtractor.class);
    private static final int SUMMARY_CHARS = 100;

    public static final Duration DEFAULT_LIFE_EVENT_WINDOW = Duration.ofHours(24);

    private final Clock clock;
    private final EmotionClassifier emotionClassifier;
    private final LifeEventClassifier lifeEventClassifier;
    private final TopicDetector topicDetector;
    private final SentimentAnalyzer sentimentAnalyzer;
    private final Duration lifeEventWindow;
    private final double defaultSalience;

    public HeuristicMemoryExtractor(Clock clock) {
        this(clock, new KeywordEmotionClassifier(), new KeywordLifeEventClassifier(), DEFAULT_LIFE_EVENT_WINDOW, Memory.DEFAULT_SALIENCE);
    }

    public HeuristicMemoryExtractor(
        Clock clock,
        EmotionClassifier emotionClassifier,
        LifeEventClassifier lifeEventClassifier,
        Duration lifeEventWindow,
        double defaultSalience
    ) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.emotionClassifier = Objects.requireNonNull(emotionClassifier, "emotionClassifier must not be null");
        this.lifeEventClassifier = Objects.requireNonNull(lifeEventClassifier, "lifeEventClassifier must not be null");
        this.topicDetector = new TopicDetector();
        this.sentimentAnalyzer = new SentimentAnalyzer();
        this.lifeEventWindow = lifeEventWindow == null ? DEFAULT_LIFE_EVENT_WINDOW : lifeEventWindow;
        this.defaultSalience = defaultSalience;
    }

    @Override
    public ExtractedMemories extract(ConversationTurn turn, ExtractionHistory history) {
        if (turn == null || turn.ownerId().isBlank()) {
            return ExtractedMemories.empty();
        }
        if (turn.userMessage().isBlank() && turn.assistantMessage().isBlank()) {
            return ExtractedMemories.empty();
        }
        ExtractionHistory safeHistory = history == null ? ExtractionHistory.empty() : history;
        Instant now = clock.instant();
        String conversationId = Memory.newId(MemoryKind.CONVERSATION);
        String summary = summarize(turn.userMessage(), turn.assistantMessage());

        if (turn.userMessage().isBlank()) {
            Memory conversation = conversation(turn, conversationId, summary, DetectedEmotion.neutral(), List.of(),
                new SentimentReading(Sentiment.NEUTRAL, 0.0), now);
            return new ExtractedMemories(conversation, null, null, null, List.of());
        }

        DetectedEmotion emotion = emotionClassifier.classify(turn.userMessage(), turn.assistantMessage());
        List<Topic> topics = topicDetector.detect(turn.combinedText());
        SentimentReading sentiment = sentimentAnalyzer.analyze(turn.combinedText());
        Memory conversation = conversation(turn, conversationId, summary, emotion, topics, sentiment, now);

        Memory emotionalState = new Memory(
            Memory.newId(MemoryKind.EMOTIONAL_STATE),
            turn.ownerId(),
            MemoryKind.EMOTIONAL_STATE,
            List.of(),
            now,
            now,
            0,
            defaultSalience,
            emotion.score(),
            new EmotionalStatePayload(emotion.primary(), emotion.secondary(), emotion.intensity(), summary, conversationId)
        );

        Memory lifeEvent = lifeEventClassifier.classify(turn.userMessage())
            .filter(candidate -> !isRecentDuplicate(candidate, safeHistory, now))
            .map(candidate -> new Memory(
                Memory.newId(MemoryKind.LIFE_EVENT),
                turn.ownerId(),
                MemoryKind.LIFE_EVENT,
                List.of(),
                now,
                now,
                0,
                candidate.importance().salience(),
                emotion.primary().valence(),
                new LifeEventPayload(candidate.category(), candidate.description(), candidate.importance(),
                    emotion.primary(), conversationId)
            ))
            .orElse(null);

        Memory topicPattern = topics.isEmpty() ? null : new Memory(
            Memory.newId(MemoryKind.TOPIC_PATTERN),
            turn.ownerId(),
            MemoryKind.TOPIC_PATTERN,
            List.of(),
            now,
            now,
            0,
            defaultSalience,
            emotion.primary().valence(),
            new TopicPatternPayload(topics, emotion.primary(), 1, List.of(conversationId), now)
        );

        LOG.debug(
            "Extracted from turn of {}: emotion={}, lifeEvent={}, topics={}",
            turn.ownerId(),
            emotion.primary(),
            lifeEvent != null,
            topics
        );
        return new ExtractedMemories(conversation, emotionalState, lifeEvent, topicPattern, topics);
    }

    static String summarize(String userMessage, String assistantMessage) {
        return "User: \"" + truncate(userMessage) + "\" | Assistant: \"" + truncate(assistantMessage) + "\"";
    }

    private Memory conversation(
        ConversationTurn turn,
        String id,
        String summary,
        DetectedEmotion emotion,
        List<Topic> topics,
        SentimentReading sentiment,
        Instant now
    ) {
        return new Memory(
            id,
            turn.ownerId(),
            MemoryKind.CONVERSATION,
            List.of(),
            now,
            now,
            0,
            defaultSalience,
            sentiment.score(),
            new ConversationPayload(turn.userMessage(), turn.assistantMessage(), summary, emotion.primary(), topics,
                sentiment.sentiment())
        );
    }

    private boolean isRecentDuplicate(LifeEventCandidate candidate, ExtractionHistory history, Instant now) {
        for (Memory existing : history.lifeEvents()) {
            if (!(existing.payload() instanceof LifeEventPayload payload) || payload.category() != candidate.category()) {
                continue;
            }
            if (Duration.between(existing.createdAt(), now).abs().compareTo(lifeEventWindow) < 0) {
                LOG.debug("Dropping {} life event: one was recorded at {}", candidate.category(), existing.createdAt());
                return true;
            }
        }
        return false;
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= SUMMARY_CHARS ? text : text.substring(0, SUMMARY_CHARS) + "...";
    }
}
