package io.kairos.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.config.model.MemoryConfig;
import io.kairos.core.context.ContextResult;
import io.kairos.core.context.ContextSource;
import io.kairos.core.embedding.Embedder;
import io.kairos.core.embedding.EmbeddingUnavailableException;
import io.kairos.core.extract.ExtractedMemories;
import io.kairos.core.memory.ConversationPayload;
import io.kairos.core.memory.Emotion;
import io.kairos.core.memory.Intensity;
import io.kairos.core.memory.LifeEventCategory;
import io.kairos.core.memory.LifeEventPayload;
import io.kairos.core.memory.Memory;
import io.kairos.core.memory.MemoryKind;
import io.kairos.core.memory.TopicPatternPayload;
import io.kairos.core.observability.AuditEvent;
import io.kairos.core.observability.EngineDashboard;
import io.kairos.core.observability.InMemoryAuditStore;
import io.kairos.core.observability.ObservabilityService;
import io.kairos.core.profile.Goal;
import io.kairos.core.profile.GoalStatus;
import io.kairos.core.scoring.ScoringStats;
import io.kairos.core.store.InMemoryPersistence;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MemoryEngineTest {
    private static final Instant NOW = Instant.parse("2026-08-03T15:00:00Z");
    private static final List<Double> WORK = List.of(1.0, 0.0, 0.0);
    private static final List<Double> TRIP = List.of(0.0, 1.0, 0.0);
    private static final List<Double> OTHER = List.of(0.0, 0.0, 1.0);

    private TestClock clock;
    private InMemoryPersistence persistence;
    private ObservabilityService observability;
    private TopicEmbedder embedder;
    private MemoryEngine engine;

    @BeforeEach
    void setUp() {
        clock = new TestClock(NOW);
        persistence = new InMemoryPersistence();
        observability = new ObservabilityService(new InMemoryAuditStore(), clock);
        embedder = new TopicEmbedder();
        engine = MemoryEngine.create(KairosConfig.defaults(), persistence, embedder, observability, clock);
    }

    @Test
    void shouldRankOlderWorkConversationAboveRecentTripForWorkQuery() {
        engine.insertMemory("u1", conversation("conv_work", "work stress", NOW.minus(Duration.ofDays(3)), WORK));
        engine.insertMemory("u1", conversation("conv_trip", "weekend trip", NOW.minus(Duration.ofHours(1)), TRIP));
        engine.addFact("u1", "likes tea", null);
        engine.addPreference("u1", "music", "jazz");

        ContextResult result = engine.buildContext("u1", "work", WORK, 5);

        assertThat(result.usedConversationIds()).containsExactly("conv_work", "conv_trip");
        assertThat(result.texts()).containsExactly(
            "Previous conversation (2026-07-31, feeling neutral): work stress",
            "Previous conversation (2026-08-03, feeling neutral): weekend trip",
            "Known facts: likes tea",
            "Preferences: music: jazz"
        );
        assertThat(engine.getMemory("u1", "conv_work").orElseThrow().accessCount()).isEqualTo(1);
        assertThat(persistence.load("u1").orElseThrow().memories())
            .filteredOn(memory -> memory.id().equals("conv_work"))
            .singleElement()
            .extracting(Memory::accessCount)
            .isEqualTo(1L);
    }

    @Test
    void shouldEmbedQueryTextWhenNoEmbeddingIsGiven() {
        engine.insertMemory("u1", conversation("conv_work", "work stress", NOW.minus(Duration.ofDays(3)), WORK));
        engine.insertMemory("u1", conversation("conv_trip", "weekend trip", NOW.minus(Duration.ofHours(1)), TRIP));

        ContextResult result = engine.buildContext("u1", "how is work going", null, 1);

        assertThat(result.usedConversationIds()).containsExactly("conv_work");
    }

    @Test
    void shouldFallBackToOtherSignalsWhenEmbedderFails() {
        engine.insertMemory("u1", conversation("conv_work", "work stress", NOW.minus(Duration.ofDays(3)), WORK));
        engine.insertMemory("u1", conversation("conv_trip", "weekend trip", NOW.minus(Duration.ofHours(1)), TRIP));
        embedder.available = false;

        ContextResult result = engine.buildContext("u1", "work", null, 5);

        assertThat(result.usedConversationIds()).containsExactly("conv_trip", "conv_work");
    }

    @Test
    void shouldRecordCareerLifeEventOncePerDay() {
        ExtractedMemories first = engine.recordTurn("u1", "I just got a new job", "Congratulations!");
        clock.advance(Duration.ofHours(3));
        ExtractedMemories second = engine.recordTurn("u1", "I got a new job", "You mentioned that, well done");

        assertThat(first.findLifeEvent()).isPresent();
        assertThat(second.findLifeEvent()).isEmpty();
        List<Memory> events = engine.getLifeEventTimeline("u1");
        assertThat(events).hasSize(1);
        assertThat(((LifeEventPayload) events.get(0).payload()).category()).isEqualTo(LifeEventCategory.CAREER);
        assertThat(engine.getMemoriesByKind("u1", MemoryKind.CONVERSATION)).hasSize(2);
        assertThat(first.conversation().embedding()).isEqualTo(WORK);
    }

    @Test
    void shouldMergeTopicPatternsAcrossTurns() {
        engine.recordTurn("u1", "My project at work is going well, I am happy", "Great!");
        engine.recordTurn("u1", "Happy with how the work meeting went", "Nice");

        List<Memory> patterns = engine.getTopicPatterns("u1");

        assertThat(patterns).hasSize(1);
        TopicPatternPayload payload = (TopicPatternPayload) patterns.get(0).payload();
        assertThat(payload.frequency()).isEqualTo(2);
        assertThat(payload.emotionalState()).isEqualTo(Emotion.HAPPY);
        assertThat(payload.relatedConversations()).hasSize(2);
    }

    @Test
    void shouldStoreTurnWithoutEmbeddingWhenEmbedderFails() {
        embedder.available = false;

        ExtractedMemories stored = engine.recordTurn("u1", "Work was fine", "Good to hear");

        assertThat(stored.conversation().hasEmbedding()).isFalse();
        assertThat(engine.buildContext("u1", "work", null, 5).usedConversationIds())
            .containsExactly(stored.conversation().id());
    }

    @Test
    void shouldStoreTurnWithoutEmbeddingWhenVectorHasNullElement() {
        MemoryEngine broken = MemoryEngine.create(KairosConfig.defaults(), persistence,
            new FixedEmbedder(text -> Arrays.asList(1.0, null, 0.0)), observability, clock);

        ExtractedMemories stored = broken.recordTurn("u1", "Work was fine", "Good to hear");

        assertThat(stored.conversation().hasEmbedding()).isFalse();
        assertThat(broken.buildContext("u1", "work", null, 5).usedConversationIds())
            .containsExactly(stored.conversation().id());
    }

    @Test
    void shouldStoreTurnWithoutEmbeddingWhenVectorIsNotFinite() {
        MemoryEngine broken = MemoryEngine.create(KairosConfig.defaults(), persistence,
            new FixedEmbedder(text -> List.of(1.0, Double.NaN, 0.0)), observability, clock);

        ExtractedMemories stored = broken.recordTurn("u1", "Work was fine", "Good to hear");

        assertThat(stored.conversation().hasEmbedding()).isFalse();
    }

    @Test
    void shouldStoreTurnWithoutEmbeddingWhenEmbedderThrowsUnexpectedly() {
        MemoryEngine broken = MemoryEngine.create(KairosConfig.defaults(), persistence,
            new FixedEmbedder(text -> {
                throw new IllegalStateException("model not loaded");
            }), observability, clock);

        ExtractedMemories stored = broken.recordTurn("u1", "Work was fine", "Good to hear");

        assertThat(stored.conversation().hasEmbedding()).isFalse();
        assertThat(broken.buildContext("u1", "work", null, 5).usedConversationIds())
            .containsExactly(stored.conversation().id());
    }

    @Test
    void shouldEvictOldestConversationsAndAuditIt() throws Exception {
        MemoryConfig memory = new MemoryConfig(2, 50, 50, 24, 3, 3, 5, 0.5, 30);
        KairosConfig config = new KairosConfig(memory, null, null, null);
        MemoryEngine capped = MemoryEngine.create(config, persistence, embedder, observability, clock);

        for (int i = 0; i < 3; i++) {
            capped.insertMemory("u1", conversation("conv_" + i, "chat " + i, NOW.minus(Duration.ofHours(3 - i)), OTHER));
        }

        assertThat(capped.getMemoriesByKind("u1", MemoryKind.CONVERSATION))
            .extracting(Memory::id)
            .containsExactly("conv_1", "conv_2");
        assertThat(observability.recent(10)).extracting(AuditEvent::type).contains(ObservabilityService.MEMORY_EVICTED);
        assertThat(observability.summary().memoriesEvicted()).isEqualTo(1);
    }

    @Test
    void shouldRejectMemoryOfAnotherOwner() {
        Memory foreign = conversation("conv_x", "hello", NOW, WORK);

        assertThatThrownBy(() -> engine.insertMemory("u2", foreign)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.addFact("u1", " ", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReplacePreferenceWithSameKey() {
        Memory first = engine.addPreference("u1", "music", "jazz");
        Memory second = engine.addPreference("u1", "Music", "blues");

        assertThat(second.id()).isEqualTo(first.id());
        assertThat(engine.getMemoriesByKind("u1", MemoryKind.PREFERENCE))
            .extracting(Memory::describe)
            .containsExactly("Music: blues");
    }

    @Test
    void shouldManageProfileRecordsAndReportStats() {
        engine.addRelationship("u1", "Anna", "sister", "");
        Goal goal = engine.addGoal("u1", "run a marathon", "fitness", null);
        engine.addGoal("u1", "learn Spanish", null, null);
        engine.addInterest("u1", "chess", null);
        engine.addLongTermMemory("u1", "allergic to nuts", "health", Intensity.HIGH, null);
        engine.updateGoalStatus("u1", goal.id(), GoalStatus.COMPLETED, 100);

        MemoryStats stats = engine.getMemoryStats("u1");
        ContextResult result = engine.buildContext("u1", "plans", null, 5);

        assertThat(stats.count(MemoryKind.LONG_TERM)).isEqualTo(1);
        assertThat(stats.goals()).isEqualTo(2);
        assertThat(stats.activeGoals()).isEqualTo(1);
        assertThat(stats.relationships()).isEqualTo(1);
        assertThat(stats.interests()).isEqualTo(1);
        assertThat(engine.getMemoriesByKind("u1", MemoryKind.LONG_TERM).get(0).salience())
            .isEqualTo(Intensity.HIGH.salience());
        assertThat(result.bySource(ContextSource.GOALS)).singleElement()
            .satisfies(entry -> assertThat(entry.text()).isEqualTo("Current goals: learn Spanish"));
    }

    @Test
    void shouldReportEmotionalStats() {
        engine.recordTurn("u1", "I feel sad today", "I'm sorry");
        engine.recordTurn("u1", "Still sad", "That sounds hard");
        engine.recordTurn("u1", "Now I'm happy", "Great");

        EmotionalStats stats = engine.getEmotionalStats("u1");

        assertThat(stats.totalStates()).isEqualTo(3);
        assertThat(stats.counts()).containsEntry(Emotion.SAD, 2).containsEntry(Emotion.HAPPY, 1);
        assertThat(stats.dominant()).isEqualTo(Emotion.SAD);
        assertThat(engine.getEmotionalStats("nobody").dominant()).isEqualTo(Emotion.NEUTRAL);
    }

    @Test
    void shouldComputeScoringStatsOverEmbeddedMemories() {
        engine.insertMemory("u1", conversation("conv_work", "work stress", NOW.minus(Duration.ofDays(3)), WORK));
        engine.insertMemory("u1", conversation("conv_trip", "weekend trip", NOW.minus(Duration.ofHours(1)), TRIP));

        ScoringStats stats = engine.getScoringStats("u1", WORK);

        assertThat(stats.totalMemories()).isEqualTo(2);
        assertThat(stats.topMemories()).extracting(ScoringStats.TopScore::id).containsExactly("conv_work", "conv_trip");
        assertThat(stats.max()).isGreaterThan(0.8);
        assertThat(engine.getScoringStats("empty", WORK)).isEqualTo(ScoringStats.empty());
    }

    @Test
    void shouldAuditContextBuildsAndTurns() throws Exception {
        engine.recordTurn("u1", "Work was busy", "Take a break");
        engine.buildContext("u1", "work", null, 3);
        engine.buildContext("u2", "anything", null, 3);

        EngineDashboard dashboard = observability.summary();

        assertThat(dashboard.contextBuilds()).isEqualTo(2);
        assertThat(dashboard.turnsRecorded()).isEqualTo(1);
        assertThat(dashboard.buildSuccessRate()).isEqualTo(100.0);
        assertThat(dashboard.activeOwners7d()).isEqualTo(2);
    }

    @Test
    void shouldDeleteOwnerEverywhere() {
        engine.addFact("u1", "likes tea", null);
        engine.addFact("u2", "likes coffee", null);

        assertThat(engine.owners()).containsExactly("u1", "u2");
        assertThat(engine.deleteOwner("u1")).isTrue();
        assertThat(engine.owners()).containsExactly("u2");
        assertThat(engine.getMemoriesByKind("u1", MemoryKind.FACT)).isEmpty();
    }

    @Test
    void shouldWorkWithoutObservability() {
        MemoryEngine quiet = MemoryEngine.create(KairosConfig.defaults(), persistence, embedder, null, clock);

        quiet.recordTurn("u1", "Work was busy", "Take a break");

        assertThat(quiet.buildContext("u1", "work", null, 3).entries()).isNotEmpty();
    }

    private static Memory conversation(String id, String summary, Instant at, List<Double> embedding) {
        return new Memory(id, "u1", MemoryKind.CONVERSATION, embedding, at, at, 0, 0.5, 0.0,
            new ConversationPayload(summary, "", summary, Emotion.NEUTRAL, List.of(), null));
    }

    /**
     * Maps text onto three axes: work, trips, everything else.
     */
    private static final class TopicEmbedder implements Embedder {
        boolean available = true;

        @Override
        public List<Double> embed(String text) {
            if (!available) {
                throw new EmbeddingUnavailableException("embedder offline");
            }
            String lowered = text.toLowerCase();
            if (lowered.contains("work") || lowered.contains("job")) {
                return WORK;
            }
            if (lowered.contains("trip")) {
                return TRIP;
            }
            return OTHER;
        }

        @Override
        public int dimension() {
            return 3;
        }
    }

    private static final class FixedEmbedder implements Embedder {
        private final Function<String, List<Double>> vectors;

        FixedEmbedder(Function<String, List<Double>> vectors) {
            this.vectors = vectors;
        }

        @Override
        public List<Double> embed(String text) {
            return vectors.apply(text);
        }

        @Override
        public int dimension() {
            return 3;
        }
    }
}
