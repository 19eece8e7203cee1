package io.kairos.core;

import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.context.ContextAssembler;
import io.kairos.core.context.ContextResult;
import io.kairos.core.context.ContextSettings;
import io.kairos.core.embedding.Embedder;
import io.kairos.core.embedding.EmbeddingUnavailableException;
import io.kairos.core.extract.ConversationTurn;
import io.kairos.core.extract.ExtractedMemories;
import io.kairos.core.extract.ExtractionHistory;
import io.kairos.core.extract.HeuristicMemoryExtractor;
import io.kairos.core.extract.KeywordEmotionClassifier;
import io.kairos.core.extract.KeywordLifeEventClassifier;
import io.kairos.core.extract.MemoryExtractor;
import io.kairos.core.memory.Emotion;
import io.kairos.core.memory.EmotionalStatePayload;
import io.kairos.core.memory.FactPayload;
import io.kairos.core.memory.Intensity;
import io.kairos.core.memory.LongTermPayload;
import io.kairos.core.memory.Memory;
import io.kairos.core.memory.MemoryKind;
import io.kairos.core.memory.PreferencePayload;
import io.kairos.core.memory.TopicPatternPayload;
import io.kairos.core.observability.ObservabilityService;
import io.kairos.core.profile.Goal;
import io.kairos.core.profile.GoalStatus;
import io.kairos.core.profile.Interest;
import io.kairos.core.profile.OwnerProfile;
import io.kairos.core.profile.Relationship;
import io.kairos.core.scoring.ScoringEngine;
import io.kairos.core.scoring.ScoringStats;
import io.kairos.core.scoring.ScoringWeights;
import io.kairos.core.store.MemoryPersistence;
import io.kairos.core.store.OwnerRegistry;
import io.kairos.core.store.OwnerStore;
import io.kairos.core.store.WriteOutcome;
import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the memory core. Every call is scoped to one owner; writes run under that
 * owner's write lock and save the owner's snapshot before the lock is released.
 */
public final class MemoryEngine {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryEngine.class);
    private static final int RECENT_EMOTIONAL_STATES = 10;

    private final OwnerRegistry registry;
    private final MemoryExtractor extractor;
    private final Embedder embedder;
    private final ScoringEngine scoringEngine;
    private final ContextAssembler assembler;
    private final ScoringWeights weights;
    private final ObservabilityService observability;
    private final Clock clock;

    public MemoryEngine(
        OwnerRegistry registry,
        MemoryExtractor extractor,
        Embedder embedder,
        ScoringEngine scoringEngine,
        ContextAssembler assembler,
        ScoringWeights weights,
        ObservabilityService observability,
        Clock clock
    ) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.embedder = Objects.requireNonNull(embedder, "embedder must not be null");
        this.scoringEngine = Objects.requireNonNull(scoringEngine, "scoringEngine must not be null");
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        this.weights = weights == null ? ScoringWeights.defaults() : weights.sanitized();
        this.observability = observability;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Wires an engine from configuration. {@code observability} may be null.
     */
    public static MemoryEngine create(
        KairosConfig config,
        MemoryPersistence persistence,
        Embedder embedder,
        ObservabilityService observability,
        Clock clock
    ) {
        ScoringEngine scoring = new ScoringEngine(clock, config.scoring().decayLambdaPerDay());
        OwnerRegistry registry = new OwnerRegistry(
            persistence,
            config.memory().toLimits(),
            clock,
            config.memory().idleTimeout()
        );
        MemoryExtractor extractor = new HeuristicMemoryExtractor(
            clock,
            new KeywordEmotionClassifier(),
            new KeywordLifeEventClassifier(),
            config.memory().lifeEventWindow(),
            config.memory().defaultSalience()
        );
        ContextAssembler assembler = new ContextAssembler(scoring, ContextSettings.from(config.memory()), clock);
        return new MemoryEngine(
            registry,
            extractor,
            embedder,
            scoring,
            assembler,
            config.scoring().toWeights(),
            observability,
            clock
        );
    }

    public Memory insertMemory(String ownerId, Memory memory) {
        Objects.requireNonNull(memory, "memory must not be null");
        if (!memory.ownerId().equals(ownerId)) {
            throw new IllegalArgumentException("memory " + memory.id() + " does not belong to " + ownerId);
        }
        WriteOutcome outcome = mutate(ownerId, store -> store.put(memory));
        recordEvictions(ownerId, outcome);
        return outcome.stored();
    }

    public boolean deleteMemory(String ownerId, String memoryId) {
        return mutate(ownerId, store -> store.remove(memoryId));
    }

    public List<Memory> getMemoriesByKind(String ownerId, MemoryKind kind) {
        return registry.acquire(ownerId).byKind(kind);
    }

    public Optional<Memory> getMemory(String ownerId, String memoryId) {
        return registry.acquire(ownerId).get(memoryId);
    }

    /**
     * Stores the turn as a conversation and inserts every record derived from it. Extraction
     * and storage happen under one write lock so life-event dedup sees every earlier turn.
     */
    public ExtractedMemories recordTurn(String ownerId, String userMessage, String assistantMessage) {
        ConversationTurn turn = new ConversationTurn(ownerId, userMessage, assistantMessage);
        List<Double> embedding = turn.combinedText().isBlank() ? List.of() : embedOrEmpty(turn.combinedText());
        List<WriteOutcome> outcomes = new ArrayList<>();
        ExtractedMemories stored = mutate(ownerId, store -> {
            ExtractionHistory history = new ExtractionHistory(store.byKind(MemoryKind.LIFE_EVENT));
            ExtractedMemories extracted = extractor.extract(turn, history);
            Memory conversation = extracted.findConversation()
                .map(memory -> store.put(memory.withEmbedding(embedding)))
                .map(outcome -> {
                    outcomes.add(outcome);
                    return outcome.stored();
                })
                .orElse(null);
            Memory emotionalState = storeDerived(store, extracted.emotionalState(), outcomes);
            Memory lifeEvent = storeDerived(store, extracted.lifeEvent(), outcomes);
            Memory topicPattern = storeDerived(store, extracted.topicPattern(), outcomes);
            return new ExtractedMemories(conversation, emotionalState, lifeEvent, topicPattern, extracted.topics());
        });
        for (WriteOutcome outcome : outcomes) {
            recordEvictions(ownerId, outcome);
        }
        if (stored.conversation() != null) {
            Map<String, Object> attrs = new LinkedHashMap<>();
            attrs.put("owner_id", ownerId);
            attrs.put("conversation_id", stored.conversation().id());
            attrs.put("derived", stored.derived().size());
            audit(ObservabilityService.TURN_RECORDED, attrs);
        }
        return stored;
    }

    /**
     * Assembles the context for a query. When {@code queryEmbedding} is absent the configured
     * embedder is asked for one; if that fails the semantic signal is simply 0.
     */
    public ContextResult buildContext(String ownerId, String queryText, List<Double> queryEmbedding, int maxItems) {
        long startedAt = System.currentTimeMillis();
        OwnerStore store = registry.acquire(ownerId);
        List<Double> embedding = queryEmbedding;
        if ((embedding == null || embedding.isEmpty()) && queryText != null && !queryText.isBlank()) {
            embedding = embedOrEmpty(queryText);
        }
        ContextResult result;
        try {
            result = assembler.assemble(store, queryText, embedding, maxItems, weights);
        } catch (RuntimeException e) {
            Map<String, Object> attrs = new LinkedHashMap<>();
            attrs.put("owner_id", ownerId);
            attrs.put("duration_ms", Math.max(0, System.currentTimeMillis() - startedAt));
            attrs.put("error", String.valueOf(e.getMessage()));
            audit(ObservabilityService.CONTEXT_FAILED, attrs);
            throw e;
        }
        if (!result.usedConversationIds().isEmpty()) {
            store.write(() -> registry.persist(store));
        }

        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("owner_id", ownerId);
        attrs.put("duration_ms", Math.max(0, System.currentTimeMillis() - startedAt));
        attrs.put("entries", result.entries().size());
        attrs.put("conversations", result.usedConversationIds().size());
        attrs.put("candidates", result.candidateCount());
        audit(ObservabilityService.CONTEXT_BUILT, attrs);
        if (result.dimensionMismatches() > 0) {
            LOG.warn("{} memories of {} skipped for dimension mismatch", result.dimensionMismatches(), ownerId);
            audit(ObservabilityService.DIMENSION_MISMATCH, Map.of("owner_id", ownerId, "count", result.dimensionMismatches()));
        }
        return result;
    }

    /**
     * Scores every embedded memory of the owner against the query; when none carries an
     * embedding, every memory is scored on its other signals.
     */
    public ScoringStats getScoringStats(String ownerId, List<Double> queryEmbedding) {
        List<Memory> all = registry.acquire(ownerId).all();
        List<Memory> embedded = all.stream().filter(Memory::hasEmbedding).toList();
        return scoringEngine.stats(queryEmbedding, embedded.isEmpty() ? all : embedded, weights);
    }

    public Memory addFact(String ownerId, String text, String category) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("fact text must not be blank");
        }
        Memory fact = Memory.create(
            ownerId,
            MemoryKind.FACT,
            new FactPayload(text, category),
            embedOrEmpty(text),
            Memory.DEFAULT_SALIENCE,
            0.0,
            clock.instant()
        );
        return insertMemory(ownerId, fact);
    }

    /**
     * Stores a preference. A preference with the same key (ignoring case) is replaced in place.
     */
    public Memory addPreference(String ownerId, String key, String value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("preference key must not be blank");
        }
        PreferencePayload payload = new PreferencePayload(key, value);
        List<Double> embedding = embedOrEmpty(payload.describe());
        return mutate(ownerId, store -> {
            Optional<Memory> existing = store.byKind(MemoryKind.PREFERENCE).stream()
                .filter(memory -> memory.payload() instanceof PreferencePayload p && p.key().equalsIgnoreCase(payload.key()))
                .findFirst();
            Memory memory = existing
                .map(current -> current.withPayload(payload).withEmbedding(embedding))
                .orElseGet(() -> Memory.create(ownerId, MemoryKind.PREFERENCE, payload, embedding,
                    Memory.DEFAULT_SALIENCE, 0.0, clock.instant()));
            return store.put(memory).stored();
        });
    }

    public Relationship addRelationship(String ownerId, String person, String relation, String notes) {
        if (person == null || person.isBlank()) {
            throw new IllegalArgumentException("person must not be blank");
        }
        Relationship relationship = new Relationship(newId("rel"), person, relation, notes, clock.instant());
        return mutate(ownerId, store -> store.addRelationship(relationship));
    }

    public Goal addGoal(String ownerId, String text, String category, LocalDate deadline) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("goal text must not be blank");
        }
        Goal goal = new Goal(newId("goal"), text, category, deadline, GoalStatus.ACTIVE, 0, clock.instant());
        return mutate(ownerId, store -> store.addGoal(goal));
    }

    public Optional<Goal> updateGoalStatus(String ownerId, String goalId, GoalStatus status, int progress) {
        Objects.requireNonNull(status, "status must not be null");
        return mutate(ownerId, store -> store.updateGoal(goalId, status, progress));
    }

    public Interest addInterest(String ownerId, String interest, String category) {
        if (interest == null || interest.isBlank()) {
            throw new IllegalArgumentException("interest must not be blank");
        }
        Interest created = new Interest(newId("interest"), interest, category, clock.instant());
        return mutate(ownerId, store -> store.addInterest(created));
    }

    /**
     * Stores a long-term memory. Salience follows {@code importance}; without an embedding the
     * text is embedded with the configured embedder.
     */
    public Memory addLongTermMemory(
        String ownerId,
        String text,
        String category,
        Intensity importance,
        List<Double> embedding
    ) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("memory text must not be blank");
        }
        LongTermPayload payload = new LongTermPayload(text, category, importance);
        List<Double> vector = embedding == null || embedding.isEmpty() ? embedOrEmpty(text) : embedding;
        Memory memory = Memory.create(
            ownerId,
            MemoryKind.LONG_TERM,
            payload,
            vector,
            payload.importance().salience(),
            0.0,
            clock.instant()
        );
        return insertMemory(ownerId, memory);
    }

    public EmotionalStats getEmotionalStats(String ownerId) {
        List<Memory> states = getMemoriesByKind(ownerId, MemoryKind.EMOTIONAL_STATE);
        Map<Emotion, Integer> counts = new EnumMap<>(Emotion.class);
        for (Memory state : states) {
            Emotion primary = state.payload() instanceof EmotionalStatePayload payload ? payload.primary() : Emotion.NEUTRAL;
            counts.merge(primary, 1, Integer::sum);
        }
        Emotion dominant = counts.entrySet().stream()
            .max(Map.Entry.comparingByValue())
            .map(Map.Entry::getKey)
            .orElse(Emotion.NEUTRAL);
        List<Memory> recent = states.subList(Math.max(0, states.size() - RECENT_EMOTIONAL_STATES), states.size());
        return new EmotionalStats(states.size(), counts, recent, dominant);
    }

    /**
     * Life events, oldest first.
     */
    public List<Memory> getLifeEventTimeline(String ownerId) {
        return getMemoriesByKind(ownerId, MemoryKind.LIFE_EVENT);
    }

    /**
     * Topic patterns, most frequent first.
     */
    public List<Memory> getTopicPatterns(String ownerId) {
        return getMemoriesByKind(ownerId, MemoryKind.TOPIC_PATTERN).stream()
            .sorted(Comparator.comparingInt(MemoryEngine::frequency).reversed())
            .toList();
    }

    public MemoryStats getMemoryStats(String ownerId) {
        OwnerStore store = registry.acquire(ownerId);
        return store.read(() -> {
            Map<MemoryKind, Integer> byKind = new EnumMap<>(MemoryKind.class);
            List<Memory> all = store.all();
            for (Memory memory : all) {
                byKind.merge(memory.kind(), 1, Integer::sum);
            }
            OwnerProfile profile = store.profile();
            return new MemoryStats(
                ownerId,
                all.size(),
                byKind,
                profile.relationships().size(),
                profile.goals().size(),
                profile.activeGoals().size(),
                profile.interests().size()
            );
        });
    }

    public OwnerProfile getProfile(String ownerId) {
        return registry.acquire(ownerId).profile();
    }

    /**
     * Embeds text with the configured embedder; empty when the embedder is unavailable.
     */
    public List<Double> embed(String text) {
        return text == null || text.isBlank() ? List.of() : embedOrEmpty(text);
    }

    public List<String> owners() {
        return registry.owners();
    }

    public boolean deleteOwner(String ownerId) {
        return registry.remove(ownerId);
    }

    public List<String> evictIdle() {
        return registry.evictIdle(clock.instant());
    }

    private <T> T mutate(String ownerId, Function<OwnerStore, T> action) {
        OwnerStore store = registry.acquire(ownerId);
        return store.write(() -> {
            T result = action.apply(store);
            registry.persist(store);
            return result;
        });
    }

    private static Memory storeDerived(OwnerStore store, Memory derived, List<WriteOutcome> outcomes) {
        if (derived == null) {
            return null;
        }
        WriteOutcome outcome = store.put(derived);
        outcomes.add(outcome);
        return outcome.stored();
    }

    /**
     * Any embedder failure, including a vector with null or non-finite elements, leaves the
     * caller without an embedding instead of failing the write or the context build.
     */
    private List<Double> embedOrEmpty(String text) {
        List<Double> embedding;
        try {
            embedding = embedder.embed(text);
        } catch (EmbeddingUnavailableException e) {
            LOG.warn("Embedding unavailable, continuing without semantic signal: {}", e.getMessage());
            return List.of();
        } catch (RuntimeException e) {
            LOG.warn("Embedder failed, continuing without semantic signal", e);
            return List.of();
        }
        if (embedding == null) {
            return List.of();
        }
        for (Double value : embedding) {
            if (value == null || !Double.isFinite(value)) {
                LOG.warn("Embedder returned a vector with element {}; continuing without semantic signal", value);
                return List.of();
            }
        }
        return embedding;
    }

    private void recordEvictions(String ownerId, WriteOutcome outcome) {
        if (outcome.evicted().isEmpty()) {
            return;
        }
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("owner_id", ownerId);
        attrs.put("kind", outcome.evicted().get(0).kind().name());
        attrs.put("count", outcome.evicted().size());
        audit(ObservabilityService.MEMORY_EVICTED, attrs);
    }

    private void audit(String type, Map<String, Object> attributes) {
        if (observability == null) {
            return;
        }
        try {
            observability.record(type, attributes);
        } catch (IOException e) {
            LOG.debug("Failed to record {} audit event: {}", type, e.getMessage());
        }
    }

    private static int frequency(Memory memory) {
        return memory.payload() instanceof TopicPatternPayload payload ? payload.frequency() : 0;
    }

    private static String newId(String prefix) {
        return prefix + "_" + UUID.randomUUID();
    }
}
