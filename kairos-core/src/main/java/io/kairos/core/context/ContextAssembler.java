package io.kairos.core.context;

import io.kairos.core.embedding.TextTokens;
import io.kairos.core.memory.ConversationPayload;
import io.kairos.core.memory.Emotion;
import io.kairos.core.memory.EmotionalStatePayload;
import io.kairos.core.memory.LifeEventPayload;
import io.kairos.core.memory.Memory;
import io.kairos.core.memory.MemoryKind;
import io.kairos.core.profile.Goal;
import io.kairos.core.profile.Interest;
import io.kairos.core.profile.OwnerProfile;
import io.kairos.core.profile.Relationship;
import io.kairos.core.scoring.ScoredMemory;
import io.kairos.core.scoring.ScoringEngine;
import io.kairos.core.scoring.ScoringWeights;
import io.kairos.core.store.OwnerStore;
import io.kairos.core.vector.SearchFilter;
import io.kairos.core.vector.SearchHit;
import io.kairos.core.vector.SearchResult;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the ordered context for one query: relevant conversations, the recent emotional
 * trend, matching life events, then the category sections.
 *
 * <p>The sections are read and the surfaced conversations get their access metadata bumped under
 * a single hold of the owner's write lock, so no mutation lands between the two.
 */
public final class ContextAssembler {
    private static final Logger LOG = LoggerFactory.getLogger(ContextAssembler.class);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final String SEPARATOR = "; ";

    private final ScoringEngine scoringEngine;
    private final ContextSettings settings;
    private final Clock clock;

    public ContextAssembler(ScoringEngine scoringEngine, ContextSettings settings, Clock clock) {
        this.scoringEngine = Objects.requireNonNull(scoringEngine, "scoringEngine must not be null");
        this.settings = settings == null ? ContextSettings.defaults() : settings;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ContextResult assemble(
        OwnerStore store,
        String queryText,
        List<Double> queryEmbedding,
        int maxItems,
        ScoringWeights weights
    ) {
        String query = queryText == null ? "" : queryText;
        List<Double> embedding = queryEmbedding == null ? List.of() : queryEmbedding;
        ContextResult result = store.write(() -> {
            ContextResult collected = collect(store, query, embedding, maxItems, weights);
            if (!collected.usedConversationIds().isEmpty()) {
                store.markAccessed(collected.usedConversationIds(), clock.instant());
            }
            return collected;
        });
        LOG.debug(
            "Built context for {}: {} entries, {} conversations from {} candidates",
            store.ownerId(),
            result.entries().size(),
            result.usedConversationIds().size(),
            result.candidateCount()
        );
        return result;
    }

    private ContextResult collect(
        OwnerStore store,
        String query,
        List<Double> embedding,
        int maxItems,
        ScoringWeights weights
    ) {
        List<ContextEntry> entries = new ArrayList<>();
        Set<String> emitted = new HashSet<>();

        SearchResult search = store.index().search(
            embedding,
            settings.candidatePoolSize(),
            SearchFilter.owner(store.ownerId(), MemoryKind.CONVERSATION)
        );
        List<Memory> candidates = candidatePool(store, search);
        List<String> usedConversations = new ArrayList<>();
        for (ScoredMemory scored : scoringEngine.topK(embedding, candidates, weights, maxItems)) {
            Memory memory = scored.memory();
            if (emitted.add(memory.id())) {
                entries.add(new ContextEntry(ContextSource.CONVERSATION, conversationText(memory), List.of(memory.id())));
                usedConversations.add(memory.id());
            }
        }

        emotionalTrend(store.byKind(MemoryKind.EMOTIONAL_STATE), emitted).ifPresent(entries::add);
        entries.addAll(lifeEvents(store.byKind(MemoryKind.LIFE_EVENT), query, emitted));

        joined(ContextSource.FACTS, "Known facts: ", store.byKind(MemoryKind.FACT), Memory::id, Memory::describe, emitted)
            .ifPresent(entries::add);
        joined(ContextSource.PREFERENCES, "Preferences: ", store.byKind(MemoryKind.PREFERENCE), Memory::id,
            Memory::describe, emitted).ifPresent(entries::add);

        OwnerProfile profile = store.profile();
        joined(ContextSource.RELATIONSHIPS, "Relationships: ", profile.relationships(), Relationship::id,
            Relationship::describe, emitted).ifPresent(entries::add);
        joined(ContextSource.GOALS, "Current goals: ", profile.activeGoals(), Goal::id, Goal::text, emitted)
            .ifPresent(entries::add);
        joined(ContextSource.INTERESTS, "Interests: ", profile.interests(), Interest::id, Interest::interest, emitted)
            .ifPresent(entries::add);

        return new ContextResult(entries, usedConversations, candidates.size(), search.dimensionMismatches());
    }

    /**
     * Vector hits first, then conversations stored without an embedding (newest first), up to
     * the pool size.
     */
    private List<Memory> candidatePool(OwnerStore store, SearchResult search) {
        int limit = settings.candidatePoolSize();
        LinkedHashSet<String> seen = new LinkedHashSet<>();
        List<Memory> pool = new ArrayList<>();
        for (SearchHit hit : search.hits()) {
            if (pool.size() >= limit) {
                break;
            }
            store.get(hit.id())
                .filter(memory -> memory.kind() == MemoryKind.CONVERSATION)
                .filter(memory -> seen.add(memory.id()))
                .ifPresent(pool::add);
        }
        List<Memory> unembedded = new ArrayList<>(store.byKind(MemoryKind.CONVERSATION).stream()
            .filter(memory -> !memory.hasEmbedding())
            .toList());
        for (int i = unembedded.size() - 1; i >= 0 && pool.size() < limit; i--) {
            Memory memory = unembedded.get(i);
            if (seen.add(memory.id())) {
                pool.add(memory);
            }
        }
        return pool;
    }

    private Optional<ContextEntry> emotionalTrend(List<Memory> states, Set<String> emitted) {
        if (states.size() < settings.trendMinimumStates()) {
            return Optional.empty();
        }
        List<Memory> window = states.subList(Math.max(0, states.size() - settings.trendWindow()), states.size());
        Map<Emotion, Integer> counts = new EnumMap<>(Emotion.class);
        Map<Emotion, Integer> firstSeen = new EnumMap<>(Emotion.class);
        for (int i = 0; i < window.size(); i++) {
            Emotion emotion = primary(window.get(i));
            counts.merge(emotion, 1, Integer::sum);
            firstSeen.putIfAbsent(emotion, i);
        }
        // ties go to the emotion that first showed up latest in the window
        Emotion dominant = counts.keySet().stream()
            .max(Comparator.comparing((Emotion e) -> counts.get(e)).thenComparing(firstSeen::get))
            .orElse(Emotion.NEUTRAL);
        List<String> ids = window.stream().map(Memory::id).filter(emitted::add).toList();
        String text = "Recent emotional trend: mostly " + dominant.label()
            + " (" + counts.get(dominant) + " of last " + window.size() + " turns)";
        return Optional.of(new ContextEntry(ContextSource.EMOTIONAL_TREND, text, ids));
    }

    private List<ContextEntry> lifeEvents(List<Memory> events, String query, Set<String> emitted) {
        if (settings.maxLifeEventEntries() == 0 || query.isBlank()) {
            return List.of();
        }
        List<Memory> matching = events.stream()
            .filter(memory -> memory.payload() instanceof LifeEventPayload)
            .filter(memory -> TextTokens.overlaps(query, memory.describe()))
            .filter(memory -> !emitted.contains(memory.id()))
            .toList();
        List<Memory> recent = matching.subList(Math.max(0, matching.size() - settings.maxLifeEventEntries()), matching.size());
        List<ContextEntry> out = new ArrayList<>(recent.size());
        for (Memory memory : recent) {
            LifeEventPayload payload = (LifeEventPayload) memory.payload();
            emitted.add(memory.id());
            out.add(new ContextEntry(
                ContextSource.LIFE_EVENT,
                "Life event (" + payload.category().label() + ", " + payload.importance().label() + "): "
                    + payload.description(),
                List.of(memory.id())
            ));
        }
        return out;
    }

    private <T> Optional<ContextEntry> joined(
        ContextSource source,
        String prefix,
        List<T> items,
        Function<T, String> id,
        Function<T, String> text,
        Set<String> emitted
    ) {
        List<String> ids = new ArrayList<>();
        List<String> parts = new ArrayList<>();
        for (T item : items) {
            String itemId = id.apply(item);
            String itemText = text.apply(item);
            if (itemText == null || itemText.isBlank()) {
                continue;
            }
            if (!itemId.isBlank() && !emitted.add(itemId)) {
                continue;
            }
            ids.add(itemId);
            parts.add(itemText);
        }
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ContextEntry(source, prefix + String.join(SEPARATOR, parts), ids));
    }

    private static String conversationText(Memory memory) {
        String feeling = memory.payload() instanceof ConversationPayload payload
            ? payload.primaryEmotion().label()
            : Emotion.NEUTRAL.label();
        return "Previous conversation (" + DAY.format(memory.createdAt()) + ", feeling " + feeling + "): "
            + memory.describe();
    }

    private static Emotion primary(Memory state) {
        return state.payload() instanceof EmotionalStatePayload payload ? payload.primary() : Emotion.NEUTRAL;
    }
}
