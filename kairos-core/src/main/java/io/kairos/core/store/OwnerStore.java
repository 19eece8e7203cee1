package io.kairos.core.store;

import io.kairos.core.memory.Memory;
import io.kairos.core.memory.MemoryKind;
import io.kairos.core.memory.TopicPatternPayload;
import io.kairos.core.profile.Goal;
import io.kairos.core.profile.GoalStatus;
import io.kairos.core.profile.Interest;
import io.kairos.core.profile.OwnerProfile;
import io.kairos.core.profile.Relationship;
import io.kairos.core.vector.InMemoryVectorIndex;
import io.kairos.core.vector.IndexMetadata;
import io.kairos.core.vector.VectorIndex;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * All memories, category records and the vector index of a single owner.
 *
 * <p>Every mutation takes the owner's write lock; compound read-modify sequences should run
 * inside {@link #write(Supplier)} so readers never see a half-applied eviction or merge.
 */
public final class OwnerStore {
    private static final Logger LOG = LoggerFactory.getLogger(OwnerStore.class);

    private final String ownerId;
    private final StoreLimits limits;
    private final Instant createdAt;
    private final Map<String, Memory> memories = new LinkedHashMap<>();
    private final VectorIndex index = new InMemoryVectorIndex();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private OwnerProfile profile = OwnerProfile.empty();
    private volatile Instant lastUsed;
    private volatile boolean retired;

    public OwnerStore(String ownerId, StoreLimits limits, Instant createdAt) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId must not be blank");
        }
        this.ownerId = ownerId;
        this.limits = limits == null ? StoreLimits.defaults() : limits;
        this.createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        this.lastUsed = this.createdAt;
    }

    public static OwnerStore fromSnapshot(StoreSnapshot snapshot, StoreLimits limits) {
        OwnerStore store = new OwnerStore(snapshot.ownerId(), limits, snapshot.createdAt());
        for (Memory memory : snapshot.memories()) {
            if (!store.ownerId.equals(memory.ownerId())) {
                LOG.warn("Skipping memory {} of owner {} found in snapshot of {}", memory.id(), memory.ownerId(), store.ownerId);
                continue;
            }
            store.putInternal(memory);
        }
        store.profile = snapshot.profile();
        store.enforceLimit(MemoryKind.CONVERSATION, store.limits.maxConversations());
        store.enforceLimit(MemoryKind.EMOTIONAL_STATE, store.limits.maxEmotionalStates());
        return store;
    }

    public String ownerId() {
        return ownerId;
    }

    public Instant lastUsed() {
        return lastUsed;
    }

    public void touch(Instant at) {
        lastUsed = at;
    }

    /**
     * Marks the store as deleted. A retired store is never saved again.
     */
    public void retire() {
        retired = true;
    }

    public boolean retired() {
        return retired;
    }

    public VectorIndex index() {
        return index;
    }

    public <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stores a memory. Topic patterns merge into an existing pattern sharing a topic and the
     * dominant emotion; conversations and emotional states evict their oldest records beyond
     * the configured caps.
     */
    public WriteOutcome put(Memory memory) {
        if (!ownerId.equals(memory.ownerId())) {
            throw new IllegalArgumentException("memory " + memory.id() + " belongs to " + memory.ownerId() + ", not " + ownerId);
        }
        return write(() -> {
            if (memory.kind() == MemoryKind.TOPIC_PATTERN
                && memory.payload() instanceof TopicPatternPayload
                && !memories.containsKey(memory.id())) {
                return mergeTopicPattern(memory);
            }
            putInternal(memory);
            List<Memory> evicted = switch (memory.kind()) {
                case CONVERSATION -> enforceLimit(MemoryKind.CONVERSATION, limits.maxConversations());
                case EMOTIONAL_STATE -> enforceLimit(MemoryKind.EMOTIONAL_STATE, limits.maxEmotionalStates());
                default -> List.of();
            };
            return new WriteOutcome(memory, false, evicted);
        });
    }

    public boolean remove(String id) {
        return write(() -> {
            Memory removed = memories.remove(id);
            index.delete(id);
            return removed != null;
        });
    }

    public Optional<Memory> get(String id) {
        return read(() -> Optional.ofNullable(memories.get(id)));
    }

    /**
     * Memories of one kind, oldest first.
     */
    public List<Memory> byKind(MemoryKind kind) {
        return read(() -> byKindInternal(kind));
    }

    public List<Memory> all() {
        return read(() -> List.copyOf(memories.values()));
    }

    public int size() {
        return read(memories::size);
    }

    /**
     * Increments the access count of each id once, however often it appears.
     */
    public List<Memory> markAccessed(Collection<String> ids, Instant at) {
        return write(() -> {
            List<Memory> updated = new ArrayList<>();
            for (String id : new HashSet<>(ids)) {
                Memory current = memories.get(id);
                if (current != null) {
                    Memory accessed = current.withAccess(at);
                    memories.put(id, accessed);
                    updated.add(accessed);
                }
            }
            return updated;
        });
    }

    public OwnerProfile profile() {
        return read(() -> profile);
    }

    public Relationship addRelationship(Relationship relationship) {
        return write(() -> {
            List<Relationship> relationships = new ArrayList<>(profile.relationships());
            relationships.removeIf(r -> r.person().equalsIgnoreCase(relationship.person()));
            relationships.add(relationship);
            profile = new OwnerProfile(relationships, profile.goals(), profile.interests());
            return relationship;
        });
    }

    public Goal addGoal(Goal goal) {
        return write(() -> {
            List<Goal> goals = new ArrayList<>(profile.goals());
            goals.add(goal);
            profile = new OwnerProfile(profile.relationships(), goals, profile.interests());
            return goal;
        });
    }

    public Optional<Goal> updateGoal(String goalId, GoalStatus status, int progress) {
        return write(() -> {
            List<Goal> goals = new ArrayList<>(profile.goals());
            for (int i = 0; i < goals.size(); i++) {
                if (goals.get(i).id().equals(goalId)) {
                    Goal updated = goals.get(i).withStatus(status, progress);
                    goals.set(i, updated);
                    profile = new OwnerProfile(profile.relationships(), goals, profile.interests());
                    return Optional.of(updated);
                }
            }
            return Optional.<Goal>empty();
        });
    }

    public Interest addInterest(Interest interest) {
        return write(() -> {
            List<Interest> interests = new ArrayList<>(profile.interests());
            interests.add(interest);
            profile = new OwnerProfile(profile.relationships(), profile.goals(), interests);
            return interest;
        });
    }

    public StoreSnapshot snapshot(Instant now) {
        return read(() -> new StoreSnapshot(ownerId, List.copyOf(memories.values()), profile, createdAt, now));
    }

    private void putInternal(Memory memory) {
        memories.put(memory.id(), memory);
        if (memory.hasEmbedding()) {
            index.insert(memory.id(), memory.embedding(), new IndexMetadata(ownerId, memory.kind(), memory.createdAt()));
        } else {
            index.delete(memory.id());
        }
    }

    private WriteOutcome mergeTopicPattern(Memory incoming) {
        TopicPatternPayload merged = (TopicPatternPayload) incoming.payload();
        Memory target = null;
        Set<String> folded = new HashSet<>();
        boolean grew = true;
        while (grew) {
            grew = false;
            for (Memory existing : byKindInternal(MemoryKind.TOPIC_PATTERN)) {
                if (folded.contains(existing.id()) || !(existing.payload() instanceof TopicPatternPayload payload)) {
                    continue;
                }
                if (!payload.mergeableWith(merged)) {
                    continue;
                }
                merged = target == null ? payload.mergedWith(merged) : merged.mergedWith(payload);
                if (target == null) {
                    target = existing;
                }
                folded.add(existing.id());
                grew = true;
            }
        }
        if (target == null) {
            putInternal(incoming);
            return new WriteOutcome(incoming, false, List.of());
        }
        for (String id : folded) {
            if (!id.equals(target.id())) {
                memories.remove(id);
                index.delete(id);
            }
        }
        Memory updated = target.withPayload(merged);
        memories.put(updated.id(), updated);
        LOG.debug("Merged topic pattern into {} for {} (frequency {})", updated.id(), ownerId, merged.frequency());
        return new WriteOutcome(updated, true, List.of());
    }

    private List<Memory> enforceLimit(MemoryKind kind, int cap) {
        List<Memory> ofKind = byKindInternal(kind);
        if (ofKind.size() <= cap) {
            return List.of();
        }
        List<Memory> evicted = new ArrayList<>(ofKind.subList(0, ofKind.size() - cap));
        for (Memory memory : evicted) {
            memories.remove(memory.id());
            index.delete(memory.id());
        }
        LOG.debug("Evicted {} {} memories of {}", evicted.size(), kind, ownerId);
        return evicted;
    }

    private List<Memory> byKindInternal(MemoryKind kind) {
        return memories.values().stream()
            .filter(memory -> memory.kind() == kind)
            .sorted(Comparator.comparing(Memory::createdAt))
            .toList();
    }
}
