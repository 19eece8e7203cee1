package io.kairos.core.store;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one {@link OwnerStore} per owner. Stores are created on first access, loaded from
 * persistence when a snapshot exists, and dropped again after a period of inactivity.
 */
public final class OwnerRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(OwnerRegistry.class);

    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofMinutes(30);

    private final Map<String, OwnerStore> stores = new ConcurrentHashMap<>();
    private final MemoryPersistence persistence;
    private final StoreLimits limits;
    private final Clock clock;
    private final Duration idleTimeout;

    public OwnerRegistry(MemoryPersistence persistence, StoreLimits limits, Clock clock, Duration idleTimeout) {
        this.persistence = Objects.requireNonNull(persistence, "persistence must not be null");
        this.limits = limits == null ? StoreLimits.defaults() : limits;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.idleTimeout = idleTimeout == null || idleTimeout.isNegative() || idleTimeout.isZero()
            ? DEFAULT_IDLE_TIMEOUT
            : idleTimeout;
    }

    /**
     * Returns the owner's store, creating it on first access. An owner unknown to persistence
     * starts with an empty store.
     */
    public OwnerStore acquire(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId must not be blank");
        }
        OwnerStore store = stores.computeIfAbsent(ownerId, this::open);
        store.touch(clock.instant());
        return store;
    }

    public Optional<OwnerStore> find(String ownerId) {
        return Optional.ofNullable(stores.get(ownerId));
    }

    /**
     * Saves the owner's snapshot. A failed save is logged and the resident store stays
     * authoritative; the next successful save carries its state.
     */
    public boolean persist(OwnerStore store) {
        if (store.retired()) {
            LOG.debug("Not saving deleted memory store of {}", store.ownerId());
            return false;
        }
        try {
            persistence.save(store.ownerId(), store.snapshot(clock.instant()));
            return true;
        } catch (IOException e) {
            LOG.warn("Failed to save memories of {}: {}", store.ownerId(), e.getMessage());
            return false;
        }
    }

    /**
     * Drops the owner's resident store and persisted snapshot. Both happen under the store's
     * write lock and the store is retired, so a write still holding the old store cannot save
     * it back afterwards.
     */
    public boolean remove(String ownerId) {
        OwnerStore resident = stores.get(ownerId);
        boolean removed = resident == null
            ? deletePersisted(ownerId)
            : resident.write(() -> {
                resident.retire();
                stores.remove(ownerId, resident);
                deletePersisted(ownerId);
                return true;
            });
        if (removed) {
            LOG.info("Deleted memory store of {}", ownerId);
        }
        return removed;
    }

    private boolean deletePersisted(String ownerId) {
        try {
            return persistence.delete(ownerId);
        } catch (IOException e) {
            LOG.warn("Failed to delete persisted memories of {}: {}", ownerId, e.getMessage());
            return false;
        }
    }

    /**
     * Saves and unloads every store unused for longer than the idle timeout.
     *
     * @return ids of the evicted owners
     */
    public List<String> evictIdle(Instant now) {
        List<String> evicted = new ArrayList<>();
        for (OwnerStore store : List.copyOf(stores.values())) {
            if (Duration.between(store.lastUsed(), now).compareTo(idleTimeout) <= 0) {
                continue;
            }
            boolean saved = store.write(() -> persist(store));
            if (!saved) {
                continue;
            }
            if (stores.remove(store.ownerId(), store)) {
                evicted.add(store.ownerId());
                LOG.info("Unloaded idle memory store of {}", store.ownerId());
            }
        }
        return evicted;
    }

    /**
     * Every owner resident in memory or known to persistence, sorted.
     */
    public List<String> owners() {
        TreeSet<String> owners = new TreeSet<>(stores.keySet());
        try {
            owners.addAll(persistence.owners());
        } catch (IOException e) {
            LOG.warn("Failed to list persisted owners: {}", e.getMessage());
        }
        return List.copyOf(owners);
    }

    public int residentCount() {
        return stores.size();
    }

    private OwnerStore open(String ownerId) {
        Optional<StoreSnapshot> snapshot;
        try {
            snapshot = persistence.load(ownerId);
        } catch (IOException e) {
            LOG.warn("Failed to load memories of {}, starting empty: {}", ownerId, e.getMessage());
            snapshot = Optional.empty();
        }
        if (snapshot.isPresent() && !ownerId.equals(snapshot.get().ownerId())) {
            LOG.warn("Ignoring snapshot of {} stored under {}", snapshot.get().ownerId(), ownerId);
            snapshot = Optional.empty();
        }
        if (snapshot.isPresent()) {
            OwnerStore restored = OwnerStore.fromSnapshot(snapshot.get(), limits);
            LOG.info("Loaded memory store of {} ({} memories)", ownerId, restored.size());
            return restored;
        }
        LOG.info("Created memory store of {}", ownerId);
        return new OwnerStore(ownerId, limits, clock.instant());
    }
}
