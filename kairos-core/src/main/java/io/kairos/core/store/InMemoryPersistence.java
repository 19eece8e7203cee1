package io.kairos.core.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryPersistence implements MemoryPersistence {
    private final Map<String, StoreSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public Optional<StoreSnapshot> load(String ownerId) {
        return Optional.ofNullable(snapshots.get(ownerId));
    }

    @Override
    public void save(String ownerId, StoreSnapshot snapshot) {
        snapshots.put(ownerId, snapshot);
    }

    @Override
    public boolean delete(String ownerId) {
        return snapshots.remove(ownerId) != null;
    }

    @Override
    public List<String> owners() {
        return snapshots.keySet().stream().sorted().toList();
    }
}
