package io.kairos.core.store;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Durable key-value storage of one snapshot per owner.
 */
public interface MemoryPersistence {

    /**
     * @return empty when nothing was ever saved for the owner
     */
    Optional<StoreSnapshot> load(String ownerId) throws IOException;

    void save(String ownerId, StoreSnapshot snapshot) throws IOException;

    boolean delete(String ownerId) throws IOException;

    List<String> owners() throws IOException;
}
