package io.kairos.core.store;

import io.kairos.core.memory.Memory;
import io.kairos.core.profile.OwnerProfile;
import java.time.Instant;
import java.util.List;

public record StoreSnapshot(
    String ownerId,
    List<Memory> memories,
    OwnerProfile profile,
    Instant createdAt,
    Instant updatedAt
) {
    public StoreSnapshot {
        ownerId = ownerId == null ? "" : ownerId;
        memories = memories == null ? List.of() : List.copyOf(memories);
        profile = profile == null ? OwnerProfile.empty() : profile;
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }
}
