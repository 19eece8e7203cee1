package io.kairos.core.vector;

import io.kairos.core.memory.MemoryKind;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public record IndexMetadata(
    String ownerId,
    MemoryKind kind,
    Instant createdAt,
    Map<String, String> attributes
) {
    public IndexMetadata {
        ownerId = ownerId == null ? "" : ownerId;
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public IndexMetadata(String ownerId, MemoryKind kind, Instant createdAt) {
        this(ownerId, kind, createdAt, Map.of());
    }

    IndexMetadata withAttributes(Map<String, String> patch) {
        if (patch == null || patch.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new HashMap<>(attributes);
        merged.putAll(patch);
        return new IndexMetadata(ownerId, kind, createdAt, merged);
    }
}
