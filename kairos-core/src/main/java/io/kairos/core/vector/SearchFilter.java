package io.kairos.core.vector;

import io.kairos.core.memory.MemoryKind;

/**
 * Restricts a search to one owner and optionally one kind. A null field matches anything.
 */
public record SearchFilter(String ownerId, MemoryKind kind) {

    public static SearchFilter any() {
        return new SearchFilter(null, null);
    }

    public static SearchFilter owner(String ownerId) {
        return new SearchFilter(ownerId, null);
    }

    public static SearchFilter owner(String ownerId, MemoryKind kind) {
        return new SearchFilter(ownerId, kind);
    }

    public boolean matches(IndexMetadata metadata) {
        if (ownerId != null && !ownerId.equals(metadata.ownerId())) {
            return false;
        }
        return kind == null || kind == metadata.kind();
    }
}
