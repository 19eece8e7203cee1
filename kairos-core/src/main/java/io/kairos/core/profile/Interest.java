package io.kairos.core.profile;

import java.time.Instant;

public record Interest(String id, String interest, String category, Instant createdAt) {
    public Interest {
        id = id == null ? "" : id;
        interest = interest == null ? "" : interest.trim();
        category = category == null || category.isBlank() ? "general" : category.trim();
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
    }
}
