package io.kairos.core.profile;

import java.time.Instant;

public record Relationship(
    String id,
    String person,
    String relation,
    String notes,
    Instant createdAt
) {
    public Relationship {
        id = id == null ? "" : id;
        person = person == null ? "" : person.trim();
        relation = relation == null ? "" : relation.trim();
        notes = notes == null ? "" : notes.trim();
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
    }

    public String describe() {
        return relation.isBlank() ? person : person + " (" + relation + ")";
    }
}
