package io.kairos.core.profile;

import java.time.Instant;
import java.time.LocalDate;

public record Goal(
    String id,
    String text,
    String category,
    LocalDate deadline,
    GoalStatus status,
    int progress,
    Instant createdAt
) {
    public Goal {
        id = id == null ? "" : id;
        text = text == null ? "" : text.trim();
        category = category == null || category.isBlank() ? "general" : category.trim();
        status = status == null ? GoalStatus.ACTIVE : status;
        progress = Math.max(0, Math.min(100, progress));
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
    }

    public boolean active() {
        return status == GoalStatus.ACTIVE;
    }

    public Goal withStatus(GoalStatus updatedStatus, int updatedProgress) {
        return new Goal(id, text, category, deadline, updatedStatus, updatedProgress, createdAt);
    }
}
