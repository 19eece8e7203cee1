package io.kairos.core.profile;

public enum GoalStatus {
    ACTIVE,
    COMPLETED,
    ABANDONED
}
