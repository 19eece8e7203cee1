package io.kairos.core.memory;

import java.util.Locale;

public enum LifeEventCategory {
    EDUCATION,
    CAREER,
    RELATIONSHIP,
    FAMILY,
    RESIDENCE,
    TRAVEL,
    HEALTH,
    LOSS,
    ACHIEVEMENT,
    CHALLENGE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
