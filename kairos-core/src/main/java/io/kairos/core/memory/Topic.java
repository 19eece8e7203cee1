package io.kairos.core.memory;

import java.util.Locale;

public enum Topic {
    WORK,
    FAMILY,
    HEALTH,
    EDUCATION,
    RELATIONSHIPS,
    HOBBIES,
    EMOTIONS,
    GOALS;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
