package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kairos.core.store.StoreLimits;
import java.time.Duration;

/**
 * Collection caps and context assembly limits.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryConfig(
    int maxConversations,
    int maxEmotionalStates,
    int candidatePoolSize,
    int lifeEventDedupHours,
    int maxLifeEventEntries,
    int trendMinimumStates,
    int trendWindow,
    double defaultSalience,
    int idleEvictionMinutes
) {

    public static MemoryConfig defaults() {
        return new MemoryConfig(100, 50, 50, 24, 3, 3, 5, 0.5, 30);
    }

    public StoreLimits toLimits() {
        return new StoreLimits(maxConversations, maxEmotionalStates);
    }

    public Duration lifeEventWindow() {
        return Duration.ofHours(Math.max(1, lifeEventDedupHours));
    }

    public Duration idleTimeout() {
        return Duration.ofMinutes(Math.max(1, idleEvictionMinutes));
    }
}
