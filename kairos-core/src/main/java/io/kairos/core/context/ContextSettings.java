package io.kairos.core.context;

import io.kairos.core.config.model.MemoryConfig;

public record ContextSettings(
    int candidatePoolSize,
    int maxLifeEventEntries,
    int trendMinimumStates,
    int trendWindow
) {
    public ContextSettings {
        candidatePoolSize = candidatePoolSize <= 0 ? 50 : candidatePoolSize;
        maxLifeEventEntries = Math.max(0, maxLifeEventEntries);
        trendMinimumStates = trendMinimumStates <= 0 ? 3 : trendMinimumStates;
        trendWindow = trendWindow <= 0 ? 5 : trendWindow;
    }

    public static ContextSettings defaults() {
        return new ContextSettings(50, 3, 3, 5);
    }

    public static ContextSettings from(MemoryConfig config) {
        return new ContextSettings(
            config.candidatePoolSize(),
            config.maxLifeEventEntries(),
            config.trendMinimumStates(),
            config.trendWindow()
        );
    }
}
