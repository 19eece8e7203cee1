package io.kairos.core.observability;

public record EngineDashboard(
    int contextBuilds,
    int contextFailures,
    double buildSuccessRate,
    double p50BuildLatencyMs,
    double p95BuildLatencyMs,
    double averageConversationEntries,
    int turnsRecorded,
    int memoriesEvicted,
    int dimensionMismatches,
    int activeOwners7d,
    int auditEvents
) {
}
