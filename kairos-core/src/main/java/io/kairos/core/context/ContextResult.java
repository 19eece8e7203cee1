package io.kairos.core.context;

import java.util.List;

/**
 * Assembled context plus the bookkeeping needed to audit the build.
 */
public record ContextResult(
    List<ContextEntry> entries,
    List<String> usedConversationIds,
    int candidateCount,
    int dimensionMismatches
) {
    public ContextResult {
        entries = entries == null ? List.of() : List.copyOf(entries);
        usedConversationIds = usedConversationIds == null ? List.of() : List.copyOf(usedConversationIds);
    }

    public static ContextResult empty() {
        return new ContextResult(List.of(), List.of(), 0, 0);
    }

    public List<String> texts() {
        return entries.stream().map(ContextEntry::text).toList();
    }

    public List<ContextEntry> bySource(ContextSource source) {
        return entries.stream().filter(entry -> entry.source() == source).toList();
    }
}
