package io.kairos.core.observability;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Append-only audit log of engine activity plus the dashboard aggregated from it.
 */
public final class ObservabilityService {
    public static final String CONTEXT_BUILT = "context_built";
    public static final String CONTEXT_FAILED = "context_failed";
    public static final String TURN_RECORDED = "turn_recorded";
    public static final String MEMORY_EVICTED = "memory_evicted";
    public static final String DIMENSION_MISMATCH = "dimension_mismatch";

    private static final int MAX_EVENTS = 20_000;

    private final AuditStore store;
    private final Clock clock;

    public ObservabilityService(AuditStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized AuditEvent record(String type, Map<String, Object> attributes) throws IOException {
        List<AuditEvent> all = new ArrayList<>(store.load());
        AuditEvent event = new AuditEvent(
            UUID.randomUUID().toString(),
            clock.instant(),
            type,
            attributes
        );
        all.add(event);
        if (all.size() > MAX_EVENTS) {
            all = new ArrayList<>(all.subList(all.size() - MAX_EVENTS, all.size()));
        }
        store.save(all);
        return event;
    }

    public synchronized List<AuditEvent> recent(int limit) throws IOException {
        int safe = Math.max(1, limit);
        return store.load().stream()
            .sorted(Comparator.comparing(AuditEvent::timestamp).reversed())
            .limit(safe)
            .toList();
    }

    public synchronized EngineDashboard summary() throws IOException {
        List<AuditEvent> all = store.load().stream()
            .sorted(Comparator.comparing(AuditEvent::timestamp))
            .toList();
        Instant now = clock.instant();
        Instant since7d = now.minus(Duration.ofDays(7));

        List<AuditEvent> built = byType(all, CONTEXT_BUILT);
        List<AuditEvent> failed = byType(all, CONTEXT_FAILED);
        int attempts = built.size() + failed.size();
        double successRate = attempts == 0 ? 0.0 : percentage(built.size(), attempts);

        List<Double> latencies = numbers(built, "duration_ms").stream().sorted().toList();
        List<Double> conversations = numbers(built, "conversations");
        double averageConversations = conversations.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);

        int evicted = numbers(byType(all, MEMORY_EVICTED), "count").stream().mapToInt(Double::intValue).sum();
        int mismatches = numbers(byType(all, DIMENSION_MISMATCH), "count").stream().mapToInt(Double::intValue).sum();

        return new EngineDashboard(
            built.size(),
            failed.size(),
            round2(successRate),
            round2(percentile(latencies, 50)),
            round2(percentile(latencies, 95)),
            round2(averageConversations),
            byType(all, TURN_RECORDED).size(),
            evicted,
            mismatches,
            activeOwners(all, since7d, now).size(),
            all.size()
        );
    }

    private List<AuditEvent> byType(List<AuditEvent> events, String type) {
        return events.stream().filter(e -> type.equalsIgnoreCase(e.type())).toList();
    }

    private List<Double> numbers(List<AuditEvent> events, String key) {
        List<Double> values = new ArrayList<>();
        for (AuditEvent event : events) {
            event.number(key).ifPresent(values::add);
        }
        return values;
    }

    private Set<String> activeOwners(List<AuditEvent> events, Instant fromInclusive, Instant toInclusive) {
        return events.stream()
            .filter(e -> !e.timestamp().isBefore(fromInclusive) && !e.timestamp().isAfter(toInclusive))
            .map(AuditEvent::ownerId)
            .filter(owner -> !owner.isBlank())
            .collect(Collectors.toSet());
    }

    private double percentile(List<Double> sorted, int percentile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int safe = Math.max(0, Math.min(100, percentile));
        if (safe == 0) {
            return sorted.get(0);
        }
        int index = (int) Math.ceil((safe / 100.0) * sorted.size()) - 1;
        index = Math.max(0, Math.min(sorted.size() - 1, index));
        return sorted.get(index);
    }

    private double percentage(int numerator, int denominator) {
        if (denominator <= 0) {
            return 0.0;
        }
        return (numerator * 100.0) / denominator;
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
