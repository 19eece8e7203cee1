package io.kairos.core.observability;

import java.util.ArrayList;
import java.util.List;

public final class InMemoryAuditStore implements AuditStore {
    private List<AuditEvent> events = new ArrayList<>();

    @Override
    public synchronized List<AuditEvent> load() {
        return List.copyOf(events);
    }

    @Override
    public synchronized void save(List<AuditEvent> updated) {
        events = new ArrayList<>(updated);
    }
}
