package io.kairos.core.observability;

import java.io.IOException;
import java.util.List;

/**
 * Backing storage of the audit log. The service always rewrites the whole, already capped
 * list, so implementations need no append or trimming logic.
 */
public interface AuditStore {

    /**
     * @return every stored event in insertion order, empty when nothing was recorded yet
     */
    List<AuditEvent> load() throws IOException;

    void save(List<AuditEvent> events) throws IOException;
}
