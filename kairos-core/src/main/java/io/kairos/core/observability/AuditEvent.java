package io.kairos.core.observability;

import java.time.Instant;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * One engine event. Attribute values are numbers or strings so the log stays plain JSON.
 */
public record AuditEvent(
    String id,
    Instant timestamp,
    String type,
    Map<String, Object> attributes
) {
    public AuditEvent {
        id = id == null ? "" : id.trim();
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        type = type == null ? "" : type.trim();
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public String ownerId() {
        return attribute("owner_id");
    }

    /**
     * Numeric attribute, accepting numbers and numeric strings; empty when absent, malformed
     * or negative.
     */
    public OptionalDouble number(String key) {
        Object value = attributes.get(key);
        double parsed;
        if (value instanceof Number n) {
            parsed = n.doubleValue();
        } else if (value == null) {
            return OptionalDouble.empty();
        } else {
            try {
                parsed = Double.parseDouble(String.valueOf(value).trim());
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return parsed >= 0 && Double.isFinite(parsed) ? OptionalDouble.of(parsed) : OptionalDouble.empty();
    }

    public String attribute(String key) {
        Object value = attributes.get(key);
        return value == null ? "" : String.valueOf(value).trim();
    }
}
