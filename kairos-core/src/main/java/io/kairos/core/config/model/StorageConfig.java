package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(String directory, String auditFile) {

    public static StorageConfig defaults() {
        return new StorageConfig("~/.kairos/memories", "~/.kairos/observability/audit-events.json");
    }
}
