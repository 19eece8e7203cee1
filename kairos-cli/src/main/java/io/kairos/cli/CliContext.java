package io.kairos.cli;

import io.kairos.core.MemoryEngine;
import io.kairos.core.config.ConfigService;
import io.kairos.core.observability.ObservabilityService;
import java.nio.file.Path;

public record CliContext(
    MemoryEngine engine,
    ConfigService configService,
    Path configPath,
    ObservabilityService observability
) {
    public CliContext(MemoryEngine engine, ConfigService configService, Path configPath) {
        this(engine, configService, configPath, null);
    }
}
