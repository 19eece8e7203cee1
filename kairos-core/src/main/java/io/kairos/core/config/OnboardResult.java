package io.kairos.core.config;

import java.nio.file.Path;

public record OnboardResult(Path configPath, Path storagePath, boolean createdConfig, boolean overwrittenConfig) {
}
