package io.kairos.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.config.model.StorageConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes {@code config.json}. Values on disk are deep-merged over the defaults, so
 * keys added in later versions appear without rewriting the file.
 */
public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public KairosConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return KairosConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(KairosConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, KairosConfig.class);
    }

    public void save(Path configPath, KairosConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        return onboard(configPath, overwrite, null);
    }

    /**
     * Writes the config (defaults when absent or when {@code overwrite} is set) and creates the
     * memory storage directory. A non-blank {@code storageDirectory} replaces the configured one.
     */
    public OnboardResult onboard(Path configPath, boolean overwrite, String storageDirectory) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        boolean created = !Files.exists(configPath);
        KairosConfig config = created || overwrite ? KairosConfig.defaults() : load(configPath);
        if (storageDirectory != null && !storageDirectory.isBlank()) {
            StorageConfig storage = new StorageConfig(storageDirectory.trim(), config.storage().auditFile());
            config = new KairosConfig(config.memory(), config.scoring(), storage, config.embedding());
        }
        save(configPath, config);

        Path storage = ConfigPaths.resolveStorage(config.storage().directory());
        Files.createDirectories(storage);
        return new OnboardResult(configPath, storage, created, !created && overwrite);
    }

    public String toPrettyJson(KairosConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null || override.isNull()) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
