package io.kairos.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One pretty-printed JSON file per owner, replaced atomically on every save.
 */
public final class FileMemoryPersistence implements MemoryPersistence {
    private static final Logger LOG = LoggerFactory.getLogger(FileMemoryPersistence.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;

    public FileMemoryPersistence(Path directory) {
        this.directory = directory;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public synchronized Optional<StoreSnapshot> load(String ownerId) throws IOException {
        Path path = pathFor(ownerId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        String json = Files.readString(path);
        try {
            return Optional.of(mapper.readValue(json, StoreSnapshot.class));
        } catch (JsonProcessingException e) {
            LOG.warn("Ignoring unreadable memory snapshot {}: {}", path, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized void save(String ownerId, StoreSnapshot snapshot) throws IOException {
        Files.createDirectories(directory);
        Path path = pathFor(ownerId);
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    @Override
    public synchronized boolean delete(String ownerId) throws IOException {
        return Files.deleteIfExists(pathFor(ownerId));
    }

    @Override
    public synchronized List<String> owners() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .map(path -> path.getFileName().toString())
                .filter(name -> name.endsWith(SUFFIX))
                .map(name -> URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()), StandardCharsets.UTF_8))
                .sorted()
                .toList();
        }
    }

    private Path pathFor(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId must not be blank");
        }
        return directory.resolve(URLEncoder.encode(ownerId, StandardCharsets.UTF_8) + SUFFIX);
    }
}
