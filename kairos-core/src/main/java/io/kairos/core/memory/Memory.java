package io.kairos.core.memory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A unit of user-scoped information that can be surfaced as conversational context.
 *
 * <p>Out-of-range salience and emotion values are clamped, never rejected, and
 * {@code lastAccessedAt} never precedes {@code createdAt}.
 */
public record Memory(
    String id,
    String ownerId,
    MemoryKind kind,
    List<Double> embedding,
    Instant createdAt,
    Instant lastAccessedAt,
    long accessCount,
    double salience,
    double emotionScore,
    MemoryPayload payload
) {
    public static final double DEFAULT_SALIENCE = 0.5;

    public Memory {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId must not be blank");
        }
        Objects.requireNonNull(kind, "kind must not be null");
        embedding = embedding == null ? List.of() : List.copyOf(embedding);
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        lastAccessedAt = lastAccessedAt == null || lastAccessedAt.isBefore(createdAt) ? createdAt : lastAccessedAt;
        accessCount = Math.max(0, accessCount);
        salience = Double.isNaN(salience) ? DEFAULT_SALIENCE : clamp(salience, 0.0, 1.0);
        emotionScore = Double.isNaN(emotionScore) ? 0.0 : clamp(emotionScore, -1.0, 1.0);
    }

    public static Memory create(
        String ownerId,
        MemoryKind kind,
        MemoryPayload payload,
        List<Double> embedding,
        double salience,
        double emotionScore,
        Instant now
    ) {
        return new Memory(
            newId(kind),
            ownerId,
            kind,
            embedding,
            now,
            now,
            0,
            salience,
            emotionScore,
            payload
        );
    }

    public static String newId(MemoryKind kind) {
        String prefix = switch (kind) {
            case CONVERSATION -> "conv";
            case FACT -> "fact";
            case PREFERENCE -> "pref";
            case LIFE_EVENT -> "event";
            case EMOTIONAL_STATE -> "emotion";
            case TOPIC_PATTERN -> "pattern";
            case LONG_TERM -> "ltm";
        };
        return prefix + "_" + UUID.randomUUID();
    }

    public boolean hasEmbedding() {
        return !embedding.isEmpty();
    }

    public Memory withAccess(Instant at) {
        return new Memory(id, ownerId, kind, embedding, createdAt, at, accessCount + 1, salience, emotionScore, payload);
    }

    public Memory withPayload(MemoryPayload updated) {
        return new Memory(id, ownerId, kind, embedding, createdAt, lastAccessedAt, accessCount, salience, emotionScore, updated);
    }

    public Memory withEmbedding(List<Double> updated) {
        return new Memory(id, ownerId, kind, updated, createdAt, lastAccessedAt, accessCount, salience, emotionScore, payload);
    }

    public String describe() {
        return payload == null ? "" : payload.describe();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
