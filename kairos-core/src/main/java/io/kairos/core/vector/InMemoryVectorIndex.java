package io.kairos.core.vector;

import io.kairos.core.memory.MemoryKind;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brute-force cosine index. Ties order by newer {@code createdAt}, then by insertion order.
 */
public final class InMemoryVectorIndex implements VectorIndex {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryVectorIndex.class);
    private static final Comparator<Candidate> ORDER = Comparator
        .comparingDouble(Candidate::similarity).reversed()
        .thenComparing((Candidate c) -> c.entry().metadata().createdAt(), Comparator.reverseOrder())
        .thenComparingLong(c -> c.entry().sequence());

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private long nextSequence;

    @Override
    public void insert(String id, List<Double> embedding, IndexMetadata metadata) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        List<Double> vector = embedding == null ? List.of() : List.copyOf(embedding);
        IndexMetadata safeMetadata = metadata == null ? new IndexMetadata("", null, null) : metadata;
        lock.writeLock().lock();
        try {
            int dimension = dimensionInternal();
            if (dimension > 0 && !vector.isEmpty() && vector.size() != dimension) {
                LOG.warn("Indexing {} with dimension {} into index of dimension {}", id, vector.size(), dimension);
            }
            Entry previous = entries.get(id);
            long sequence = previous == null ? nextSequence++ : previous.sequence();
            entries.put(id, new Entry(vector, safeMetadata, sequence));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean update(String id, List<Double> embedding, Map<String, String> attributes) {
        lock.writeLock().lock();
        try {
            Entry previous = entries.get(id);
            if (previous == null) {
                return false;
            }
            List<Double> vector = embedding == null ? previous.embedding() : List.copyOf(embedding);
            entries.put(id, new Entry(vector, previous.metadata().withAttributes(attributes), previous.sequence()));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean delete(String id) {
        lock.writeLock().lock();
        try {
            return entries.remove(id) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public SearchResult search(List<Double> queryEmbedding, int k, SearchFilter filter) {
        if (k <= 0) {
            return SearchResult.empty();
        }
        SearchFilter safeFilter = filter == null ? SearchFilter.any() : filter;
        List<Candidate> candidates = new ArrayList<>();
        int mismatches = 0;

        lock.readLock().lock();
        try {
            for (Map.Entry<String, Entry> item : entries.entrySet()) {
                Entry entry = item.getValue();
                if (!safeFilter.matches(entry.metadata())) {
                    continue;
                }
                double similarity;
                try {
                    similarity = VectorMath.cosine(queryEmbedding, entry.embedding());
                } catch (DimensionMismatchException e) {
                    mismatches++;
                    continue;
                }
                candidates.add(new Candidate(item.getKey(), similarity, entry));
            }
        } finally {
            lock.readLock().unlock();
        }

        if (mismatches > 0) {
            LOG.warn("Excluded {} indexed vectors with a dimension different from the query", mismatches);
        }
        List<SearchHit> hits = candidates.stream()
            .sorted(ORDER)
            .limit(k)
            .map(c -> new SearchHit(c.id(), c.similarity(), c.entry().metadata()))
            .toList();
        return new SearchResult(hits, mismatches);
    }

    @Override
    public boolean contains(String id) {
        lock.readLock().lock();
        try {
            return entries.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public IndexStats stats() {
        lock.readLock().lock();
        try {
            Map<MemoryKind, Integer> byKind = new EnumMap<>(MemoryKind.class);
            for (Entry entry : entries.values()) {
                MemoryKind kind = entry.metadata().kind();
                if (kind != null) {
                    byKind.merge(kind, 1, Integer::sum);
                }
            }
            return new IndexStats(entries.size(), dimensionInternal(), byKind);
        } finally {
            lock.readLock().unlock();
        }
    }

    private int dimensionInternal() {
        for (Entry entry : entries.values()) {
            if (!entry.embedding().isEmpty()) {
                return entry.embedding().size();
            }
        }
        return 0;
    }

    private record Entry(List<Double> embedding, IndexMetadata metadata, long sequence) {
    }

    private record Candidate(String id, double similarity, Entry entry) {
    }
}
