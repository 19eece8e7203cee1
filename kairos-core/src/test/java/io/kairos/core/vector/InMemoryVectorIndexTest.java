package io.kairos.core.vector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.kairos.core.memory.MemoryKind;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryVectorIndexTest {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private final InMemoryVectorIndex index = new InMemoryVectorIndex();

    @Test
    void shouldReturnInsertedMemoryFirstWhenSearchingWithItsOwnEmbedding() {
        index.insert("a", List.of(1.0, 0.0, 0.0), meta("u1", MemoryKind.CONVERSATION, T0));
        index.insert("b", List.of(0.6, 0.8, 0.0), meta("u1", MemoryKind.CONVERSATION, T0));
        index.insert("c", List.of(0.0, 0.0, 1.0), meta("u1", MemoryKind.FACT, T0));

        SearchResult result = index.search(List.of(0.6, 0.8, 0.0), 2, SearchFilter.any());

        assertThat(result.hits()).hasSize(2);
        assertThat(result.hits().get(0).id()).isEqualTo("b");
        assertThat(result.hits().get(0).similarity()).isCloseTo(1.0, within(1e-9));
        assertThat(result.hits().get(1).id()).isEqualTo("a");
        assertThat(result.dimensionMismatches()).isZero();
    }

    @Test
    void shouldExcludeAndCountDimensionMismatches() {
        index.insert("ok", List.of(1.0, 0.0, 0.0), meta("u1", MemoryKind.CONVERSATION, T0));
        index.insert("short", List.of(1.0, 0.0), meta("u1", MemoryKind.CONVERSATION, T0));
        index.insert("long", List.of(1.0, 0.0, 0.0, 0.0), meta("u1", MemoryKind.CONVERSATION, T0));

        SearchResult result = index.search(List.of(1.0, 0.0, 0.0), 10, SearchFilter.any());

        assertThat(result.hits()).extracting(SearchHit::id).containsExactly("ok");
        assertThat(result.dimensionMismatches()).isEqualTo(2);
    }

    @Test
    void shouldBreakTiesByNewerCreationThenInsertionOrder() {
        List<Double> v = List.of(0.0, 1.0);
        index.insert("old", v, meta("u1", MemoryKind.CONVERSATION, T0));
        index.insert("first", v, meta("u1", MemoryKind.CONVERSATION, T0.plusSeconds(60)));
        index.insert("second", v, meta("u1", MemoryKind.CONVERSATION, T0.plusSeconds(60)));

        List<String> ids = index.search(v, 10, SearchFilter.any()).hits().stream().map(SearchHit::id).toList();
        List<String> again = index.search(v, 10, SearchFilter.any()).hits().stream().map(SearchHit::id).toList();

        assertThat(ids).containsExactly("first", "second", "old");
        assertThat(again).isEqualTo(ids);
    }

    @Test
    void shouldKeepInsertionSlotWhenOverwriting() {
        List<Double> v = List.of(1.0, 1.0);
        index.insert("a", v, meta("u1", MemoryKind.FACT, T0));
        index.insert("b", v, meta("u1", MemoryKind.FACT, T0));
        index.insert("a", v, meta("u1", MemoryKind.FACT, T0));

        List<String> ids = index.search(v, 10, SearchFilter.any()).hits().stream().map(SearchHit::id).toList();

        assertThat(ids).containsExactly("a", "b");
        assertThat(index.size()).isEqualTo(2);
    }

    @Test
    void shouldFilterByOwnerAndKind() {
        index.insert("u1-conv", List.of(1.0, 0.0), meta("u1", MemoryKind.CONVERSATION, T0));
        index.insert("u1-fact", List.of(1.0, 0.0), meta("u1", MemoryKind.FACT, T0));
        index.insert("u2-conv", List.of(1.0, 0.0), meta("u2", MemoryKind.CONVERSATION, T0));

        assertThat(index.search(List.of(1.0, 0.0), 10, SearchFilter.owner("u1")).hits())
            .extracting(SearchHit::id)
            .containsExactlyInAnyOrder("u1-conv", "u1-fact");
        assertThat(index.search(List.of(1.0, 0.0), 10, SearchFilter.owner("u1", MemoryKind.CONVERSATION)).hits())
            .extracting(SearchHit::id)
            .containsExactly("u1-conv");
    }

    @Test
    void shouldReturnFilteredEntriesWithZeroSimilarityForEmptyQuery() {
        index.insert("older", List.of(1.0, 0.0), meta("u1", MemoryKind.CONVERSATION, T0));
        index.insert("newer", List.of(0.0, 1.0), meta("u1", MemoryKind.CONVERSATION, T0.plusSeconds(5)));

        SearchResult result = index.search(List.of(), 10, SearchFilter.owner("u1"));

        assertThat(result.hits()).extracting(SearchHit::id).containsExactly("newer", "older");
        assertThat(result.hits()).allSatisfy(hit -> assertThat(hit.similarity()).isZero());
    }

    @Test
    void shouldIgnoreDeletesOfAbsentIdsAndNonPositiveK() {
        index.insert("a", List.of(1.0), meta("u1", MemoryKind.FACT, T0));

        assertThat(index.delete("missing")).isFalse();
        assertThat(index.delete("a")).isTrue();
        assertThat(index.contains("a")).isFalse();
        assertThat(index.search(List.of(1.0), 0, SearchFilter.any()).hits()).isEmpty();
    }

    @Test
    void shouldUpdateOnlyExistingEntriesAndMergeAttributes() {
        index.insert("a", List.of(1.0, 0.0), new IndexMetadata("u1", MemoryKind.FACT, T0, Map.of("source", "cli")));

        assertThat(index.update("missing", List.of(0.0, 1.0), Map.of())).isFalse();
        assertThat(index.update("a", List.of(0.0, 1.0), Map.of("category", "food"))).isTrue();

        SearchHit hit = index.search(List.of(0.0, 1.0), 1, SearchFilter.any()).hits().get(0);
        assertThat(hit.similarity()).isCloseTo(1.0, within(1e-9));
        assertThat(hit.metadata().attributes()).containsEntry("source", "cli").containsEntry("category", "food");
    }

    @Test
    void shouldReportStatsPerKind() {
        index.insert("a", List.of(1.0, 0.0, 0.0), meta("u1", MemoryKind.FACT, T0));
        index.insert("b", List.of(0.0, 1.0, 0.0), meta("u1", MemoryKind.FACT, T0));
        index.insert("c", List.of(0.0, 0.0, 1.0), meta("u1", MemoryKind.CONVERSATION, T0));

        IndexStats stats = index.stats();

        assertThat(stats.totalVectors()).isEqualTo(3);
        assertThat(stats.dimension()).isEqualTo(3);
        assertThat(stats.vectorsByKind()).containsEntry(MemoryKind.FACT, 2).containsEntry(MemoryKind.CONVERSATION, 1);
    }

    private static IndexMetadata meta(String owner, MemoryKind kind, Instant createdAt) {
        return new IndexMetadata(owner, kind, createdAt);
    }
}
