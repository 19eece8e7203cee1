package io.kairos.core.vector;

import java.util.List;

public record SearchResult(List<SearchHit> hits, int dimensionMismatches) {
    public SearchResult {
        hits = hits == null ? List.of() : List.copyOf(hits);
        dimensionMismatches = Math.max(0, dimensionMismatches);
    }

    public static SearchResult empty() {
        return new SearchResult(List.of(), 0);
    }
}
