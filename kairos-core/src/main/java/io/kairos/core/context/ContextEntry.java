package io.kairos.core.context;

import java.util.List;
import java.util.Objects;

public record ContextEntry(ContextSource source, String text, List<String> sourceIds) {
    public ContextEntry {
        Objects.requireNonNull(source, "source must not be null");
        text = text == null ? "" : text;
        sourceIds = sourceIds == null ? List.of() : List.copyOf(sourceIds);
    }
}
