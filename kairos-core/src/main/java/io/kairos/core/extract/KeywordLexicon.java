package io.kairos.core.extract;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Ordered keyword sets matched on whole words, case-insensitively. Iteration order is the
 * priority order.
 */
final class KeywordLexicon<K> {
    private final Map<K, Pattern> patterns;

    private KeywordLexicon(Map<K, Pattern> patterns) {
        this.patterns = patterns;
    }

    static <K> Builder<K> builder() {
        return new Builder<>();
    }

    Optional<K> firstMatch(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<K, Pattern> entry : patterns.entrySet()) {
            if (entry.getValue().matcher(lowered).find()) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    List<K> allMatches(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        List<K> matches = new ArrayList<>();
        for (Map.Entry<K, Pattern> entry : patterns.entrySet()) {
            if (entry.getValue().matcher(lowered).find()) {
                matches.add(entry.getKey());
            }
        }
        return matches;
    }

    int count(String text, K key) {
        Pattern pattern = patterns.get(key);
        if (pattern == null || text == null) {
            return 0;
        }
        return (int) pattern.matcher(text.toLowerCase(Locale.ROOT)).results().count();
    }

    static final class Builder<K> {
        private final Map<K, Pattern> patterns = new LinkedHashMap<>();

        Builder<K> add(K key, String... keywords) {
            String alternation = Arrays.stream(keywords)
                .map(keyword -> Pattern.quote(keyword.toLowerCase(Locale.ROOT)))
                .collect(Collectors.joining("|"));
            patterns.put(key, Pattern.compile("\\b(?:" + alternation + ")\\b"));
            return this;
        }

        KeywordLexicon<K> build() {
            return new KeywordLexicon<>(new LinkedHashMap<>(patterns));
        }
    }
}
