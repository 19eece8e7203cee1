package io.kairos.core.embedding;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lowercase letter-or-digit runs of any script, without stop words and one-character tokens.
 */
public final class TextTokens {
    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "and", "or", "is", "are", "was", "were", "to", "of", "in", "for", "on", "with",
        "at", "by", "from", "it", "this", "that", "these", "those", "be", "been", "being", "as", "if", "but",
        "not", "no", "you", "your", "we", "our", "they", "their", "he", "she", "his", "her", "my", "me", "am",
        "just", "so", "do", "did", "have", "has", "had", "about"
    );

    private TextTokens() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] raw = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        List<String> out = new ArrayList<>();
        for (String token : raw) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                out.add(token);
            }
        }
        return out;
    }

    public static Set<String> distinct(String text) {
        return new LinkedHashSet<>(tokenize(text));
    }

    public static boolean overlaps(String left, String right) {
        Set<String> leftTokens = distinct(left);
        if (leftTokens.isEmpty()) {
            return false;
        }
        for (String token : tokenize(right)) {
            if (leftTokens.contains(token)) {
                return true;
            }
        }
        return false;
    }
}
