package io.recallr.memory.retention;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Extracts the keyword set used for pattern similarity.
 */
public final class KeywordExtractor {

    public static final int MIN_KEYWORD_LENGTH = 4;

    private static final String DELIMITERS = " \t\n\r.,;:!?()[]{}\"'";

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "this", "that", "these", "those", "with", "from", "have", "has",
            "been", "will", "would", "could", "should", "what", "when", "where",
            "which", "while", "your", "their", "there", "here");

    private KeywordExtractor() {
    }

    /**
     * Lowercased, de-duplicated tokens of at least {@value #MIN_KEYWORD_LENGTH}
     * characters that are not stop words, in first-occurrence order.
     */
    public static Set<String> extract(String text) {
        Set<String> keywords = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) return keywords;

        int start = -1;
        for (int i = 0; i <= text.length(); i++) {
            boolean delimiter = i == text.length() || DELIMITERS.indexOf(text.charAt(i)) >= 0;
            if (!delimiter) {
                if (start < 0) start = i;
                continue;
            }
            if (start >= 0) {
                String token = text.substring(start, i);
                if (token.length() >= MIN_KEYWORD_LENGTH) {
                    String word = token.toLowerCase(Locale.ROOT);
                    if (!STOP_WORDS.contains(word)) {
                        keywords.add(word);
                    }
                }
                start = -1;
            }
        }
        return keywords;
    }

    /** Shared keywords divided by the larger set's size; 0 when either set is empty. */
    public static double similarity(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        int shared = 0;
        for (String word : a) {
            if (b.contains(word)) shared++;
        }
        return (double) shared / Math.max(a.size(), b.size());
    }
}
