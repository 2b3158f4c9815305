package io.recallr.memory.retention;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KeywordExtractorTest {

    @Test
    void shouldKeepTokensOfFourOrMoreCharacters() {
        assertEquals(List.of("quick", "brown", "jumps", "over", "lazy"),
                List.copyOf(KeywordExtractor.extract("The quick brown fox, jumps over THE lazy dog!")));
    }

    @Test
    void shouldDropStopWords() {
        assertTrue(KeywordExtractor.extract("This should have been there, which would while").isEmpty());
    }

    @Test
    void shouldLowercaseAndDeduplicate() {
        assertEquals(Set.of("memory"), KeywordExtractor.extract("Memory memory MEMORY"));
    }

    @Test
    void shouldSplitOnPunctuationAndQuotes() {
        assertEquals(List.of("quoted", "parens", "brackets", "braces", "single", "semi", "colon"),
                List.copyOf(KeywordExtractor.extract("\"quoted\"(parens)[brackets]{braces}'single';semi:colon")));
    }

    @Test
    void shouldHandleEmptyInput() {
        assertTrue(KeywordExtractor.extract(null).isEmpty());
        assertTrue(KeywordExtractor.extract("").isEmpty());
    }

    @Test
    void shouldDivideSharedByLargerSet() {
        assertEquals(0.5, KeywordExtractor.similarity(Set.of("alpha", "bravo", "charlie", "delta"),
                Set.of("alpha", "bravo", "xray")), 1e-9);
        assertEquals(1.0, KeywordExtractor.similarity(Set.of("alpha"), Set.of("alpha")), 1e-9);
    }

    @Test
    void shouldScoreEmptySetsAsUnrelated() {
        assertEquals(0.0, KeywordExtractor.similarity(Set.of(), Set.of("alpha")));
        assertEquals(0.0, KeywordExtractor.similarity(Set.of(), Set.of()));
    }
}
