package com.deerbot.server.text;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WordTokenizerTest {

    private final WordTokenizer tokenizer = new WordTokenizer();

    @Test
    void testSplitsWordsNumbersWhitespaceAndPunctuation() {
        List<String> tokens = tokenizer.tokenize("Hello,  world 42.");
        assertEquals(List.of("Hello", ",", "  ", "world", " ", "42", "."), tokens);
    }

    @Test
    void testKeepsNonAsciiLetterRuns() {
        List<String> tokens = tokenizer.tokenize("Äiti söi (omenan).");
        assertEquals(List.of("Äiti", " ", "söi", " ", "(", "omenan", ")", "."), tokens);
    }

    @Test
    void testTokensConcatenateToInput() {
        String text = "The 3rd item - [sic] - costs 12,50 euros.";
        assertEquals(text, String.join("", tokenizer.tokenize(text)));
    }

    @Test
    void testEmptyInput() {
        assertTrue(tokenizer.tokenize("").isEmpty());
    }
}
