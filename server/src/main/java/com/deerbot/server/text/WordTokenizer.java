package com.deerbot.server.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a text segment into chain tokens: runs of letters, runs of digits,
 * runs of whitespace, and every other character on its own. Concatenating the
 * tokens gives back the input.
 */
public class WordTokenizer {

    private static final Pattern TOKEN = Pattern.compile("\\p{L}+|\\p{Nd}+|\\s+|.", Pattern.DOTALL);

    public List<String> tokenize(String segment) {
        List<String> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(segment);
        while (m.find()) {
            tokens.add(m.group());
        }
        return tokens;
    }
}
