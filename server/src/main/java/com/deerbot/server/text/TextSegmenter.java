package com.deerbot.server.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cuts prose into segments worth analyzing. A line is kept when it starts
 * with an upper case character and holds at least {@code minInputLength}
 * characters up to its last full stop; the rest of the line is dropped.
 */
public class TextSegmenter {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SPACE_AFTER_OPENING = Pattern.compile("([(\\[{])\\s");
    private static final Pattern SPACE_BEFORE_CLOSING = Pattern.compile("\\s([,;:)\\]}])");

    private final int minInputLength;

    public TextSegmenter(int minInputLength) {
        this.minInputLength = minInputLength;
    }

    public List<String> segment(String text) {
        List<String> result = new ArrayList<>();

        for (String line : text.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            int begin = trimmed.codePointAt(0);
            if (!Character.isUpperCase(begin) && !Character.isTitleCase(begin)) {
                continue;
            }

            int length = trimmed.lastIndexOf('.') + 1;
            if (length < minInputLength) {
                continue;
            }

            String str = trimmed.substring(0, length);
            str = WHITESPACE.matcher(str).replaceAll(" ");
            str = replaceFirst(SPACE_AFTER_OPENING, str);
            str = replaceFirst(SPACE_BEFORE_CLOSING, str);

            str = completeParens(str, '(', ')');
            str = completeParens(str, '[', ']');
            str = completeParens(str, '{', '}');

            result.add(str);
        }
        return result;
    }

    private static String replaceFirst(Pattern pattern, String str) {
        Matcher m = pattern.matcher(str);
        return m.find() ? str.substring(0, m.start()) + m.group(1) + str.substring(m.end()) : str;
    }

    private static String completeParens(String str, char left, char right) {
        return str.lastIndexOf(left) <= str.lastIndexOf(right) ? str : str + right;
    }
}
