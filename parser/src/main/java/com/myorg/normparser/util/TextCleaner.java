package com.myorg.normparser.util;

import java.util.regex.Pattern;

public final class TextCleaner {

    // Unicode-aware \s plus an explicit NBSP, which Excel exports use between words
    private static final Pattern WHITESPACE_RUN =
            Pattern.compile("[\\s\\u00A0]+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextCleaner() {}

    /**
     * Collapses every whitespace run to one ASCII space and trims. Null stays null.
     */
    public static String clean(String text) {
        if (text == null || text.isEmpty()) return text;
        return WHITESPACE_RUN.matcher(text).replaceAll(" ").trim();
    }
}
