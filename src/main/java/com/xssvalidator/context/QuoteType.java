package com.xssvalidator.context;

/**
 * Quote character enclosing an injection point. Used both for attribute/style quoting
 * and for JavaScript string delimiters.
 */
public enum QuoteType {
    SINGLE('\'', "single"),
    DOUBLE('"', "double"),
    NONE('\0', "none");

    private final char quoteChar;
    private final String wireName;

    QuoteType(char quoteChar, String wireName) {
        this.quoteChar = quoteChar;
        this.wireName = wireName;
    }

    public char quoteChar() { return quoteChar; }

    public String wireName() { return wireName; }

    /** Quote kind for a trailing character: {@code '}, {@code "} or anything else. */
    public static QuoteType fromChar(char c) {
        if (c == '\'') return SINGLE;
        if (c == '"') return DOUBLE;
        return NONE;
    }

    /** Quote kind of the last character of {@code text}; NONE for empty text. */
    public static QuoteType trailing(String text) {
        if (text == null || text.isEmpty()) return NONE;
        return fromChar(text.charAt(text.length() - 1));
    }
}
