package com.xssvalidator.context;

/**
 * Textual environment of an injection point, in classification precedence order.
 */
public enum ContextKind {
    COMMENT,
    CSS,
    ATTRIBUTE,
    JAVASCRIPT,
    URL,
    HTML,
    UNKNOWN;

    /** Lower-case wire name used when the context is serialized. */
    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
