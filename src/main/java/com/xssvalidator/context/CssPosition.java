package com.xssvalidator.context;

public enum CssPosition {
    /** Inside a declaration value, after {@code property:}. */
    PROPERTY_VALUE("property_value"),
    GENERAL("general");

    private final String wireName;

    CssPosition(String wireName) { this.wireName = wireName; }

    public String wireName() { return wireName; }
}
