package com.xssvalidator.context;

public enum CssType {
    ATTRIBUTE("attribute"),
    BLOCK("block");

    private final String wireName;

    CssType(String wireName) { this.wireName = wireName; }

    public String wireName() { return wireName; }
}
