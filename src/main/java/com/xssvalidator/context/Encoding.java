package com.xssvalidator.context;

public enum Encoding {
    URL("url"),
    HTML_ENTITY("html_entity"),
    UNICODE("unicode"),
    BASE64("base64");

    private final String wireName;

    Encoding(String wireName) { this.wireName = wireName; }

    public String wireName() { return wireName; }
}
