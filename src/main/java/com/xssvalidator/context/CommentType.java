package com.xssvalidator.context;

public enum CommentType {
    HTML("html"),
    JS_SINGLE_LINE("js_single_line"),
    JS_MULTI_LINE("js_multi_line"),
    CSS("css");

    private final String wireName;

    CommentType(String wireName) { this.wireName = wireName; }

    public String wireName() { return wireName; }
}
