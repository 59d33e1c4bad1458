package com.xssvalidator.model;

import burp.api.montoya.core.ToolType;

/**
 * Burp tool that produced a response event.
 */
public enum ToolKind {
    PROXY("Proxy"),
    INTRUDER("Intruder"),
    REPEATER("Repeater"),
    SCANNER("Scanner"),
    EXTENSIONS("Extensions"),
    OTHER("Unknown");

    private final String displayName;

    ToolKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static ToolKind fromBurp(ToolType toolType) {
        if (toolType == null) return OTHER;
        return switch (toolType) {
            case PROXY -> PROXY;
            case INTRUDER -> INTRUDER;
            case REPEATER -> REPEATER;
            case SCANNER -> SCANNER;
            case EXTENSIONS -> EXTENSIONS;
            default -> OTHER;
        };
    }
}
