package com.xssvalidator.payload;

/**
 * A candidate payload with its category and priority (1 = most basic).
 * Emission order is decided by the generator, not by priority.
 */
public record PayloadSpec(String text, String category, int priority) {

    public PayloadSpec {
        if (text == null || text.isEmpty()) throw new IllegalArgumentException("payload text is required");
        if (category == null) category = "";
    }
}
