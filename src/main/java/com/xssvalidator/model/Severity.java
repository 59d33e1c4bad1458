package com.xssvalidator.model;

import java.util.Locale;

/**
 * Severity reported by the verification service ("none", "low", "medium", "high").
 */
public enum Severity {
    NONE,
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Parses the service's lower-case severity string. Unknown or missing values map to NONE.
     */
    public static Severity fromString(String value) {
        if (value == null || value.isBlank()) return NONE;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "low" -> LOW;
            case "medium" -> MEDIUM;
            case "high", "critical" -> HIGH;
            default -> NONE;
        };
    }

    /**
     * Map to Burp's AuditIssueSeverity name for native issue reporting.
     * Burp has no "none" severity, so it maps to INFORMATION.
     */
    public String toBurpSeverity() {
        return switch (this) {
            case NONE -> "INFORMATION";
            case LOW -> "LOW";
            case MEDIUM -> "MEDIUM";
            case HIGH -> "HIGH";
        };
    }
}
