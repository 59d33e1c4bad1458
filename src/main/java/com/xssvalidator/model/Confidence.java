package com.xssvalidator.model;

public enum Confidence {
    TENTATIVE,
    FIRM,
    CERTAIN;

    /**
     * Burp issue confidence for a verification outcome: script execution observed in the
     * browser is certain, any other positive verdict is firm.
     */
    public static Confidence forResult(VerificationResult result) {
        if (result.isExecuted()) return CERTAIN;
        if (result.isVulnerable()) return FIRM;
        return TENTATIVE;
    }

    /**
     * Map to Burp's AuditIssueConfidence string for native issue reporting.
     */
    public String toBurpConfidence() {
        return switch (this) {
            case TENTATIVE -> "TENTATIVE";
            case FIRM -> "FIRM";
            case CERTAIN -> "CERTAIN";
        };
    }
}
