package com.xssvalidator.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class VerificationResultTest {

    @Test
    void vulnerableOnlyWithPositiveValueAndNoError() {
        assertTrue(VerificationResult.builder("u", "p", "chromium").value(1).build().isVulnerable());
        assertFalse(VerificationResult.builder("u", "p", "chromium").value(0).build().isVulnerable());
        assertFalse(VerificationResult.builder("u", "p", "chromium").value(1).error("TIMEOUT").build().isVulnerable());
    }

    @Test
    void errorResultHasMessage() {
        VerificationResult r = VerificationResult.error("u", "p", "webkit", " ");
        assertTrue(r.isError());
        assertEquals("verification failed", r.getError());
        assertEquals(0, r.getValue());
    }

    @Test
    void toBuilderKeepsVerdictAndAddsContext() {
        VerificationResult verdict = VerificationResult.builder("u", "p", "firefox")
                .value(1).executed(true).severity(Severity.HIGH).confidence(0.9).timestamp(42L).build();

        VerificationResult enriched = verdict.toBuilder().method("POST").tool("Intruder").build();

        assertEquals(1, enriched.getValue());
        assertTrue(enriched.isExecuted());
        assertEquals(Severity.HIGH, enriched.getSeverity());
        assertEquals(42L, enriched.getTimestamp());
        assertEquals("POST", enriched.getMethod());
        assertEquals("", verdict.getMethod());
    }

    @Test
    void confidenceFollowsExecution() {
        assertEquals(Confidence.CERTAIN,
                Confidence.forResult(VerificationResult.builder("u", "p", "b").value(1).executed(true).build()));
        assertEquals(Confidence.FIRM,
                Confidence.forResult(VerificationResult.builder("u", "p", "b").value(1).build()));
        assertEquals(Confidence.TENTATIVE,
                Confidence.forResult(VerificationResult.builder("u", "p", "b").build()));
    }

    @Test
    void severityParsing() {
        assertEquals(Severity.HIGH, Severity.fromString("critical"));
        assertEquals(Severity.MEDIUM, Severity.fromString("Medium"));
        assertEquals(Severity.NONE, Severity.fromString(null));
        assertEquals(Severity.NONE, Severity.fromString("bogus"));
    }
}
