package com.xssvalidator.verification;

import com.xssvalidator.model.VerificationResult;

/**
 * Loads a response in a real browser engine and reports whether the payload executed.
 */
public interface Verifier {

    /**
     * @param url          URL the response was served from
     * @param responseBody raw response body to render
     * @param payload      payload text that was injected
     * @param browser      browser engine name (chromium, firefox, webkit)
     * @throws VerificationException if the service could not produce a verdict
     */
    VerificationResult verify(String url, String responseBody, String payload, String browser)
            throws VerificationException;
}
