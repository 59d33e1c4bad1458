package com.xssvalidator.verification;

import burp.api.montoya.http.message.HttpRequestResponse;
import com.xssvalidator.model.VerificationResult;

/**
 * Verifies payloads on demand, outside any Intruder attack: a payload typed in by the
 * user, or a captured response picked from the context menu.
 * Never throws: failures come back as error results.
 */
public class ManualTester {

    public static final String MANUAL_TOOL = "Manual";
    public static final String CONTEXT_MENU_TOOL = "Context Menu";
    public static final String DEFAULT_PAYLOAD = "<script>alert('xss')</script>";

    private final Verifier verifier;

    public ManualTester(Verifier verifier) {
        this.verifier = verifier;
    }

    /** Echoes {@code payload} into a minimal test page and verifies it. */
    public VerificationResult test(String url, String payload, String browser) {
        return testResponse(url, testPage(payload), payload, browser, "GET", MANUAL_TOOL, null);
    }

    /** Verifies an already captured response body against {@code payload}. */
    public VerificationResult testResponse(String url, String responseBody, String payload, String browser,
                                           String method, String tool, HttpRequestResponse requestResponse) {
        VerificationResult verdict;
        try {
            verdict = verifier.verify(url, responseBody, payload, browser);
        } catch (VerificationException e) {
            verdict = VerificationResult.error(url, payload, browser, e.getErrorType() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            verdict = VerificationResult.error(url, payload, browser, e.toString());
        }
        return verdict.toBuilder()
                .method(method)
                .tool(tool)
                .originalPayload(payload)
                .requestResponse(requestResponse)
                .build();
    }

    static String testPage(String payload) {
        return "<html><head><title>XSS Validator manual test</title></head><body>"
                + "<p>" + payload + "</p>"
                + "<div id=\"content\">" + payload + "</div>"
                + "</body></html>";
    }
}
