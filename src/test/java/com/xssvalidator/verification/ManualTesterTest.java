package com.xssvalidator.verification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.xssvalidator.model.VerificationResult;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ManualTesterTest {

    @Test
    void wrapsPayloadInTestPage() {
        AtomicReference<String> rendered = new AtomicReference<>();
        Verifier verifier = (url, responseBody, payload, browser) -> {
            rendered.set(responseBody);
            return VerificationResult.builder(url, payload, browser).value(1).build();
        };

        VerificationResult r = new ManualTester(verifier).test("http://manual.test/", "<svg onload=alert(1)>", "firefox");

        assertTrue(rendered.get().contains("<p><svg onload=alert(1)></p>"));
        assertTrue(rendered.get().contains("<div id=\"content\"><svg onload=alert(1)></div>"));
        assertTrue(r.isVulnerable());
        assertEquals(ManualTester.MANUAL_TOOL, r.getTool());
        assertEquals("<svg onload=alert(1)>", r.getOriginalPayload());
    }

    @Test
    void serviceFailureBecomesErrorResult() {
        Verifier down = (url, responseBody, payload, browser) -> {
            throw new VerificationException(VerificationException.ErrorType.CONNECTION_ERROR, "refused");
        };

        VerificationResult r = new ManualTester(down).test("http://manual.test/", "<b>", "chromium");

        assertTrue(r.isError());
        assertTrue(r.getError().contains("CONNECTION_ERROR"));
        assertEquals(ManualTester.MANUAL_TOOL, r.getTool());
        assertEquals("chromium", r.getBrowser());
    }

    @Test
    void capturedResponseKeepsCallerTool() {
        Verifier verifier = (url, responseBody, payload, browser) ->
                VerificationResult.builder(url, payload, browser).message(responseBody).build();

        VerificationResult r = new ManualTester(verifier).testResponse("http://t/", "<html/>",
                ManualTester.DEFAULT_PAYLOAD, "webkit", "POST", ManualTester.CONTEXT_MENU_TOOL, null);

        assertEquals("<html/>", r.getMessage());
        assertEquals("POST", r.getMethod());
        assertEquals(ManualTester.CONTEXT_MENU_TOOL, r.getTool());
    }
}
