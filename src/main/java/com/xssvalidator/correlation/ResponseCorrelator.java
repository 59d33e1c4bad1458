package com.xssvalidator.correlation;

import com.xssvalidator.framework.ResultsStore;
import com.xssvalidator.framework.VerificationExecutor;
import com.xssvalidator.model.ToolKind;
import com.xssvalidator.model.ValidatorConfig;
import com.xssvalidator.model.VerificationResult;
import com.xssvalidator.verification.VerificationException;
import com.xssvalidator.verification.Verifier;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Matches observed responses back to the payloads that caused them and has each match
 * verified in every enabled browser.
 *
 * <p>Matching entries are claimed from the {@link CorrelationTable} before any network call,
 * so a payload is verified at most once however many responses contain it. Every claimed
 * entry yields one result per browser: the service verdict or an error-flagged result.
 */
public class ResponseCorrelator {

    private final CorrelationTable table;
    private final Verifier verifier;
    private final ValidatorConfig config;
    private final ResultsStore resultsStore;
    private final VerificationExecutor executor;
    private volatile Consumer<String> logger;
    private volatile Consumer<String> errorLogger;

    public ResponseCorrelator(CorrelationTable table, Verifier verifier, ValidatorConfig config,
                              ResultsStore resultsStore, VerificationExecutor executor) {
        this.table = table;
        this.verifier = verifier;
        this.config = config;
        this.resultsStore = resultsStore;
        this.executor = executor;
    }

    public void setLogger(Consumer<String> logger) {
        this.logger = logger;
    }

    public void setErrorLogger(Consumer<String> errorLogger) {
        this.errorLogger = errorLogger;
    }

    /**
     * Processes one response event. Only Intruder traffic is correlated.
     *
     * @return the results reported for this event, empty when nothing matched
     */
    public List<VerificationResult> onResponse(ResponseEvent event) {
        if (!config.isCorrelationEnabled() || event.toolKind() != ToolKind.INTRUDER) {
            return List.of();
        }

        List<ClaimedEntry> claims = table.claim(event.rawRequest());
        if (claims.isEmpty()) return List.of();

        List<String> browsers = config.getEnabledBrowsers();
        List<CompletableFuture<VerificationResult>> pending = new ArrayList<>();
        for (ClaimedEntry claim : claims) {
            log("[Correlator] Match for attack " + claim.attackId() + ": " + claim.entry().payload()
                    + " -> verifying in " + browsers);
            for (String browser : browsers) {
                pending.add(executor.submit(() -> verifyOne(event, claim, browser)));
            }
        }

        List<VerificationResult> results = new ArrayList<>();
        for (CompletableFuture<VerificationResult> f : pending) {
            VerificationResult result = f.join();
            resultsStore.addResult(result);
            results.add(result);
        }
        return results;
    }

    private VerificationResult verifyOne(ResponseEvent event, ClaimedEntry claim, String browser) {
        CorrelationEntry entry = claim.entry();
        VerificationResult verdict;
        try {
            verdict = verifier.verify(event.url(), event.responseBody(), entry.payload(), browser);
        } catch (VerificationException e) {
            logError("[Correlator] Verification failed (" + e.getErrorType() + ") for " + entry.payload()
                    + " in " + browser + ": " + e.getMessage());
            verdict = VerificationResult.error(event.url(), entry.payload(), browser,
                    e.getErrorType() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            logError("[Correlator] Verification error for " + entry.payload() + " in " + browser + ": " + e);
            verdict = VerificationResult.error(event.url(), entry.payload(), browser, e.toString());
        }

        return verdict.toBuilder()
                .method(event.method())
                .tool(event.toolKind().displayName())
                .payloadCategory(entry.category())
                .payloadPriority(entry.priority())
                .originalPayload(entry.originalPayload())
                .attackMetadata(entry.attackMetadata())
                .requestResponse(event.requestResponse())
                .build();
    }

    private void log(String msg) {
        Consumer<String> l = logger;
        if (l != null) l.accept(msg);
    }

    private void logError(String msg) {
        Consumer<String> l = errorLogger;
        if (l != null) l.accept(msg);
    }
}
