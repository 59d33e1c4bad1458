package com.xssvalidator.framework;

import burp.api.montoya.MontoyaApi;
import burp.api.montoya.http.message.HttpRequestResponse;
import burp.api.montoya.scanner.audit.issues.AuditIssue;
import burp.api.montoya.scanner.audit.issues.AuditIssueConfidence;
import burp.api.montoya.scanner.audit.issues.AuditIssueSeverity;
import com.xssvalidator.model.Confidence;
import com.xssvalidator.model.Severity;
import com.xssvalidator.model.VerificationResult;

import java.net.URI;
import java.text.SimpleDateFormat;
import java.util.Date;

/**
 * Reports browser-verified XSS to Burp's Dashboard/Site Map.
 * Every vulnerable result that carries its request/response becomes a Burp AuditIssue
 * with the "[XSS Validator]" prefix.
 */
public class IssueReporter implements ResultsStore.ResultsListener {

    static final String ISSUE_NAME = "[XSS Validator] XSS Vulnerability (Browser Verified)";
    static final String EXECUTED_SUFFIX = " - JavaScript Executed";

    private static final String BACKGROUND =
            "Cross-site scripting vulnerabilities arise when data is copied from a request and echoed "
                    + "into the application's immediate response in an unsafe way. This issue was confirmed "
                    + "by rendering the response in a real browser engine.";
    private static final String REMEDIATION =
            "Validate input on arrival as strictly as possible and HTML-encode user-controllable data "
                    + "for the context it is written into before it is copied into responses. "
                    + "A Content-Security-Policy that forbids inline script limits the impact.";

    private final MontoyaApi api;

    public IssueReporter(MontoyaApi api) {
        this.api = api;
    }

    @Override
    public void onResultAdded(VerificationResult result) {
        if (!result.isVulnerable()) return;
        try {
            HttpRequestResponse reqResp = result.getRequestResponse();
            if (reqResp == null || reqResp.request() == null) {
                api.logging().logToOutput("[IssueReporter] Skipping (no request data): " + result);
                return;
            }

            String baseUrl = extractBaseUrl(reqResp.request().url());
            if (baseUrl.isEmpty()) {
                baseUrl = extractBaseUrl(result.getUrl());
            }
            if (baseUrl.isEmpty()) {
                api.logging().logToOutput("[IssueReporter] Skipping (no URL): " + result);
                return;
            }

            AuditIssueSeverity severity = mapSeverity(result);
            AuditIssueConfidence confidence = AuditIssueConfidence.valueOf(
                    Confidence.forResult(result).toBurpConfidence());

            AuditIssue issue = AuditIssue.auditIssue(
                    issueName(result),
                    buildDetailHtml(result),
                    null,
                    baseUrl,
                    severity,
                    confidence,
                    BACKGROUND,
                    REMEDIATION,
                    severity,
                    reqResp
            );

            api.siteMap().add(issue);
            api.logging().logToOutput("[IssueReporter] OK: " + issue.name()
                    + " [" + severity + "/" + confidence + "] @ " + baseUrl);
        } catch (Throwable t) {
            api.logging().logToError("[IssueReporter] FAILED: " + result
                    + " | " + t.getClass().getName() + ": " + t.getMessage());
        }
    }

    static String issueName(VerificationResult result) {
        return result.isExecuted() ? ISSUE_NAME + EXECUTED_SUFFIX : ISSUE_NAME;
    }

    /**
     * Uses the severity reported by the service; when the service gave none, execution
     * in the browser counts as high and a plain positive verdict as medium.
     */
    static AuditIssueSeverity mapSeverity(VerificationResult result) {
        Severity sev = result.getSeverity();
        if (sev == Severity.NONE) {
            return result.isExecuted() ? AuditIssueSeverity.HIGH : AuditIssueSeverity.MEDIUM;
        }
        return AuditIssueSeverity.valueOf(sev.toBurpSeverity());
    }

    static String buildDetailHtml(VerificationResult r) {
        StringBuilder sb = new StringBuilder();
        sb.append("<p>XSS vulnerability detected and verified by browser automation.</p>");
        sb.append("<p><b>Payload:</b> <code>").append(esc(r.getPayload())).append("</code></p>");
        if (!r.getOriginalPayload().isEmpty() && !r.getOriginalPayload().equals(r.getPayload())) {
            sb.append("<p><b>Original payload:</b> <code>").append(esc(r.getOriginalPayload())).append("</code></p>");
        }
        if (!r.getPayloadCategory().isEmpty()) {
            sb.append("<p><b>Category:</b> ").append(esc(r.getPayloadCategory()))
                    .append(" (priority ").append(r.getPayloadPriority()).append(")</p>");
        }
        sb.append("<p><b>Browser:</b> ").append(esc(r.getBrowser()))
                .append(" | <b>JavaScript executed:</b> ").append(r.isExecuted())
                .append(" | <b>Confidence:</b> ").append(String.format("%.2f", r.getConfidence())).append("</p>");
        if (!r.getDetectionMethods().isEmpty()) {
            sb.append("<p><b>Detection methods:</b> ").append(esc(String.join(", ", r.getDetectionMethods())))
                    .append("</p>");
        }
        if (!r.getMessage().isEmpty()) {
            sb.append("<p><b>Service message:</b> ").append(esc(r.getMessage())).append("</p>");
        }
        if (r.getAttackMetadata() != null) {
            sb.append("<p><b>Intruder attack:</b> ").append(esc(r.getAttackMetadata().toString())).append("</p>");
        }
        sb.append("<p><b>Verified at:</b> ")
                .append(new SimpleDateFormat("yyyy-MM-dd HH:mm:ss").format(new Date(r.getTimestamp())))
                .append("</p>");
        return sb.toString();
    }

    private static String extractBaseUrl(String fullUrl) {
        if (fullUrl == null || fullUrl.isEmpty()) return "";
        try {
            URI uri = URI.create(fullUrl);
            String scheme = uri.getScheme();
            String host = uri.getHost();
            int port = uri.getPort();
            if (scheme == null || host == null) return "";
            if (port > 0 && !isDefaultPort(scheme, port)) {
                return scheme + "://" + host + ":" + port;
            }
            return scheme + "://" + host;
        } catch (IllegalArgumentException e) {
            int schemeEnd = fullUrl.indexOf("://");
            if (schemeEnd < 0) return "";
            int pathStart = fullUrl.indexOf('/', schemeEnd + 3);
            return pathStart < 0 ? fullUrl : fullUrl.substring(0, pathStart);
        }
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }

    private static String esc(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
