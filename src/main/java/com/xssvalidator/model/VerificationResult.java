package com.xssvalidator.model;

import burp.api.montoya.http.message.HttpRequestResponse;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one browser verification of one payload, enriched with the metadata of the
 * request and attack that produced it. Either a service verdict or an error-flagged result
 * ({@link #getError()} non-null); never both.
 */
public class VerificationResult {

    private final String url;
    private final String payload;
    private final String browser;
    private final int value;
    private final String message;
    private final boolean detected;
    private final boolean executed;
    private final Severity severity;
    private final double confidence;
    private final List<String> detectionMethods;
    private final String error;
    private final long timestamp;
    private final String method;
    private final String tool;
    private final String payloadCategory;
    private final int payloadPriority;
    private final String originalPayload;
    private final AttackMetadata attackMetadata;
    private final HttpRequestResponse requestResponse;

    private VerificationResult(Builder builder) {
        this.url = Objects.requireNonNull(builder.url, "url is required");
        this.payload = Objects.requireNonNull(builder.payload, "payload is required");
        this.browser = Objects.requireNonNull(builder.browser, "browser is required");
        this.value = builder.value;
        this.message = builder.message;
        this.detected = builder.detected;
        this.executed = builder.executed;
        this.severity = builder.severity;
        this.confidence = builder.confidence;
        this.detectionMethods = List.copyOf(builder.detectionMethods);
        this.error = builder.error;
        this.timestamp = builder.timestamp;
        this.method = builder.method;
        this.tool = builder.tool;
        this.payloadCategory = builder.payloadCategory;
        this.payloadPriority = builder.payloadPriority;
        this.originalPayload = builder.originalPayload;
        this.attackMetadata = builder.attackMetadata;
        this.requestResponse = builder.requestResponse;
    }

    public String getUrl() { return url; }
    public String getPayload() { return payload; }
    public String getBrowser() { return browser; }
    public int getValue() { return value; }
    public String getMessage() { return message; }
    public boolean isDetected() { return detected; }
    public boolean isExecuted() { return executed; }
    public Severity getSeverity() { return severity; }
    public double getConfidence() { return confidence; }
    public List<String> getDetectionMethods() { return detectionMethods; }
    public String getError() { return error; }
    public long getTimestamp() { return timestamp; }
    public String getMethod() { return method; }
    public String getTool() { return tool; }
    public String getPayloadCategory() { return payloadCategory; }
    public int getPayloadPriority() { return payloadPriority; }
    public String getOriginalPayload() { return originalPayload; }
    public AttackMetadata getAttackMetadata() { return attackMetadata; }
    public HttpRequestResponse getRequestResponse() { return requestResponse; }

    /** True when the service reported the payload as effective ({@code value > 0}). */
    public boolean isVulnerable() {
        return error == null && value > 0;
    }

    public boolean isError() {
        return error != null;
    }

    public static Builder builder(String url, String payload, String browser) {
        return new Builder(url, payload, browser);
    }

    /**
     * Error-flagged result for a verification that could not be completed.
     */
    public static VerificationResult error(String url, String payload, String browser, String error) {
        return builder(url, payload, browser)
                .error(error != null && !error.isBlank() ? error : "verification failed")
                .build();
    }

    /** Copy of this result as a builder, used to attach request and attack metadata. */
    public Builder toBuilder() {
        return new Builder(url, payload, browser)
                .value(value)
                .message(message)
                .detected(detected)
                .executed(executed)
                .severity(severity)
                .confidence(confidence)
                .detectionMethods(detectionMethods)
                .error(error)
                .timestamp(timestamp)
                .method(method)
                .tool(tool)
                .payloadCategory(payloadCategory)
                .payloadPriority(payloadPriority)
                .originalPayload(originalPayload)
                .attackMetadata(attackMetadata)
                .requestResponse(requestResponse);
    }

    @Override
    public String toString() {
        if (error != null) {
            return "[ERROR] " + browser + " " + payload + " @ " + url + ": " + error;
        }
        return "[" + severity + "] " + browser + " value=" + value + " " + payload + " @ " + url;
    }

    public static class Builder {
        private final String url;
        private final String payload;
        private final String browser;
        private int value;
        private String message = "";
        private boolean detected;
        private boolean executed;
        private Severity severity = Severity.NONE;
        private double confidence;
        private List<String> detectionMethods = List.of();
        private String error;
        private long timestamp = System.currentTimeMillis();
        private String method = "";
        private String tool = "";
        private String payloadCategory = "";
        private int payloadPriority;
        private String originalPayload = "";
        private AttackMetadata attackMetadata;
        private HttpRequestResponse requestResponse;

        private Builder(String url, String payload, String browser) {
            this.url = url;
            this.payload = payload;
            this.browser = browser;
        }

        public Builder value(int v) { this.value = v; return this; }
        public Builder message(String m) { this.message = m != null ? m : ""; return this; }
        public Builder detected(boolean d) { this.detected = d; return this; }
        public Builder executed(boolean e) { this.executed = e; return this; }
        public Builder severity(Severity s) { this.severity = s != null ? s : Severity.NONE; return this; }
        public Builder confidence(double c) { this.confidence = c; return this; }
        public Builder detectionMethods(List<String> m) { this.detectionMethods = m != null ? m : List.of(); return this; }
        public Builder error(String e) { this.error = e; return this; }
        public Builder timestamp(long t) { this.timestamp = t; return this; }
        public Builder method(String m) { this.method = m != null ? m : ""; return this; }
        public Builder tool(String t) { this.tool = t != null ? t : ""; return this; }
        public Builder payloadCategory(String c) { this.payloadCategory = c != null ? c : ""; return this; }
        public Builder payloadPriority(int p) { this.payloadPriority = p; return this; }
        public Builder originalPayload(String p) { this.originalPayload = p != null ? p : ""; return this; }
        public Builder attackMetadata(AttackMetadata m) { this.attackMetadata = m; return this; }
        public Builder requestResponse(HttpRequestResponse rr) { this.requestResponse = rr; return this; }

        public VerificationResult build() {
            return new VerificationResult(this);
        }
    }
}
