package com.xssvalidator.verification;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.xssvalidator.model.Severity;
import com.xssvalidator.model.ValidatorConfig;
import com.xssvalidator.model.VerificationResult;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Client for the browser verification service.
 * Uses Java 17's built-in java.net.http.HttpClient for transport and Gson for parsing.
 *
 * Server address and request timeout are read from {@link ValidatorConfig} on every call,
 * so configuration changes apply without rebuilding the client.
 * Thread-safe: single shared HttpClient instance, no mutable state.
 */
public class HttpVerificationClient implements Verifier {

    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ValidatorConfig config;

    public HttpVerificationClient(ValidatorConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .build();
    }

    @Override
    public VerificationResult verify(String url, String responseBody, String payload, String browser)
            throws VerificationException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("http-response", base64(responseBody));
        form.put("http-url", base64(url));
        form.put("http-headers", base64(""));
        form.put("payload", payload);
        form.put("browser", browser);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.getServerBaseUrl() + "/"))
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("User-Agent", "Burp XSS Validator Extension")
                .POST(HttpRequest.BodyPublishers.ofString(formEncode(form), StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response = send(request);
        int status = response.statusCode();
        if (status == 503) {
            throw new VerificationException(VerificationException.ErrorType.SERVER_BUSY,
                    "Verification server at capacity (HTTP 503): " + truncate(response.body(), 200));
        }
        // 200 = XSS found, 201 = no XSS found; both carry a verdict
        if (status != 200 && status != 201) {
            throw new VerificationException(VerificationException.ErrorType.HTTP_ERROR,
                    "Verification server returned HTTP " + status + ": " + truncate(response.body(), 300));
        }
        return parseVerdict(response.body(), url, payload, browser);
    }

    /**
     * Queries {@code GET /health}.
     *
     * @throws VerificationException if the service is unreachable or reports a non-healthy status
     */
    public HealthStatus checkHealth() throws VerificationException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.getServerBaseUrl() + "/health"))
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .GET()
                .build();

        HttpResponse<String> response = send(request);
        if (response.statusCode() != 200) {
            throw new VerificationException(VerificationException.ErrorType.HTTP_ERROR,
                    "Health check returned HTTP " + response.statusCode());
        }

        HealthStatus health;
        try {
            JsonObject root = JsonParser.parseString(response.body()).getAsJsonObject();
            health = new HealthStatus(
                    getStr(root, "status"),
                    getStrList(root, "availableBrowsers"),
                    root.has("uptime") ? root.get("uptime").getAsDouble() : 0.0,
                    root.has("activeRequests") ? root.get("activeRequests").getAsInt() : 0);
        } catch (RuntimeException e) {
            throw new VerificationException(VerificationException.ErrorType.PARSE_ERROR,
                    "Malformed health response: " + e.getMessage() + " | body snippet: "
                            + truncate(response.body(), 200), e);
        }
        if (!health.isHealthy()) {
            throw new VerificationException(VerificationException.ErrorType.HTTP_ERROR,
                    "Verification server reports status '" + health.status() + "'");
        }
        return health;
    }

    private HttpResponse<String> send(HttpRequest request) throws VerificationException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new VerificationException(VerificationException.ErrorType.TIMEOUT,
                    "Verification request timed out after " + config.getTimeoutSeconds() + "s", e);
        } catch (java.io.IOException e) {
            throw new VerificationException(VerificationException.ErrorType.CONNECTION_ERROR,
                    "Cannot reach verification server at " + config.getServerBaseUrl() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VerificationException(VerificationException.ErrorType.TIMEOUT,
                    "Verification request interrupted", e);
        }
    }

    static VerificationResult parseVerdict(String body, String url, String payload, String browser)
            throws VerificationException {
        try {
            JsonObject root = JsonParser.parseString(body).getAsJsonObject();
            VerificationResult.Builder builder = VerificationResult.builder(url, payload, browser)
                    .value(root.has("value") && !root.get("value").isJsonNull() ? root.get("value").getAsInt() : 0)
                    .message(getStr(root, "msg"))
                    .timestamp(System.currentTimeMillis());

            JsonElement enhancedEl = root.get("enhanced");
            if (enhancedEl != null && enhancedEl.isJsonObject()) {
                JsonObject enhanced = enhancedEl.getAsJsonObject();
                builder.detected(getBool(enhanced, "detected"))
                        .executed(getBool(enhanced, "executed"))
                        .severity(Severity.fromString(getStr(enhanced, "severity")))
                        .confidence(enhanced.has("confidence") && !enhanced.get("confidence").isJsonNull()
                                ? enhanced.get("confidence").getAsDouble() : 0.0)
                        .detectionMethods(getStrList(enhanced, "detectionMethods"));
            } else {
                builder.severity(Severity.NONE).confidence(0.0);
            }
            return builder.build();
        } catch (RuntimeException e) {
            throw new VerificationException(VerificationException.ErrorType.PARSE_ERROR,
                    "Failed to parse verification response: " + e.getMessage()
                            + " | body snippet: " + truncate(body, 200), e);
        }
    }

    private static String formEncode(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue() != null ? e.getValue() : "", StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    private static String base64(String s) {
        return Base64.getEncoder().encodeToString((s != null ? s : "").getBytes(StandardCharsets.UTF_8));
    }

    private static String getStr(JsonObject obj, String key) {
        JsonElement el = obj.get(key);
        return (el != null && !el.isJsonNull()) ? el.getAsString() : "";
    }

    private static boolean getBool(JsonObject obj, String key) {
        JsonElement el = obj.get(key);
        return el != null && !el.isJsonNull() && el.getAsBoolean();
    }

    private static List<String> getStrList(JsonObject obj, String key) {
        List<String> out = new ArrayList<>();
        JsonElement el = obj.get(key);
        if (el != null && el.isJsonArray()) {
            JsonArray arr = el.getAsJsonArray();
            for (JsonElement item : arr) {
                if (item != null && !item.isJsonNull()) out.add(item.getAsString());
            }
        }
        return out;
    }

    private static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() > max ? s.substring(0, max) + "..." : s;
    }
}
