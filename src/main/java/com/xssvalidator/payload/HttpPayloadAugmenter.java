package com.xssvalidator.payload;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.xssvalidator.context.Encoding;
import com.xssvalidator.context.InjectionContext;
import com.xssvalidator.model.ValidatorConfig;
import com.xssvalidator.verification.VerificationException;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches extra payloads for a context from the verification server's
 * {@code POST /generate-payloads} endpoint.
 */
public class HttpPayloadAugmenter implements PayloadAugmenter {

    private static final Gson GSON = new Gson();

    private final HttpClient httpClient;
    private final ValidatorConfig config;

    public HttpPayloadAugmenter(ValidatorConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public List<PayloadSpec> fetch(InjectionContext context, int limit) throws VerificationException {
        JsonObject body = new JsonObject();
        body.add("context", serialize(context));
        body.addProperty("limit", limit);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.getServerBaseUrl() + "/generate-payloads"))
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(GSON.toJson(body), StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new VerificationException(VerificationException.ErrorType.TIMEOUT,
                    "Payload generation timed out after " + config.getTimeoutSeconds() + "s", e);
        } catch (java.io.IOException e) {
            throw new VerificationException(VerificationException.ErrorType.CONNECTION_ERROR,
                    "Payload generation request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VerificationException(VerificationException.ErrorType.TIMEOUT,
                    "Payload generation interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new VerificationException(VerificationException.ErrorType.HTTP_ERROR,
                    "Payload generation returned HTTP " + response.statusCode());
        }
        return parsePayloads(response.body(), limit);
    }

    static JsonObject serialize(InjectionContext ctx) {
        JsonObject json = new JsonObject();
        json.addProperty("type", ctx.kind().wireName());
        if (ctx.commentType() != null) json.addProperty("commentType", ctx.commentType().wireName());
        if (ctx.cssType() != null) json.addProperty("cssType", ctx.cssType().wireName());
        if (ctx.quoteType() != null) json.addProperty("quoteType", ctx.quoteType().wireName());
        if (ctx.position() != null) json.addProperty("position", ctx.position().wireName());
        if (ctx.attributeName() != null) json.addProperty("attributeName", ctx.attributeName());
        if (ctx.stringDelimiter() != null) json.addProperty("stringDelimiter", ctx.stringDelimiter().wireName());
        JsonArray encodings = new JsonArray();
        for (Encoding e : ctx.encodings()) encodings.add(e.wireName());
        json.add("encodings", encodings);
        return json;
    }

    static List<PayloadSpec> parsePayloads(String body, int limit) throws VerificationException {
        try {
            JsonObject root = JsonParser.parseString(body).getAsJsonObject();
            JsonElement arr = root.get("payloads");
            List<PayloadSpec> out = new ArrayList<>();
            if (arr == null || !arr.isJsonArray()) return out;
            for (JsonElement el : arr.getAsJsonArray()) {
                if (out.size() >= limit) break;
                if (!el.isJsonObject()) continue;
                JsonObject item = el.getAsJsonObject();
                JsonElement text = item.get("payload");
                if (text == null || text.isJsonNull() || text.getAsString().isBlank()) continue;
                int priority = item.has("priority") && !item.get("priority").isJsonNull()
                        ? item.get("priority").getAsInt() : ContextPayloadSynthesizer.SERVER_GENERATED_PRIORITY;
                out.add(new PayloadSpec(text.getAsString(), ContextPayloadSynthesizer.SERVER_GENERATED, priority));
            }
            return out;
        } catch (RuntimeException e) {
            throw new VerificationException(VerificationException.ErrorType.PARSE_ERROR,
                    "Malformed payload generation response: " + e.getMessage(), e);
        }
    }
}
