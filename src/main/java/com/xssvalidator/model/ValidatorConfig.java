package com.xssvalidator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Extension configuration holder. The configuring side (persistence, UI) writes values
 * through {@link #update(Map)}, which validates every value before applying any of them;
 * the engine reads them through the typed getters.
 */
public class ValidatorConfig {

    public static final String SERVER_HOST = "server.host";
    public static final String SERVER_PORT = "server.port";
    public static final String DEFAULT_BROWSER = "browser.default";
    public static final String ENABLED_BROWSERS = "browser.enabled";
    public static final String TIMEOUT_SECONDS = "test.timeoutSeconds";
    public static final String CONFIDENCE_THRESHOLD = "results.confidenceThreshold";
    public static final String SHOW_ALL_RESULTS = "results.showAll";
    public static final String CORRELATION_ENABLED = "correlation.enabled";
    public static final String CORRELATION_GRACE_SECONDS = "correlation.graceSeconds";
    public static final String AUGMENTATION_ENABLED = "augmentation.enabled";
    public static final String AUGMENTATION_LIMIT = "augmentation.limit";
    public static final String MUTATION_ENABLED = "mutation.enabled";

    public static final List<String> KNOWN_BROWSERS = List.of("chromium", "firefox", "webkit");

    private static final Set<String> STRING_KEYS = Set.of(SERVER_HOST, DEFAULT_BROWSER, ENABLED_BROWSERS,
            CONFIDENCE_THRESHOLD);
    private static final Set<String> INT_KEYS = Set.of(SERVER_PORT, TIMEOUT_SECONDS, AUGMENTATION_LIMIT,
            CORRELATION_GRACE_SECONDS);
    private static final Set<String> BOOL_KEYS = Set.of(SHOW_ALL_RESULTS, CORRELATION_ENABLED,
            AUGMENTATION_ENABLED, MUTATION_ENABLED);

    private final Map<String, String> stringProps = new ConcurrentHashMap<>();
    private final Map<String, Integer> intProps = new ConcurrentHashMap<>();
    private final Map<String, Boolean> boolProps = new ConcurrentHashMap<>();

    public ValidatorConfig() {
        stringProps.put(SERVER_HOST, "127.0.0.1");
        stringProps.put(DEFAULT_BROWSER, "chromium");
        stringProps.put(ENABLED_BROWSERS, String.join(",", KNOWN_BROWSERS));
        stringProps.put(CONFIDENCE_THRESHOLD, "0.5");
        intProps.put(SERVER_PORT, 8093);
        intProps.put(TIMEOUT_SECONDS, 30);
        intProps.put(AUGMENTATION_LIMIT, 10);
        intProps.put(CORRELATION_GRACE_SECONDS, 120);
        boolProps.put(SHOW_ALL_RESULTS, false);
        boolProps.put(CORRELATION_ENABLED, true);
        boolProps.put(AUGMENTATION_ENABLED, false);
        boolProps.put(MUTATION_ENABLED, false);
    }

    /**
     * Validates and applies a set of raw textual settings. Either every entry is applied or,
     * if any entry is malformed, none is and the first problem is reported.
     *
     * @throws ConfigurationException for an unknown key or a malformed / out-of-range value
     */
    public synchronized void update(Map<String, String> raw) throws ConfigurationException {
        Map<String, String> strings = new HashMap<>();
        Map<String, Integer> ints = new HashMap<>();
        Map<String, Boolean> bools = new HashMap<>();

        for (Map.Entry<String, String> e : raw.entrySet()) {
            String key = e.getKey();
            String value = e.getValue() != null ? e.getValue().trim() : "";
            if (STRING_KEYS.contains(key)) {
                strings.put(key, validateString(key, value));
            } else if (INT_KEYS.contains(key)) {
                ints.put(key, parseInt(key, value));
            } else if (BOOL_KEYS.contains(key)) {
                bools.put(key, parseBool(key, value));
            } else {
                throw new ConfigurationException(key, "unknown setting");
            }
        }

        // The default browser has to stay among the enabled ones
        String enabled = strings.getOrDefault(ENABLED_BROWSERS, stringProps.get(ENABLED_BROWSERS));
        String defaultBrowser = strings.getOrDefault(DEFAULT_BROWSER, stringProps.get(DEFAULT_BROWSER));
        if (!splitBrowsers(enabled).contains(defaultBrowser)) {
            throw new ConfigurationException(DEFAULT_BROWSER,
                    "'" + defaultBrowser + "' is not one of the enabled browsers " + enabled);
        }

        stringProps.putAll(strings);
        intProps.putAll(ints);
        boolProps.putAll(bools);
    }

    /** Current settings as raw text, in the form accepted by {@link #update(Map)}. */
    public Map<String, String> toRawMap() {
        Map<String, String> out = new LinkedHashMap<>();
        stringProps.forEach(out::put);
        intProps.forEach((k, v) -> out.put(k, String.valueOf(v)));
        boolProps.forEach((k, v) -> out.put(k, String.valueOf(v)));
        return out;
    }

    /** All keys this configuration understands. */
    public static Set<String> knownKeys() {
        Set<String> keys = new java.util.TreeSet<>(STRING_KEYS);
        keys.addAll(INT_KEYS);
        keys.addAll(BOOL_KEYS);
        return Collections.unmodifiableSet(keys);
    }

    // ==================== Typed getters ====================

    public String getServerHost() { return stringProps.get(SERVER_HOST); }
    public int getServerPort() { return intProps.get(SERVER_PORT); }

    public String getServerBaseUrl() {
        return "http://" + getServerHost() + ":" + getServerPort();
    }

    public String getDefaultBrowser() { return stringProps.get(DEFAULT_BROWSER); }

    public List<String> getEnabledBrowsers() {
        return splitBrowsers(stringProps.get(ENABLED_BROWSERS));
    }

    public int getTimeoutSeconds() { return intProps.get(TIMEOUT_SECONDS); }

    public double getConfidenceThreshold() {
        return Double.parseDouble(stringProps.get(CONFIDENCE_THRESHOLD));
    }

    public boolean isShowAllResults() { return boolProps.get(SHOW_ALL_RESULTS); }
    public boolean isCorrelationEnabled() { return boolProps.get(CORRELATION_ENABLED); }
    public int getCorrelationGraceSeconds() { return intProps.get(CORRELATION_GRACE_SECONDS); }
    public boolean isAugmentationEnabled() { return boolProps.get(AUGMENTATION_ENABLED); }
    public int getAugmentationLimit() { return intProps.get(AUGMENTATION_LIMIT); }
    public boolean isMutationEnabled() { return boolProps.get(MUTATION_ENABLED); }

    // ==================== Validation ====================

    private static String validateString(String key, String value) throws ConfigurationException {
        switch (key) {
            case SERVER_HOST -> {
                if (value.isEmpty() || value.contains("/") || value.contains(" ")) {
                    throw new ConfigurationException(key, "host must be a bare host name or address");
                }
                return value;
            }
            case DEFAULT_BROWSER -> {
                String b = value.toLowerCase(Locale.ROOT);
                if (!KNOWN_BROWSERS.contains(b)) {
                    throw new ConfigurationException(key, "unknown browser '" + value + "'");
                }
                return b;
            }
            case ENABLED_BROWSERS -> {
                List<String> browsers = splitBrowsers(value);
                if (browsers.isEmpty()) {
                    throw new ConfigurationException(key, "at least one browser must be enabled");
                }
                for (String b : browsers) {
                    if (!KNOWN_BROWSERS.contains(b)) {
                        throw new ConfigurationException(key, "unknown browser '" + b + "'");
                    }
                }
                return String.join(",", browsers);
            }
            case CONFIDENCE_THRESHOLD -> {
                double d;
                try {
                    d = Double.parseDouble(value);
                } catch (NumberFormatException e) {
                    throw new ConfigurationException(key, "not a number: '" + value + "'", e);
                }
                if (Double.isNaN(d) || d < 0.0 || d > 1.0) {
                    throw new ConfigurationException(key, "must be between 0.0 and 1.0, was " + value);
                }
                return String.valueOf(d);
            }
            default -> throw new ConfigurationException(key, "unknown setting");
        }
    }

    private static int parseInt(String key, String value) throws ConfigurationException {
        int v;
        try {
            v = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, "not an integer: '" + value + "'", e);
        }
        int min;
        int max;
        switch (key) {
            case SERVER_PORT -> { min = 1; max = 65535; }
            case TIMEOUT_SECONDS -> { min = 1; max = 600; }
            case CORRELATION_GRACE_SECONDS -> { min = 1; max = 3600; }
            default -> { min = 1; max = 100; }
        }
        if (v < min || v > max) {
            throw new ConfigurationException(key, "must be between " + min + " and " + max + ", was " + v);
        }
        return v;
    }

    private static boolean parseBool(String key, String value) throws ConfigurationException {
        if ("true".equalsIgnoreCase(value)) return true;
        if ("false".equalsIgnoreCase(value)) return false;
        throw new ConfigurationException(key, "expected true or false, was '" + value + "'");
    }

    private static List<String> splitBrowsers(String value) {
        List<String> out = new ArrayList<>();
        if (value == null) return out;
        for (String part : value.split(",")) {
            String b = part.trim().toLowerCase(Locale.ROOT);
            if (!b.isEmpty() && !out.contains(b)) out.add(b);
        }
        return out;
    }
}
