package com.xssvalidator.intruder;

/**
 * Helpers for raw HTTP request text.
 */
public final class RequestUtil {

    private RequestUtil() {}

    /**
     * URL of a raw request built from its request line and Host header, without the query
     * string. Absolute-form request targets are returned as-is minus the query.
     * Returns an empty string when the request line cannot be read.
     */
    public static String baseUrl(String rawRequest) {
        if (rawRequest == null || rawRequest.isEmpty()) return "";
        int lineEnd = rawRequest.indexOf('\n');
        String requestLine = (lineEnd >= 0 ? rawRequest.substring(0, lineEnd) : rawRequest).trim();
        String[] parts = requestLine.split(" ");
        if (parts.length < 2) return "";

        String target = stripQuery(parts[1]);
        if (target.startsWith("http://") || target.startsWith("https://")) {
            return target;
        }
        String host = header(rawRequest, "Host");
        if (host.isEmpty()) return target;
        return "http://" + host + target;
    }

    /** HTTP method from the request line, or an empty string. */
    public static String method(String rawRequest) {
        if (rawRequest == null) return "";
        int space = rawRequest.indexOf(' ');
        return space > 0 ? rawRequest.substring(0, space).trim() : "";
    }

    /** Value of the first header with the given name (case-insensitive), or an empty string. */
    public static String header(String rawRequest, String name) {
        String[] lines = rawRequest.split("\r?\n");
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isEmpty()) break;
            int colon = line.indexOf(':');
            if (colon > 0 && line.substring(0, colon).trim().equalsIgnoreCase(name)) {
                return line.substring(colon + 1).trim();
            }
        }
        return "";
    }

    private static String stripQuery(String target) {
        int q = target.indexOf('?');
        return q >= 0 ? target.substring(0, q) : target;
    }
}
