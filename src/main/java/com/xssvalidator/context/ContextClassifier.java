package com.xssvalidator.context;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies the textual context around an injection span of a raw request.
 *
 * <p>Only a window of {@link #WINDOW} characters on each side of the span is inspected.
 * Checks run in a fixed order and the first match wins: comment, CSS, attribute,
 * JavaScript, URL, then plain HTML. Classification never throws; any internal failure
 * yields {@link InjectionContext#unknown()}.
 */
public class ContextClassifier {

    public static final int WINDOW = 100;

    private static final Pattern STYLE_ATTRIBUTE =
            Pattern.compile("(?i)style\\s*=\\s*([\"']?)[^\"'<>]*$");

    // <tag ... name=  followed by an optional opening quote and a value with no closing quote
    private static final Pattern OPEN_ATTRIBUTE = Pattern.compile(
            "<[a-zA-Z][^<>]*?\\s([\\w:.-]+)\\s*=\\s*(?:\"[^\"]*|'[^']*|[^\\s\"'<>]*)$");

    private static final Pattern CSS_HINT = Pattern.compile(
            "(?i)[{}:;]|style|\\.[a-z_-][\\w-]*|#[a-z_-][\\w-]*|color|background|font|margin|padding");

    private static final Pattern URL_ENCODED = Pattern.compile("%[0-9a-fA-F]{2}");
    private static final Pattern HTML_ENTITY = Pattern.compile("(?i)&(#\\d+|#x[0-9a-f]+|[a-z]+);");
    private static final Pattern UNICODE_ESCAPE = Pattern.compile("(?i)\\\\u[0-9a-f]{4}|\\\\x[0-9a-f]{2}");
    private static final Pattern BASE64_TOKEN = Pattern.compile("[A-Za-z0-9+/]{16,}={0,2}");

    private static final String[] URL_ATTRIBUTES = {"href=", "src=", "action=", "data="};

    private volatile Consumer<String> errorLogger;

    public void setErrorLogger(Consumer<String> errorLogger) {
        this.errorLogger = errorLogger;
    }

    /**
     * Classifies the span {@code [start, end)} of {@code requestText}.
     * Out-of-range or inverted offsets are clamped to the text.
     */
    public InjectionContext classify(String requestText, int start, int end) {
        try {
            int len = requestText.length();
            int s = Math.max(0, Math.min(start, len));
            int e = Math.max(s, Math.min(end, len));
            String before = requestText.substring(Math.max(0, s - WINDOW), s);
            String after = requestText.substring(e, Math.min(len, e + WINDOW));
            return classifyWindow(before, after);
        } catch (RuntimeException ex) {
            Consumer<String> log = errorLogger;
            if (log != null) {
                log.accept("[Classifier] Context analysis failed at " + start + "-" + end + ": " + ex);
            }
            return InjectionContext.unknown();
        }
    }

    /** Classifies directly from the text before and after the injection point. */
    InjectionContext classifyWindow(String before, String after) {
        String beforeLower = before.toLowerCase(Locale.ROOT);
        String afterLower = after.toLowerCase(Locale.ROOT);

        // 1. Comments
        if (before.contains("<!--") && after.contains("-->")) {
            return InjectionContext.comment(CommentType.HTML);
        }
        if (before.contains("//") && after.contains("\n")) {
            return InjectionContext.comment(CommentType.JS_SINGLE_LINE);
        }
        if (before.contains("/*") && after.contains("*/")) {
            return InjectionContext.comment(
                    looksLikeCss(before + after) ? CommentType.CSS : CommentType.JS_MULTI_LINE);
        }

        // 2. CSS
        boolean styleAttribute = STYLE_ATTRIBUTE.matcher(before).find();
        boolean styleBlock = beforeLower.contains("<style") && afterLower.contains("</style");
        if (styleAttribute || styleBlock || looksLikeCss(before + after)) {
            return InjectionContext.css(
                    styleAttribute ? CssType.ATTRIBUTE : CssType.BLOCK,
                    QuoteType.trailing(before),
                    cssPosition(before));
        }

        // 3. Attribute value
        Matcher attr = OPEN_ATTRIBUTE.matcher(before);
        if (attr.find()) {
            return InjectionContext.attribute(QuoteType.trailing(before), attr.group(1),
                    detectEncodings(before + after));
        }

        // 4. JavaScript
        if (beforeLower.lastIndexOf("<script") > beforeLower.lastIndexOf("</script")
                || beforeLower.contains("javascript:")) {
            return InjectionContext.javascript(QuoteType.trailing(before), detectEncodings(before + after));
        }

        // 5. URL-bearing attribute
        for (String marker : URL_ATTRIBUTES) {
            if (beforeLower.contains(marker)) {
                return InjectionContext.url();
            }
        }

        return InjectionContext.html();
    }

    static boolean looksLikeCss(String text) {
        return CSS_HINT.matcher(text).find();
    }

    static CssPosition cssPosition(String before) {
        int brace = before.lastIndexOf('{');
        String declaration = brace >= 0 ? before.substring(brace + 1) : before;
        int colon = declaration.lastIndexOf(':');
        if (colon >= 0 && declaration.indexOf(';', colon) < 0) {
            return CssPosition.PROPERTY_VALUE;
        }
        return CssPosition.GENERAL;
    }

    static Set<Encoding> detectEncodings(String text) {
        Set<Encoding> found = EnumSet.noneOf(Encoding.class);
        if (URL_ENCODED.matcher(text).find()) found.add(Encoding.URL);
        if (HTML_ENTITY.matcher(text).find()) found.add(Encoding.HTML_ENTITY);
        if (UNICODE_ESCAPE.matcher(text).find()) found.add(Encoding.UNICODE);
        Matcher b64 = BASE64_TOKEN.matcher(text);
        while (b64.find()) {
            if (b64.group().length() % 4 == 0) {
                found.add(Encoding.BASE64);
                break;
            }
        }
        return found;
    }
}
