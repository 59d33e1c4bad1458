package com.xssvalidator.payload;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.xssvalidator.context.CommentType;
import com.xssvalidator.context.CssPosition;
import com.xssvalidator.context.CssType;
import com.xssvalidator.context.InjectionContext;
import com.xssvalidator.context.QuoteType;
import com.xssvalidator.model.ValidatorConfig;
import com.xssvalidator.verification.VerificationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContextPayloadSynthesizerTest {

    private ValidatorConfig config;

    @BeforeEach
    void setUp() {
        config = new ValidatorConfig();
    }

    private static List<String> texts(List<PayloadSpec> specs) {
        return specs.stream().map(PayloadSpec::text).collect(Collectors.toList());
    }

    private List<String> synthesize(InjectionContext ctx) {
        return texts(new ContextPayloadSynthesizer(null, config).synthesize(ctx));
    }

    @Test
    void singleQuotedAttributeBreaksOutWithSingleQuotes() {
        List<String> out = synthesize(InjectionContext.attribute(QuoteType.SINGLE, "value", Set.of()));
        assertEquals(List.of(
                "' onmouseover='alert(1)' x='",
                "' autofocus onfocus='alert(1)' x='",
                "'><script>alert(1)</script>"), out);
    }

    @Test
    void eventHandlerAttributeGetsBareScript() {
        List<String> out = synthesize(InjectionContext.attribute(QuoteType.DOUBLE, "onclick", Set.of()));
        assertEquals(4, out.size());
        assertEquals("alert(1)", out.get(3));
        assertTrue(out.get(0).startsWith("\" onmouseover=\""));
    }

    @Test
    void hrefAttributeGetsJavascriptUri() {
        List<String> out = synthesize(InjectionContext.attribute(QuoteType.NONE, "href", Set.of()));
        assertEquals(List.of(
                " onmouseover=alert(1) ",
                " autofocus onfocus=alert(1) ",
                "><script>alert(1)</script>",
                "javascript:alert(1)"), out);
    }

    @Test
    void javascriptStringDelimiters() {
        assertEquals(List.of("\";alert(1);//", "\"+alert(1)+\""),
                synthesize(InjectionContext.javascript(QuoteType.DOUBLE, Set.of())));
        assertEquals(List.of("';alert(1);//", "'+alert(1)+'"),
                synthesize(InjectionContext.javascript(QuoteType.SINGLE, Set.of())));
        assertEquals(List.of(";alert(1);//", "</script><script>alert(1)</script>"),
                synthesize(InjectionContext.javascript(QuoteType.NONE, Set.of())));
    }

    @Test
    void singleQuotedStyleAttribute() {
        List<String> out = synthesize(
                InjectionContext.css(CssType.ATTRIBUTE, QuoteType.SINGLE, CssPosition.GENERAL));
        assertEquals("';color:expression(alert(1))//", out.get(0));
        assertEquals("'><script>alert(1)</script>", out.get(1));
        assertEquals("}body{background:url(javascript:alert(1))}", out.get(2));
    }

    @Test
    void styleBlockPropertyValue() {
        List<String> out = synthesize(
                InjectionContext.css(CssType.BLOCK, QuoteType.NONE, CssPosition.PROPERTY_VALUE));
        assertEquals(List.of(
                "</style><script>alert(1)</script>",
                "expression(alert(1))",
                "url(javascript:alert(1))"), out);
    }

    @Test
    void commentBreakouts() {
        assertEquals("--><script>alert(1)</script><!--",
                synthesize(InjectionContext.comment(CommentType.HTML)).get(0));
        assertEquals("\nalert(1);//",
                synthesize(InjectionContext.comment(CommentType.JS_SINGLE_LINE)).get(0));
        assertEquals("*/alert(1);/*",
                synthesize(InjectionContext.comment(CommentType.JS_MULTI_LINE)).get(0));
        assertEquals("*/</style><script>alert(1)</script>",
                synthesize(InjectionContext.comment(CommentType.CSS)).get(0));
    }

    @Test
    void urlContextUsesSchemes() {
        assertEquals(List.of("javascript:alert(1)", "data:text/html,<script>alert(1)</script>"),
                synthesize(InjectionContext.url()));
    }

    @Test
    void htmlContextUsesTags() {
        List<PayloadSpec> out = new ContextPayloadSynthesizer(null, config).synthesize(InjectionContext.html());
        assertEquals(3, out.size());
        for (PayloadSpec p : out) {
            assertEquals(ContextPayloadSynthesizer.HTML, p.category());
        }
    }

    @Test
    void unknownContextSynthesizesNothing() {
        assertTrue(synthesize(InjectionContext.unknown()).isEmpty());
    }

    @Test
    void augmentationFailureLeavesFixedPayloads() throws Exception {
        config.update(Map.of(ValidatorConfig.AUGMENTATION_ENABLED, "true"));
        List<String> errors = new ArrayList<>();
        PayloadAugmenter timingOut = (ctx, limit) -> {
            throw new VerificationException(VerificationException.ErrorType.TIMEOUT, "timed out");
        };
        ContextPayloadSynthesizer synthesizer = new ContextPayloadSynthesizer(timingOut, config);
        synthesizer.setErrorLogger(errors::add);

        InjectionContext ctx = InjectionContext.javascript(QuoteType.SINGLE, Set.of());
        assertEquals(ContextPayloadSynthesizer.fixedPayloads(ctx), synthesizer.synthesize(ctx));
        assertEquals(1, errors.size());
    }

    @Test
    void augmentationRuntimeFailureLeavesFixedPayloads() throws Exception {
        config.update(Map.of(ValidatorConfig.AUGMENTATION_ENABLED, "true"));
        PayloadAugmenter broken = (ctx, limit) -> {
            throw new IllegalStateException("boom");
        };
        InjectionContext ctx = InjectionContext.url();
        assertEquals(ContextPayloadSynthesizer.fixedPayloads(ctx),
                new ContextPayloadSynthesizer(broken, config).synthesize(ctx));
    }

    @Test
    void augmentedPayloadsAreTaggedAndCapped() throws Exception {
        config.update(Map.of(ValidatorConfig.AUGMENTATION_ENABLED, "true",
                ValidatorConfig.AUGMENTATION_LIMIT, "2"));
        PayloadAugmenter generous = (ctx, limit) -> List.of(
                new PayloadSpec("<a1>", "x", 9),
                new PayloadSpec("<a2>", "x", 9),
                new PayloadSpec("<a3>", "x", 9));

        List<PayloadSpec> out = new ContextPayloadSynthesizer(generous, config).synthesize(InjectionContext.url());

        assertEquals(4, out.size());
        assertEquals(new PayloadSpec("<a1>", ContextPayloadSynthesizer.SERVER_GENERATED, 5), out.get(2));
        assertEquals(new PayloadSpec("<a2>", ContextPayloadSynthesizer.SERVER_GENERATED, 5), out.get(3));
    }

    @Test
    void augmenterIsNotCalledWhenDisabled() {
        PayloadAugmenter failing = (ctx, limit) -> {
            throw new AssertionError("augmenter must not be called");
        };
        assertEquals(2, new ContextPayloadSynthesizer(failing, config).synthesize(InjectionContext.url()).size());
    }
}
