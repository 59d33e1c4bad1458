package com.xssvalidator.context;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContextClassifierTest {

    private static final String MARK = "XSSMARK";

    private ContextClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ContextClassifier();
    }

    /** Classifies {@code before + MARK + after} at the span of the marker. */
    private InjectionContext around(String before, String after) {
        String text = before + MARK + after;
        return classifier.classify(text, before.length(), before.length() + MARK.length());
    }

    @Test
    void singleQuotedAttributeValue() {
        InjectionContext ctx = around("<input value='", "'>");
        assertEquals(InjectionContext.attribute(QuoteType.SINGLE, "value", Set.of()), ctx);
    }

    @Test
    void doubleQuotedAttributeValue() {
        InjectionContext ctx = around("<a title=\"", "\">");
        assertEquals(ContextKind.ATTRIBUTE, ctx.kind());
        assertEquals(QuoteType.DOUBLE, ctx.quoteType());
        assertEquals("title", ctx.attributeName());
    }

    @Test
    void unquotedAttributeValue() {
        InjectionContext ctx = around("<input value=", ">");
        assertEquals(ContextKind.ATTRIBUTE, ctx.kind());
        assertEquals(QuoteType.NONE, ctx.quoteType());
        assertEquals("value", ctx.attributeName());
    }

    @Test
    void attributeNameIsTheLastOneOpened() {
        InjectionContext ctx = around("<input type=\"text\" name='", "'>");
        assertEquals("name", ctx.attributeName());
        assertEquals(QuoteType.SINGLE, ctx.quoteType());
    }

    @Test
    void attributeReportsUrlEncodingNearby() {
        InjectionContext ctx = around("<input value=\"%3Cb%3E", "\">");
        assertEquals(ContextKind.ATTRIBUTE, ctx.kind());
        assertEquals(QuoteType.NONE, ctx.quoteType());
        assertEquals(Set.of(Encoding.URL), ctx.encodings());
    }

    @Test
    void partlyTypedSingleQuotedValueHasNoTrailingQuote() {
        InjectionContext ctx = around("<input value='abc", "'>");
        assertEquals(InjectionContext.attribute(QuoteType.NONE, "value", Set.of()), ctx);
    }

    @Test
    void partlyTypedDoubleQuotedValueHasNoTrailingQuote() {
        InjectionContext ctx = around("<a title=\"hello ", "\">");
        assertEquals(ContextKind.ATTRIBUTE, ctx.kind());
        assertEquals("title", ctx.attributeName());
        assertEquals(QuoteType.NONE, ctx.quoteType());
    }

    @Test
    void htmlCommentWinsOverOpenScript() {
        InjectionContext ctx = around("<script>var a=1<!-- ", " -->");
        assertEquals(InjectionContext.comment(CommentType.HTML), ctx);
    }

    @Test
    void jsSingleLineComment() {
        InjectionContext ctx = around("<script>// note ", "\n</script>");
        assertEquals(InjectionContext.comment(CommentType.JS_SINGLE_LINE), ctx);
    }

    @Test
    void jsMultiLineComment() {
        InjectionContext ctx = around("<script>/* ", " */</script>");
        assertEquals(InjectionContext.comment(CommentType.JS_MULTI_LINE), ctx);
    }

    @Test
    void blockCommentInsideStylesheetIsCssComment() {
        InjectionContext ctx = around("<style>/* ", " */ body{}</style>");
        assertEquals(InjectionContext.comment(CommentType.CSS), ctx);
    }

    @Test
    void styleAttributeStart() {
        InjectionContext ctx = around("<div style=\"", "\">");
        assertEquals(InjectionContext.css(CssType.ATTRIBUTE, QuoteType.DOUBLE, CssPosition.GENERAL), ctx);
    }

    @Test
    void styleAttributePropertyValue() {
        InjectionContext ctx = around("<div style=\"color:", "\">");
        assertEquals(InjectionContext.css(CssType.ATTRIBUTE, QuoteType.NONE, CssPosition.PROPERTY_VALUE), ctx);
    }

    @Test
    void styleBlockPropertyValue() {
        InjectionContext ctx = around("<style>body{color:", "}</style>");
        assertEquals(InjectionContext.css(CssType.BLOCK, QuoteType.NONE, CssPosition.PROPERTY_VALUE), ctx);
    }

    @Test
    void styleBlockAfterCompletedDeclaration() {
        InjectionContext ctx = around("<style>body{color:red;", "}</style>");
        assertEquals(CssPosition.GENERAL, ctx.position());
    }

    @Test
    void colonInWindowReadsAsCss() {
        // Any CSS punctuation in the window is enough, e.g. a header separator
        InjectionContext ctx = around("GET /?q=", " HTTP/1.1\r\nHost: example.com");
        assertEquals(ContextKind.CSS, ctx.kind());
        assertEquals(CssType.BLOCK, ctx.cssType());
    }

    @Test
    void openScriptWithDoubleQuotedString() {
        InjectionContext ctx = around("<script>x=\"", "\"</script>");
        assertEquals(InjectionContext.javascript(QuoteType.DOUBLE, Set.of()), ctx);
    }

    @Test
    void openScriptWithSingleQuotedString() {
        InjectionContext ctx = around("<script>x='", "'</script>");
        assertEquals(QuoteType.SINGLE, ctx.stringDelimiter());
    }

    @Test
    void closedScriptIsNotJavaScript() {
        InjectionContext ctx = around("<script>x=1</script><b>", "</b>");
        assertEquals(ContextKind.HTML, ctx.kind());
    }

    @Test
    void urlAttributeOutsideOpenTag() {
        InjectionContext ctx = around("<a href=foo>", "</a>");
        assertEquals(InjectionContext.url(), ctx);
    }

    @Test
    void plainMarkupIsHtml() {
        assertEquals(InjectionContext.html(), around("<div>", "</div>"));
    }

    @Test
    void onlyInspectsHundredCharactersEachSide() {
        String before = "<!--" + "x".repeat(ContextClassifier.WINDOW);
        InjectionContext ctx = around(before, "-->");
        assertEquals(ContextKind.HTML, ctx.kind());
    }

    @Test
    void classificationIsDeterministic() {
        String text = "<p><input value='" + MARK + "'></p>";
        InjectionContext first = classifier.classify(text, 17, 17 + MARK.length());
        for (int i = 0; i < 10; i++) {
            assertEquals(first, classifier.classify(text, 17, 17 + MARK.length()));
        }
    }

    @Test
    void internalFailureYieldsUnknown() {
        List<String> errors = new ArrayList<>();
        classifier.setErrorLogger(errors::add);

        InjectionContext ctx = classifier.classify(null, 0, 5);

        assertEquals(InjectionContext.unknown(), ctx);
        assertEquals(1, errors.size());
    }

    @Test
    void outOfRangeOffsetsAreClamped() {
        InjectionContext ctx = classifier.classify("<div>", -10, 500);
        assertEquals(ContextKind.HTML, ctx.kind());
    }

    @Test
    void detectsAllEncodingsTogether() {
        Set<Encoding> found = ContextClassifier.detectEncodings(
                "%3C &lt; \\u003c dGhpcyBpcyBhIHRlc3Q=");
        assertEquals(Set.of(Encoding.URL, Encoding.HTML_ENTITY, Encoding.UNICODE, Encoding.BASE64), found);
    }

    @Test
    void shortTokensAreNotBase64() {
        assertTrue(ContextClassifier.detectEncodings("abcdefgh").isEmpty());
    }

    @Test
    void describeListsTheContextFields() {
        assertEquals("attribute(single,value)",
                InjectionContext.attribute(QuoteType.SINGLE, "value", Set.of()).describe());
        assertEquals("html", InjectionContext.html().describe());
    }
}
