package com.xssvalidator.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Classified surroundings of an injection point. Exactly one {@link ContextKind} is set;
 * the remaining fields are only populated for the kinds that use them and are null
 * otherwise. Structural equality lets callers deduplicate contexts across insertion points.
 *
 * <ul>
 *   <li>COMMENT: {@code commentType}</li>
 *   <li>CSS: {@code cssType}, {@code quoteType}, {@code position}</li>
 *   <li>ATTRIBUTE: {@code quoteType}, {@code attributeName}, {@code encodings}</li>
 *   <li>JAVASCRIPT: {@code stringDelimiter}, {@code encodings}</li>
 * </ul>
 */
public record InjectionContext(
        ContextKind kind,
        CommentType commentType,
        CssType cssType,
        QuoteType quoteType,
        CssPosition position,
        String attributeName,
        QuoteType stringDelimiter,
        Set<Encoding> encodings) {

    private static final InjectionContext UNKNOWN = new InjectionContext(
            ContextKind.UNKNOWN, null, null, null, null, null, null, Set.of());
    private static final InjectionContext HTML = new InjectionContext(
            ContextKind.HTML, null, null, null, null, null, null, Set.of());
    private static final InjectionContext URL = new InjectionContext(
            ContextKind.URL, null, null, null, null, null, null, Set.of());

    public InjectionContext {
        if (kind == null) throw new IllegalArgumentException("kind is required");
        encodings = encodings == null || encodings.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(encodings));
    }

    public static InjectionContext unknown() { return UNKNOWN; }

    public static InjectionContext html() { return HTML; }

    public static InjectionContext url() { return URL; }

    public static InjectionContext comment(CommentType type) {
        return new InjectionContext(ContextKind.COMMENT, type, null, null, null, null, null, Set.of());
    }

    public static InjectionContext css(CssType type, QuoteType quote, CssPosition position) {
        return new InjectionContext(ContextKind.CSS, null, type, quote, position, null, null, Set.of());
    }

    public static InjectionContext attribute(QuoteType quote, String attributeName, Set<Encoding> encodings) {
        return new InjectionContext(ContextKind.ATTRIBUTE, null, null, quote, null, attributeName, null, encodings);
    }

    public static InjectionContext javascript(QuoteType delimiter, Set<Encoding> encodings) {
        return new InjectionContext(ContextKind.JAVASCRIPT, null, null, null, null, null, delimiter, encodings);
    }

    /** Short label for logs, e.g. {@code attribute(single,value)}. */
    public String describe() {
        List<String> parts = new ArrayList<>();
        if (commentType != null) parts.add(commentType.wireName());
        if (cssType != null) parts.add(cssType.wireName());
        if (quoteType != null) parts.add(quoteType.wireName());
        if (position != null) parts.add(position.wireName());
        if (attributeName != null) parts.add(attributeName);
        if (stringDelimiter != null) parts.add(stringDelimiter.wireName());
        for (Encoding e : encodings) parts.add(e.wireName());
        return parts.isEmpty() ? kind.wireName() : kind.wireName() + "(" + String.join(",", parts) + ")";
    }
}
