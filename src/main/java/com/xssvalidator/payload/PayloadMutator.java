package com.xssvalidator.payload;

import com.xssvalidator.context.InjectionContext;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.function.UnaryOperator;

/**
 * Optional rewriting of a payload just before it is handed to Intruder.
 *
 * <p>{@link #select} currently always picks {@link Transform#IDENTITY}; the other transforms
 * are available for callers that choose one explicitly.
 */
public class PayloadMutator {

    public enum Transform {
        IDENTITY(s -> s),
        ESCAPE_SINGLE_QUOTES(s -> s.replace("'", "\\'")),
        ESCAPE_DOUBLE_QUOTES(s -> s.replace("\"", "\\\"")),
        HTML_ENCODE_ANGLES(s -> s.replace("<", "&lt;").replace(">", "&gt;")),
        URL_ENCODE_ANGLES(s -> s.replace("<", URLEncoder.encode("<", StandardCharsets.UTF_8))
                .replace(">", URLEncoder.encode(">", StandardCharsets.UTF_8)));

        private final UnaryOperator<String> fn;

        Transform(UnaryOperator<String> fn) { this.fn = fn; }

        public String apply(String payload) { return fn.apply(payload); }
    }

    /**
     * Picks the transform for a payload. Deterministic; the context is accepted so
     * selection can depend on it, but today the identity transform is always chosen.
     */
    public Transform select(PayloadSpec spec, InjectionContext context) {
        return Transform.IDENTITY;
    }

    public String mutate(PayloadSpec spec, InjectionContext context) {
        return select(spec, context).apply(spec.text());
    }
}
