package com.xssvalidator.payload;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.xssvalidator.context.InjectionContext;
import com.xssvalidator.context.QuoteType;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PayloadMutatorTest {

    private final PayloadMutator mutator = new PayloadMutator();

    @Test
    void selectionIsAlwaysIdentity() {
        PayloadSpec spec = new PayloadSpec("'><script>alert(1)</script>", "context_attribute", 2);
        InjectionContext ctx = InjectionContext.attribute(QuoteType.SINGLE, "value", Set.of());

        assertEquals(PayloadMutator.Transform.IDENTITY, mutator.select(spec, ctx));
        assertEquals(spec.text(), mutator.mutate(spec, ctx));
        assertEquals(spec.text(), mutator.mutate(spec, null));
    }

    @Test
    void transformsRewriteAsNamed() {
        String p = "<a href='x' title=\"y\">";
        assertEquals("<a href=\\'x\\' title=\"y\">", PayloadMutator.Transform.ESCAPE_SINGLE_QUOTES.apply(p));
        assertEquals("<a href='x' title=\\\"y\\\">", PayloadMutator.Transform.ESCAPE_DOUBLE_QUOTES.apply(p));
        assertEquals("&lt;a href='x' title=\"y\"&gt;", PayloadMutator.Transform.HTML_ENCODE_ANGLES.apply(p));
        assertEquals("%3Ca href='x' title=\"y\"%3E", PayloadMutator.Transform.URL_ENCODE_ANGLES.apply(p));
    }
}
