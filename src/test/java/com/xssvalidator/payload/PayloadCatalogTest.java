package com.xssvalidator.payload;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PayloadCatalogTest {

    @Test
    void hasEighteenDistinctPayloads() {
        List<PayloadSpec> all = PayloadCatalog.all();
        assertEquals(18, all.size());
        Set<String> texts = new HashSet<>();
        for (PayloadSpec p : all) texts.add(p.text());
        assertEquals(18, texts.size());
    }

    @Test
    void startsWithBasicAndEndsWithPolyglot() {
        List<PayloadSpec> all = PayloadCatalog.all();
        assertEquals(new PayloadSpec("<script>alert(1)</script>", PayloadCatalog.BASIC, 1), all.get(0));
        PayloadSpec last = all.get(all.size() - 1);
        assertEquals(PayloadCatalog.POLYGLOT, last.category());
        assertEquals(6, last.priority());
    }

    @Test
    void prioritiesNeverDecrease() {
        int previous = 0;
        for (PayloadSpec p : PayloadCatalog.all()) {
            assertTrue(p.priority() >= previous, "priority went down at " + p);
            previous = p.priority();
        }
    }

    @Test
    void coversEveryCategory() {
        Set<String> categories = new HashSet<>();
        for (PayloadSpec p : PayloadCatalog.all()) categories.add(p.category());
        assertEquals(Set.of(PayloadCatalog.BASIC, PayloadCatalog.JAVASCRIPT_URI, PayloadCatalog.EVENT_HANDLER,
                PayloadCatalog.TAG_BREAKING, PayloadCatalog.FILTER_BYPASS_CASE,
                PayloadCatalog.FILTER_BYPASS_ENCODING, PayloadCatalog.FILTER_BYPASS_NESTING,
                PayloadCatalog.ADVANCED_TAGS, PayloadCatalog.POLYGLOT), categories);
    }

    @Test
    void isReadOnly() {
        assertThrows(UnsupportedOperationException.class,
                () -> PayloadCatalog.all().add(new PayloadSpec("x", "y", 1)));
    }
}
