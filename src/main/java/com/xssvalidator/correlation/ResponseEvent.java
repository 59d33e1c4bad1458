package com.xssvalidator.correlation;

import burp.api.montoya.http.message.HttpRequestResponse;
import com.xssvalidator.model.ToolKind;

/**
 * One response observed by the host, with the request that produced it.
 *
 * @param requestResponse the Burp message pair, attached to results for issue reporting; may be null
 */
public record ResponseEvent(String rawRequest, String responseBody, ToolKind toolKind, String method,
                            String url, HttpRequestResponse requestResponse) {

    public ResponseEvent(String rawRequest, String responseBody, ToolKind toolKind, String method, String url) {
        this(rawRequest, responseBody, toolKind, method, url, null);
    }
}
