package com.xssvalidator.payload;

import com.xssvalidator.context.InjectionContext;
import com.xssvalidator.verification.VerificationException;

import java.util.List;

/**
 * Source of additional payloads for a context, typically a remote generation service.
 */
public interface PayloadAugmenter {

    /**
     * @return at most {@code limit} payloads suited to {@code context}
     * @throws VerificationException if the service cannot be reached or answers malformed data
     */
    List<PayloadSpec> fetch(InjectionContext context, int limit) throws VerificationException;
}
