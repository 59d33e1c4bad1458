package com.xssvalidator.intruder;

import burp.api.montoya.intruder.GeneratedPayload;
import burp.api.montoya.intruder.IntruderInsertionPoint;
import burp.api.montoya.intruder.PayloadGenerator;
import com.xssvalidator.payload.PayloadSpec;

/**
 * Burp side of an {@link AttackPayloadGenerator}: one instance per Intruder attack.
 */
public class XssPayloadGenerator implements PayloadGenerator {

    private final AttackPayloadGenerator generator;

    public XssPayloadGenerator(AttackPayloadGenerator generator) {
        this.generator = generator;
    }

    @Override
    public GeneratedPayload generatePayloadFor(IntruderInsertionPoint insertionPoint) {
        String baseValue = insertionPoint != null && insertionPoint.baseValue() != null
                ? insertionPoint.baseValue().toString() : "";
        PayloadSpec next = generator.next(baseValue);
        if (next == null) {
            return GeneratedPayload.end();
        }
        return GeneratedPayload.payload(next.text());
    }
}
