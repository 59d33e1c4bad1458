package com.xssvalidator.intruder;

import burp.api.montoya.MontoyaApi;
import burp.api.montoya.core.Range;
import burp.api.montoya.intruder.AttackConfiguration;
import burp.api.montoya.intruder.HttpRequestTemplate;
import burp.api.montoya.intruder.PayloadGenerator;
import burp.api.montoya.intruder.PayloadGeneratorProvider;
import com.xssvalidator.context.ContextClassifier;
import com.xssvalidator.correlation.CorrelationTable;
import com.xssvalidator.model.ValidatorConfig;
import com.xssvalidator.payload.ContextPayloadSynthesizer;
import com.xssvalidator.payload.PayloadMutator;

import java.util.ArrayList;
import java.util.List;

/**
 * Registers the "XSS Validator" payload source in Intruder and creates one generator per attack.
 */
public class XssPayloadGeneratorProvider implements PayloadGeneratorProvider {

    public static final String DISPLAY_NAME = "XSS Validator Payloads";

    private final MontoyaApi api;
    private final ContextClassifier classifier;
    private final ContextPayloadSynthesizer synthesizer;
    private final PayloadMutator mutator;
    private final CorrelationTable table;
    private final ValidatorConfig config;

    public XssPayloadGeneratorProvider(MontoyaApi api, ContextClassifier classifier,
                                       ContextPayloadSynthesizer synthesizer, PayloadMutator mutator,
                                       CorrelationTable table, ValidatorConfig config) {
        this.api = api;
        this.classifier = classifier;
        this.synthesizer = synthesizer;
        this.mutator = mutator;
        this.table = table;
        this.config = config;
    }

    @Override
    public String displayName() {
        return DISPLAY_NAME;
    }

    @Override
    public PayloadGenerator providePayloadGenerator(AttackConfiguration attackConfiguration) {
        String baseRequest = "";
        List<InsertionPoint> points = new ArrayList<>();
        HttpRequestTemplate template = attackConfiguration != null ? attackConfiguration.requestTemplate() : null;
        if (template != null) {
            baseRequest = template.content().toString();
            for (Range range : template.insertionPointOffsets()) {
                points.add(new InsertionPoint(range.startIndexInclusive(), range.endIndexExclusive()));
            }
        }

        AttackPayloadGenerator generator = new AttackPayloadGenerator(AttackId.next(), baseRequest, points,
                classifier, synthesizer, mutator, table, config);
        generator.setLogger(msg -> api.logging().logToOutput(msg));
        generator.setErrorLogger(msg -> api.logging().logToError(msg));
        return new XssPayloadGenerator(generator);
    }
}
