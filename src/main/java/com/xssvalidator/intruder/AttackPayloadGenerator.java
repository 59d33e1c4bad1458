package com.xssvalidator.intruder;

import com.xssvalidator.context.ContextClassifier;
import com.xssvalidator.correlation.CorrelationEntry;
import com.xssvalidator.correlation.CorrelationTable;
import com.xssvalidator.model.AttackMetadata;
import com.xssvalidator.model.ValidatorConfig;
import com.xssvalidator.payload.ContextPayloadSynthesizer;
import com.xssvalidator.payload.PayloadMutator;
import com.xssvalidator.payload.PayloadSpec;

import java.util.List;
import java.util.function.Consumer;

/**
 * Per-attack payload sequencer driven by Intruder.
 *
 * <p>The base request is analyzed on first use and again on every {@link #reset()}. Each
 * {@link #next(String)} hands out the payload under the cursor and records it in the
 * {@link CorrelationTable} so the response it provokes can be matched later. Recording
 * replaces any pending entry with the same literal payload text for this attack. Handing
 * out the last payload marks the attack completed in the table.
 *
 * <p>All protocol methods are synchronized; Intruder may call them from several threads.
 */
public class AttackPayloadGenerator {

    public enum State { CREATED, READY, EMITTING, EXHAUSTED }

    private final AttackId attackId;
    private final String baseRequest;
    private final List<InsertionPoint> insertionPoints;
    private final ContextClassifier classifier;
    private final ContextPayloadSynthesizer synthesizer;
    private final PayloadMutator mutator;
    private final CorrelationTable table;
    private final ValidatorConfig config;
    private volatile Consumer<String> logger;
    private volatile Consumer<String> errorLogger;

    private AttackSession session;
    private int cursor;
    private State state = State.CREATED;

    public AttackPayloadGenerator(AttackId attackId, String baseRequest, List<InsertionPoint> insertionPoints,
                                  ContextClassifier classifier, ContextPayloadSynthesizer synthesizer,
                                  PayloadMutator mutator, CorrelationTable table, ValidatorConfig config) {
        this.attackId = attackId;
        this.baseRequest = baseRequest != null ? baseRequest : "";
        this.insertionPoints = List.copyOf(insertionPoints);
        this.classifier = classifier;
        this.synthesizer = synthesizer;
        this.mutator = mutator;
        this.table = table;
        this.config = config;
    }

    public void setLogger(Consumer<String> logger) {
        this.logger = logger;
    }

    public void setErrorLogger(Consumer<String> errorLogger) {
        this.errorLogger = errorLogger;
    }

    public synchronized boolean hasNext() {
        ensureAnalyzed();
        return cursor < session.size();
    }

    /**
     * Returns the next payload, with its text mutated when mutation is enabled, or null
     * once every payload has been emitted.
     */
    public synchronized PayloadSpec next(String baseValue) {
        ensureAnalyzed();
        if (cursor >= session.size()) {
            exhaust();
            return null;
        }

        AttackSession.QueuedPayload item = session.queue().get(cursor++);
        PayloadSpec spec = item.spec();
        String text = config.isMutationEnabled() ? mutator.mutate(spec, item.context()) : spec.text();

        table.put(attackId, new CorrelationEntry(text, spec.category(), spec.priority(), spec.text(),
                baseValue != null ? baseValue : "", session.metadata()));

        if (cursor >= session.size()) {
            exhaust();
        } else {
            state = State.EMITTING;
        }
        return new PayloadSpec(text, spec.category(), spec.priority());
    }

    // The attack's entries become prunable once the grace period after this passes
    private void exhaust() {
        if (state != State.EXHAUSTED) {
            state = State.EXHAUSTED;
            table.markCompleted(attackId);
        }
    }

    /**
     * Re-analyzes the base request and rewinds the cursor. Payloads already recorded in
     * the correlation table stay pending.
     */
    public synchronized void reset() {
        analyze();
    }

    /** Forgets every pending payload of this attack. */
    public void discard() {
        table.removeAttack(attackId);
    }

    public synchronized State state() {
        return state;
    }

    public synchronized AttackMetadata metadata() {
        ensureAnalyzed();
        return session.metadata();
    }

    public synchronized int size() {
        ensureAnalyzed();
        return session.size();
    }

    public synchronized int contextPayloadCount() {
        ensureAnalyzed();
        return session.contextPayloadCount();
    }

    public AttackId attackId() {
        return attackId;
    }

    private void ensureAnalyzed() {
        if (state == State.CREATED) {
            analyze();
        }
    }

    private void analyze() {
        session = AttackSession.analyze(attackId, baseRequest, insertionPoints, classifier, synthesizer,
                errorLogger);
        cursor = 0;
        state = State.READY;

        Consumer<String> log = logger;
        if (log != null) {
            log.accept("[Generator] Attack " + attackId + " on " + session.metadata().baseUrl() + ": "
                    + insertionPoints.size() + " insertion point(s), contexts " + session.metadata().contexts()
                    + ", " + session.contextPayloadCount() + " context + "
                    + (session.size() - session.contextPayloadCount()) + " catalog payloads");
        }
    }
}
