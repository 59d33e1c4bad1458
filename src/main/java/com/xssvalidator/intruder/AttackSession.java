package com.xssvalidator.intruder;

import com.xssvalidator.context.ContextClassifier;
import com.xssvalidator.context.InjectionContext;
import com.xssvalidator.model.AttackMetadata;
import com.xssvalidator.payload.ContextPayloadSynthesizer;
import com.xssvalidator.payload.PayloadCatalog;
import com.xssvalidator.payload.PayloadSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Analysis of one attack: the distinct contexts of its insertion points and the ordered
 * emission queue built from them (context payloads first, then the catalog).
 * Immutable once built.
 */
public final class AttackSession {

    /**
     * One queued payload with the context it was synthesized for (null for catalog payloads).
     */
    public record QueuedPayload(PayloadSpec spec, InjectionContext context) {}

    private final AttackMetadata metadata;
    private final List<InjectionContext> contexts;
    private final List<QueuedPayload> queue;
    private final int contextPayloadCount;

    private AttackSession(AttackMetadata metadata, List<InjectionContext> contexts,
                          List<QueuedPayload> queue, int contextPayloadCount) {
        this.metadata = metadata;
        this.contexts = contexts;
        this.queue = queue;
        this.contextPayloadCount = contextPayloadCount;
    }

    /**
     * Classifies every insertion point, synthesizes payloads once per distinct context and
     * appends the catalog. A failure on one point is logged and that point contributes no
     * context payloads.
     */
    static AttackSession analyze(AttackId attackId, String baseRequest, List<InsertionPoint> points,
                                 ContextClassifier classifier, ContextPayloadSynthesizer synthesizer,
                                 Consumer<String> errorLogger) {
        Set<InjectionContext> distinct = new LinkedHashSet<>();
        List<QueuedPayload> queue = new ArrayList<>();

        for (InsertionPoint point : points) {
            try {
                InjectionContext ctx = classifier.classify(baseRequest, point.start(), point.end());
                if (!distinct.add(ctx)) continue;
                for (PayloadSpec spec : synthesizer.synthesize(ctx)) {
                    queue.add(new QueuedPayload(spec, ctx));
                }
            } catch (RuntimeException e) {
                if (errorLogger != null) {
                    errorLogger.accept("[Generator] Context analysis failed for " + attackId + " at "
                            + point.start() + "-" + point.end() + ": " + e);
                }
            }
        }
        int contextPayloadCount = queue.size();
        for (PayloadSpec spec : PayloadCatalog.all()) {
            queue.add(new QueuedPayload(spec, null));
        }

        List<String> labels = new ArrayList<>();
        for (InjectionContext ctx : distinct) labels.add(ctx.describe());
        AttackMetadata metadata = new AttackMetadata(attackId.value(), RequestUtil.baseUrl(baseRequest),
                points.size(), labels);

        return new AttackSession(metadata, List.copyOf(distinct), Collections.unmodifiableList(queue),
                contextPayloadCount);
    }

    public AttackMetadata metadata() { return metadata; }

    /** Distinct contexts in insertion-point order. */
    public List<InjectionContext> contexts() { return contexts; }

    public List<QueuedPayload> queue() { return queue; }

    public int contextPayloadCount() { return contextPayloadCount; }

    public int size() { return queue.size(); }
}
