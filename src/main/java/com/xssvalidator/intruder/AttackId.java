package com.xssvalidator.intruder;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Opaque identifier of one Intruder attack, issued when the attack starts.
 */
public record AttackId(String value) {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    public AttackId {
        if (value == null || value.isBlank()) throw new IllegalArgumentException("attack id is required");
    }

    /** Issues a new process-unique id. */
    public static AttackId next() {
        return new AttackId("attack-" + SEQUENCE.incrementAndGet());
    }

    @Override
    public String toString() {
        return value;
    }
}
