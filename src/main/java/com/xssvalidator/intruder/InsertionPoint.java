package com.xssvalidator.intruder;

/**
 * Character span {@code [start, end)} of the base request that Intruder replaces with payloads.
 */
public record InsertionPoint(int start, int end) {

    public InsertionPoint {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid insertion point " + start + "-" + end);
        }
    }
}
