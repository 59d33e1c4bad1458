package com.xssvalidator.correlation;

import com.xssvalidator.intruder.AttackId;

/**
 * An entry removed from the {@link CorrelationTable} by a matching response.
 */
public record ClaimedEntry(AttackId attackId, CorrelationEntry entry) {
}
