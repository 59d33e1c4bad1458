package com.xssvalidator.correlation;

import com.xssvalidator.model.AttackMetadata;

/**
 * A payload handed to Intruder and not yet seen in a response.
 *
 * @param payload         exact text sent, matched as a substring of later requests
 * @param category        payload category
 * @param priority        payload priority
 * @param originalPayload payload text before mutation
 * @param baseValue       value the insertion point held in the base request
 * @param attackMetadata  attack the payload belongs to
 */
public record CorrelationEntry(String payload, String category, int priority, String originalPayload,
                               String baseValue, AttackMetadata attackMetadata) {
}
