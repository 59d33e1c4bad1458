package com.xssvalidator.model;

import java.util.List;

/**
 * Describes the Intruder attack a payload was generated for. Attached to every
 * correlation entry and copied onto the verification results it produces.
 *
 * @param attackId        opaque attack identifier
 * @param baseUrl         URL of the attack's base request
 * @param insertionPoints number of insertion points in the base request
 * @param contexts        short labels of the distinct contexts analyzed, in insertion-point order
 */
public record AttackMetadata(String attackId, String baseUrl, int insertionPoints, List<String> contexts) {

    public AttackMetadata {
        contexts = contexts == null ? List.of() : List.copyOf(contexts);
    }

    @Override
    public String toString() {
        return attackId + " " + baseUrl + " (" + insertionPoints + " point(s), contexts=" + contexts + ")";
    }
}
