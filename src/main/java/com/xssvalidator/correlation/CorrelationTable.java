package com.xssvalidator.correlation;

import com.xssvalidator.intruder.AttackId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Pending payloads per attack, shared by the payload generators (writers) and the response
 * correlator (claimer).
 *
 * <p>Each attack's state is only read or changed inside a {@code compute*} call on that
 * attack's key, so the lookup, removal and pruning done by {@link #claim} are atomic per
 * attack while other attacks proceed without contention. An attack whose map becomes
 * empty is removed in the same step.
 *
 * <p>Attacks also leave the table through {@link #pruneExpired}: once completed and past
 * the grace period, or when nothing has been emitted or claimed for too long.
 */
public class CorrelationTable {

    private static final class PendingAttack {
        final Map<String, CorrelationEntry> payloads = new LinkedHashMap<>();
        long lastActivity;
        boolean completed;
    }

    private final ConcurrentHashMap<AttackId, PendingAttack> attacks = new ConcurrentHashMap<>();
    private final LongSupplier clock;

    public CorrelationTable() {
        this(System::currentTimeMillis);
    }

    /** @param clock millisecond time source */
    public CorrelationTable(LongSupplier clock) {
        this.clock = clock;
    }

    /**
     * Records an emitted payload. An existing entry for the same literal payload in the same
     * attack is replaced. Emitting reopens an attack previously marked completed.
     *
     * @return the replaced entry, or null
     */
    public CorrelationEntry put(AttackId attackId, CorrelationEntry entry) {
        CorrelationEntry[] previous = new CorrelationEntry[1];
        attacks.compute(attackId, (id, pending) -> {
            PendingAttack attack = pending != null ? pending : new PendingAttack();
            previous[0] = attack.payloads.put(entry.payload(), entry);
            attack.lastActivity = clock.getAsLong();
            attack.completed = false;
            return attack;
        });
        return previous[0];
    }

    /**
     * Removes and returns, for every attack, the pending payload that occurs as a literal
     * substring of {@code rawRequest}. When several of an attack's payloads occur, the longest
     * wins (earliest recorded on a tie), so a payload embedded in a longer one is not claimed
     * by the longer one's request. At most one entry per attack is claimed per call, and an
     * entry can only ever be claimed once.
     */
    public List<ClaimedEntry> claim(String rawRequest) {
        List<ClaimedEntry> claimed = new ArrayList<>();
        if (rawRequest == null || rawRequest.isEmpty()) return claimed;

        for (AttackId attackId : attacks.keySet()) {
            attacks.computeIfPresent(attackId, (id, attack) -> {
                CorrelationEntry best = null;
                for (CorrelationEntry entry : attack.payloads.values()) {
                    if ((best == null || entry.payload().length() > best.payload().length())
                            && rawRequest.contains(entry.payload())) {
                        best = entry;
                    }
                }
                if (best == null) return attack;

                attack.payloads.remove(best.payload());
                attack.lastActivity = clock.getAsLong();
                claimed.add(new ClaimedEntry(id, best));
                return attack.payloads.isEmpty() ? null : attack;
            });
        }
        return claimed;
    }

    /**
     * Marks an attack as having emitted its last payload. Its remaining entries stay
     * claimable until {@link #pruneExpired} drops them after the grace period.
     */
    public void markCompleted(AttackId attackId) {
        attacks.computeIfPresent(attackId, (id, attack) -> {
            if (!attack.completed) {
                attack.completed = true;
                attack.lastActivity = clock.getAsLong();
            }
            return attack;
        });
    }

    /**
     * Drops completed attacks idle for at least {@code graceMillis}, and any attack idle for
     * at least {@code idleMillis} (an attack stopped before its last payload is never marked
     * completed).
     *
     * @return the attacks removed
     */
    public List<AttackId> pruneExpired(long graceMillis, long idleMillis) {
        long now = clock.getAsLong();
        List<AttackId> removed = new ArrayList<>();
        for (AttackId attackId : attacks.keySet()) {
            attacks.computeIfPresent(attackId, (id, attack) -> {
                long idle = now - attack.lastActivity;
                if ((attack.completed && idle >= graceMillis) || idle >= idleMillis) {
                    removed.add(id);
                    return null;
                }
                return attack;
            });
        }
        return removed;
    }

    /** Drops every pending payload of an attack. */
    public void removeAttack(AttackId attackId) {
        attacks.remove(attackId);
    }

    public boolean containsAttack(AttackId attackId) {
        return attacks.containsKey(attackId);
    }

    public boolean isCompleted(AttackId attackId) {
        boolean[] completed = new boolean[1];
        attacks.computeIfPresent(attackId, (id, attack) -> {
            completed[0] = attack.completed;
            return attack;
        });
        return completed[0];
    }

    /** Pending entry for a payload, or null. */
    public CorrelationEntry get(AttackId attackId, String payload) {
        CorrelationEntry[] found = new CorrelationEntry[1];
        attacks.computeIfPresent(attackId, (id, attack) -> {
            found[0] = attack.payloads.get(payload);
            return attack;
        });
        return found[0];
    }

    public int pendingCount(AttackId attackId) {
        int[] count = new int[1];
        attacks.computeIfPresent(attackId, (id, attack) -> {
            count[0] = attack.payloads.size();
            return attack;
        });
        return count[0];
    }

    public Set<AttackId> attackIds() {
        return Set.copyOf(attacks.keySet());
    }
}
