package com.xssvalidator.correlation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.xssvalidator.intruder.AttackId;
import com.xssvalidator.model.AttackMetadata;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CorrelationTableTest {

    private static final AttackId A = new AttackId("A");
    private static final AttackId B = new AttackId("B");

    private CorrelationTable table;

    @BeforeEach
    void setUp() {
        table = new CorrelationTable();
    }

    private static CorrelationEntry entry(String payload, String category) {
        return new CorrelationEntry(payload, category, 1, payload, "base",
                new AttackMetadata("A", "http://t/", 1, List.of("html")));
    }

    @Test
    void claimRemovesMatchedEntry() {
        table.put(A, entry("<p1>", "basic"));
        table.put(A, entry("<p2>", "basic"));

        List<ClaimedEntry> claimed = table.claim("GET /?q=<p1> HTTP/1.1");

        assertEquals(1, claimed.size());
        assertEquals(A, claimed.get(0).attackId());
        assertEquals("<p1>", claimed.get(0).entry().payload());
        assertNull(table.get(A, "<p1>"));
        assertEquals(1, table.pendingCount(A));
    }

    @Test
    void secondClaimOfSamePayloadFindsNothing() {
        table.put(A, entry("<p1>", "basic"));
        table.put(A, entry("<p9>", "basic"));

        assertEquals(1, table.claim("x=<p1>").size());
        assertTrue(table.claim("x=<p1>").isEmpty());
    }

    @Test
    void atMostOneClaimPerAttackPerRequest() {
        table.put(A, entry("<p1>", "basic"));
        table.put(A, entry("<p2>", "basic"));
        table.put(B, entry("<p3>", "basic"));

        List<ClaimedEntry> claimed = table.claim("<p1><p2><p3>");

        assertEquals(2, claimed.size());
        assertEquals(1, table.pendingCount(A));
        assertFalse(table.containsAttack(B));
    }

    @Test
    void attackIsPrunedWhenLastPayloadMatched() {
        table.put(A, entry("<p1>", "basic"));
        table.put(A, entry("<p2>", "basic"));

        table.claim("<p1>");
        assertTrue(table.containsAttack(A));
        table.claim("<p2>");
        assertFalse(table.containsAttack(A));
        assertTrue(table.attackIds().isEmpty());
    }

    @Test
    void samePayloadOverwritesWithinAttack() {
        assertNull(table.put(A, entry("<p1>", "context_html")));
        CorrelationEntry replaced = table.put(A, entry("<p1>", "basic"));

        assertEquals("context_html", replaced.category());
        assertEquals(1, table.pendingCount(A));
        assertEquals("basic", table.get(A, "<p1>").category());
    }

    @Test
    void samePayloadInDifferentAttacksIsTrackedSeparately() {
        table.put(A, entry("<p1>", "basic"));
        table.put(B, entry("<p1>", "basic"));

        assertEquals(2, table.claim("<p1>").size());
    }

    @Test
    void emptyOrMissingRequestClaimsNothing() {
        table.put(A, entry("<p1>", "basic"));
        assertTrue(table.claim("").isEmpty());
        assertTrue(table.claim(null).isEmpty());
        assertEquals(1, table.pendingCount(A));
    }

    @Test
    void longestContainedPayloadIsClaimedFirst() {
        table.put(A, entry("<script>alert(1)</script>", "basic"));
        table.put(A, entry("\"><script>alert(1)</script>", "tag_breaking"));

        List<ClaimedEntry> claimed = table.claim("GET /?q=\"><script>alert(1)</script> HTTP/1.1");

        assertEquals(1, claimed.size());
        assertEquals("tag_breaking", claimed.get(0).entry().category());
        assertEquals(1, table.pendingCount(A));
        assertEquals("basic", table.claim("q=<script>alert(1)</script>").get(0).entry().category());
    }

    @Test
    void equalLengthMatchesGoToTheEarliestRecorded() {
        table.put(A, entry("<a1>", "first"));
        table.put(A, entry("<a2>", "second"));

        assertEquals("first", table.claim("<a2><a1>").get(0).entry().category());
    }

    @Test
    void completedAttackIsPrunedAfterGracePeriod() {
        AtomicLong now = new AtomicLong(1_000);
        CorrelationTable timed = new CorrelationTable(now::get);
        timed.put(A, entry("<p1>", "basic"));
        timed.markCompleted(A);
        assertTrue(timed.isCompleted(A));

        now.addAndGet(59_999);
        assertTrue(timed.pruneExpired(60_000, 3_600_000).isEmpty());
        assertEquals(1, timed.pendingCount(A));

        now.addAndGet(1);
        assertEquals(List.of(A), timed.pruneExpired(60_000, 3_600_000));
        assertFalse(timed.containsAttack(A));
        assertTrue(timed.claim("<p1>").isEmpty());
    }

    @Test
    void runningAttackIsKeptUntilIdleTimeout() {
        AtomicLong now = new AtomicLong(0);
        CorrelationTable timed = new CorrelationTable(now::get);
        timed.put(A, entry("<p1>", "basic"));
        timed.put(B, entry("<p2>", "basic"));
        timed.markCompleted(B);

        now.set(120_000);
        assertEquals(List.of(B), timed.pruneExpired(60_000, 600_000));
        assertTrue(timed.containsAttack(A));

        now.set(600_000);
        assertEquals(List.of(A), timed.pruneExpired(60_000, 600_000));
        assertTrue(timed.attackIds().isEmpty());
    }

    @Test
    void emittingAgainReopensCompletedAttack() {
        AtomicLong now = new AtomicLong(0);
        CorrelationTable timed = new CorrelationTable(now::get);
        timed.put(A, entry("<p1>", "basic"));
        timed.markCompleted(A);

        now.set(50_000);
        timed.put(A, entry("<p2>", "basic"));
        assertFalse(timed.isCompleted(A));

        now.set(200_000);
        assertTrue(timed.pruneExpired(60_000, 600_000).isEmpty());
        assertEquals(2, timed.pendingCount(A));
    }

    @Test
    void removeAttackDropsEverything() {
        table.put(A, entry("<p1>", "basic"));
        table.removeAttack(A);
        assertEquals(0, table.pendingCount(A));
        assertTrue(table.claim("<p1>").isEmpty());
    }

    @Test
    void concurrentClaimsConsumeEntryOnce() throws Exception {
        int threads = 16;
        for (int round = 0; round < 50; round++) {
            table.put(A, entry("<race>", "basic"));
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger claims = new AtomicInteger();
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    claims.addAndGet(table.claim("q=<race>").size());
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(5, TimeUnit.SECONDS);
            pool.shutdown();

            assertEquals(1, claims.get(), "round " + round);
            assertFalse(table.containsAttack(A));
        }
    }

    @Test
    void concurrentWritersAndClaimersLoseNothing() throws Exception {
        int payloads = 500;
        List<String> claimed = Collections.synchronizedList(new ArrayList<>());
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch written = new CountDownLatch(payloads);

        pool.submit(() -> {
            for (int i = 0; i < payloads; i++) {
                table.put(A, entry("<w" + i + ">", "basic"));
                written.countDown();
            }
        });
        List<Future<?>> claimers = new ArrayList<>();
        for (int t = 0; t < 3; t++) {
            claimers.add(pool.submit(() -> {
                for (int i = 0; i < payloads; i++) {
                    for (ClaimedEntry c : table.claim("<w" + i + ">")) {
                        claimed.add(c.entry().payload());
                    }
                }
            }));
        }
        assertTrue(written.await(5, TimeUnit.SECONDS));
        for (Future<?> f : claimers) f.get(10, TimeUnit.SECONDS);
        pool.shutdown();

        // Whatever was not claimed is still pending; nothing was claimed twice
        int pending = table.pendingCount(A);
        assertEquals(payloads, claimed.size() + pending);
        assertEquals(claimed.size(), claimed.stream().distinct().count());
    }
}
