package com.acme.deeptree.ledger.memory;

import com.acme.deeptree.ledger.telemetry.LedgerEvent;
import com.acme.deeptree.ledger.telemetry.LedgerEventBus;
import com.acme.deeptree.ledger.telemetry.LedgerStats;
import com.acme.deeptree.ledger.util.LedgerStatusCodes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BudgetedAllocationLedgerTest {
    private static final long IDLE_MS = 300_000L;

    // Strong references so payloads die only when a test destroys them.
    private final List<TestPayload> owners = new ArrayList<>();
    private final ManualLedgerClock clock = new ManualLedgerClock(1_000L);
    private final RecordingListener listener = new RecordingListener();
    private BudgetedAllocationLedger ledger;

    @AfterEach
    void tearDown() {
        if (ledger != null) {
            ledger.close();
        }
    }

    private BudgetedAllocationLedger newLedger(long budgetBytes) {
        LedgerConfig config = LedgerConfig.defaults()
            .withMaxBudgetBytes(budgetBytes)
            .withIdleThresholdMillis(IDLE_MS);
        ledger = new BudgetedAllocationLedger(config, clock, PayloadHandles.standard());
        ledger.subscribe(listener);
        return ledger;
    }

    private TestPayload payload(String name) {
        TestPayload p = new TestPayload(name);
        owners.add(p);
        return p;
    }

    @Test
    void shouldFailWhenNoRecordIsEvictable() {
        newLedger(1000);
        ledger.allocate("x", 600, payload("x"), 1);
        ledger.access("x");

        InsufficientBudgetException e = assertThrows(InsufficientBudgetException.class,
            () -> ledger.allocate("y", 500, payload("y"), 1));

        assertEquals(LedgerStatusCodes.INSUFFICIENT_STORAGE, e.reasonCode());
        assertEquals("y", e.id());
        assertTrue(ledger.contains("x"));
        assertFalse(ledger.contains("y"));
        assertEquals(600L, ledger.getStats().totalAllocated());
        assertEquals(1, listener.eventsOf(LedgerEvent.AllocationFailed.class).size());
    }

    @Test
    void shouldEvictIdleLowTierRecordToAdmitNewOne() {
        newLedger(1000);
        ledger.allocate("x", 600, payload("x"), 0);
        clock.advance(IDLE_MS + 1);

        ledger.allocate("y", 500, payload("y"), 1);

        assertThrows(RecordNotFoundException.class, () -> ledger.access("x"));
        assertEquals(500L, ledger.getStats().totalAllocated());
        assertEquals(List.of(new LedgerEvent.Freed("x", 600)), listener.eventsOf(LedgerEvent.Freed.class));
        assertEquals(new LedgerEvent.Allocated("y", 500), listener.events().get(listener.events().size() - 1));
    }

    @Test
    void shouldNotEvictRecordIdleExactlyAtThreshold() {
        newLedger(1000);
        ledger.allocate("x", 600, payload("x"), 0);
        clock.advance(IDLE_MS);

        assertThrows(InsufficientBudgetException.class, () -> ledger.allocate("y", 500, payload("y")));
        assertTrue(ledger.contains("x"));
    }

    @Test
    void shouldDropDeadRecordsOnSweep() {
        newLedger(10_000);
        TestPayload a = payload("a");
        TestPayload b = payload("b");
        TestPayload c = payload("c");
        ledger.allocate("a", 100, a, 1);
        ledger.allocate("b", 200, b, 2);
        ledger.allocate("c", 300, c, 0);
        ledger.allocate("live", 400, payload("live"), 1);
        assertEquals(4, ledger.getStats().blockCount());

        a.destroy();
        b.destroy();
        c.destroy();
        long freed = ledger.sweep();

        assertEquals(600L, freed);
        LedgerStats stats = ledger.getStats();
        assertEquals(1, stats.blockCount());
        assertEquals(400L, stats.totalAllocated());
        assertEquals(List.of(new LedgerEvent.SweepComplete(600)), listener.eventsOf(LedgerEvent.SweepComplete.class));
    }

    @Test
    void sweepShouldStayQuietWhenEverythingIsAlive() {
        newLedger(1000);
        ledger.allocate("a", 100, payload("a"));

        assertEquals(0L, ledger.sweep());
        assertTrue(listener.eventsOf(LedgerEvent.SweepComplete.class).isEmpty());
        assertEquals(1, ledger.getStats().blockCount());
    }

    @Test
    void shouldEvictLowestTierOldestFirstAndNeverProtectedTier() {
        newLedger(1000);
        clock.set(0);
        ledger.allocate("t0-old", 100, payload("t0-old"), 0);
        ledger.allocate("t2", 100, payload("t2"), 2);
        clock.set(5);
        ledger.allocate("t1", 100, payload("t1"), 1);
        clock.set(10);
        ledger.allocate("t0-new", 100, payload("t0-new"), 0);
        clock.set(10 + IDLE_MS + 1);

        assertEquals(100L, ledger.freeUpSpace(100));
        assertFalse(ledger.contains("t0-old"));
        assertTrue(ledger.contains("t0-new"));
        assertTrue(ledger.contains("t1"));

        InsufficientBudgetException e = assertThrows(InsufficientBudgetException.class, () -> ledger.freeUpSpace(250));
        assertNull(e.id());
        assertEquals(200L, e.freedBytes());
        // Partial eviction is not rolled back.
        assertFalse(ledger.contains("t0-new"));
        assertFalse(ledger.contains("t1"));
        assertTrue(ledger.contains("t2"));

        List<String> freedIds = new ArrayList<>();
        for (LedgerEvent.Freed freed : listener.eventsOf(LedgerEvent.Freed.class)) {
            freedIds.add(freed.id());
        }
        assertEquals(List.of("t0-old", "t0-new", "t1"), freedIds);
    }

    @Test
    void shouldReclaimDeadRecordsFirstEvenWhenProtected() {
        newLedger(1000);
        TestPayload guarded = payload("guarded");
        ledger.allocate("guarded", 700, guarded, 5);
        guarded.destroy();

        ledger.allocate("next", 500, payload("next"), 1);

        assertFalse(ledger.contains("guarded"));
        assertTrue(ledger.contains("next"));
        assertTrue(listener.eventsOf(LedgerEvent.Freed.class).isEmpty());
    }

    @Test
    void shouldRejectRequestLargerThanBudgetWithoutEvicting() {
        newLedger(1000);
        ledger.allocate("idle", 300, payload("idle"), 0);
        clock.advance(IDLE_MS + 1);

        assertThrows(InsufficientBudgetException.class, () -> ledger.allocate("huge", 1001, payload("huge")));
        assertTrue(ledger.contains("idle"));
    }

    @Test
    void accessShouldReturnPayloadAndRefreshRecency() {
        newLedger(1000);
        TestPayload p = payload("p");
        ledger.allocate("p", 600, p, 0);
        clock.advance(IDLE_MS + 1);

        assertSame(p, ledger.access("p", TestPayload.class));
        assertThrows(InsufficientBudgetException.class, () -> ledger.allocate("q", 500, payload("q")));
        assertTrue(ledger.contains("p"));
    }

    @Test
    void accessShouldReportReclaimedAndDropRecord() {
        newLedger(1000);
        TestPayload p = payload("p");
        ledger.allocate("p", 100, p);
        ledger.allocate("q", 100, payload("q"));
        p.destroy();

        PayloadReclaimedException e = assertThrows(PayloadReclaimedException.class, () -> ledger.access("p"));
        assertEquals(LedgerStatusCodes.GONE, e.reasonCode());
        assertEquals(1, ledger.getStats().blockCount());
        assertThrows(RecordNotFoundException.class, () -> ledger.access("p"));
    }

    @Test
    void accessShouldReportNotFoundForUnknownId() {
        newLedger(1000);
        RecordNotFoundException e = assertThrows(RecordNotFoundException.class, () -> ledger.access("nope"));
        assertEquals(LedgerStatusCodes.NOT_FOUND, e.reasonCode());
    }

    @Test
    void releaseShouldReturnSizeAndEmitEvent() {
        newLedger(1000);
        ledger.allocate("a", 250, payload("a"));

        assertEquals(250L, ledger.release("a"));
        assertFalse(ledger.contains("a"));
        assertEquals(0L, ledger.getStats().totalAllocated());
        assertEquals(List.of(new LedgerEvent.Released("a", 250)), listener.eventsOf(LedgerEvent.Released.class));
        assertThrows(RecordNotFoundException.class, () -> ledger.release("a"));
    }

    @Test
    void reallocatingSameIdShouldReplaceRecord() {
        newLedger(1000);
        ledger.allocate("a", 600, payload("a1"), 1);
        TestPayload second = payload("a2");

        ledger.allocate("a", 700, second, 2);

        LedgerStats stats = ledger.getStats();
        assertEquals(1, stats.blockCount());
        assertEquals(700L, stats.totalAllocated());
        assertSame(second, ledger.access("a"));
        assertEquals(List.of(new LedgerEvent.Released("a", 600)), listener.eventsOf(LedgerEvent.Released.class));
    }

    @Test
    void failedReallocationShouldKeepExistingRecord() {
        newLedger(1000);
        TestPayload first = payload("a1");
        ledger.allocate("a", 600, first, 2);
        ledger.allocate("b", 300, payload("b"), 2);

        assertThrows(InsufficientBudgetException.class, () -> ledger.allocate("a", 800, payload("a2"), 1));
        assertThrows(InsufficientBudgetException.class, () -> ledger.allocate("a", 2000, payload("a3"), 1));

        LedgerStats stats = ledger.getStats();
        assertEquals(2, stats.blockCount());
        assertEquals(900L, stats.totalAllocated());
        assertSame(first, ledger.access("a"));
        assertTrue(listener.eventsOf(LedgerEvent.Released.class).isEmpty());
        assertEquals(2, listener.eventsOf(LedgerEvent.AllocationFailed.class).size());
    }

    @Test
    void reallocationShouldCountReplacedBytesAsFree() {
        newLedger(1000);
        ledger.allocate("a", 600, payload("a1"), 2);
        ledger.allocate("b", 300, payload("b"), 2);

        ledger.allocate("a", 700, payload("a2"), 2);

        assertEquals(1000L, ledger.getStats().totalAllocated());
        assertTrue(ledger.contains("b"));
        assertTrue(listener.eventsOf(LedgerEvent.Freed.class).isEmpty());
        assertEquals(List.of(new LedgerEvent.Released("a", 600)), listener.eventsOf(LedgerEvent.Released.class));
    }

    @Test
    void shouldReclaimRecordWithoutSweepOnceCollected() throws InterruptedException {
        newLedger(1000);
        ledger.allocate("kept", 100, payload("kept"), 1);
        allocateUnreferenced("transient", 300);

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (listener.eventsOf(LedgerEvent.Reclaimed.class).isEmpty() && System.nanoTime() < deadline) {
            System.gc();
            Thread.sleep(20);
        }

        assertEquals(List.of(new LedgerEvent.Reclaimed("transient", 300)),
            listener.eventsOf(LedgerEvent.Reclaimed.class));
        assertFalse(ledger.contains("transient"));
        assertEquals(100L, ledger.getStats().totalAllocated());
        assertTrue(listener.eventsOf(LedgerEvent.SweepComplete.class).isEmpty());
    }

    private void allocateUnreferenced(String id, long sizeBytes) {
        ledger.allocate(id, sizeBytes, new StringBuilder(id), 1);
    }

    @Test
    void shouldRejectInvalidArguments() {
        newLedger(1000);
        assertThrows(IllegalArgumentException.class, () -> ledger.allocate(" ", 10, payload("a")));
        assertThrows(IllegalArgumentException.class, () -> ledger.allocate("a", 0, payload("a")));
        assertThrows(IllegalArgumentException.class, () -> ledger.allocate("a", 10, payload("a"), -1));
        assertEquals(0, ledger.getStats().blockCount());
    }

    @Test
    void statsShouldBeIdempotentAndZeroWhenEmpty() {
        newLedger(1000);
        LedgerStats empty = ledger.getStats();
        assertEquals(new LedgerStats(0, 0, 0, 0.0d, 0.0d), empty);

        ledger.allocate("a", 200, payload("a"));
        ledger.allocate("b", 300, payload("b"));
        ledger.reportUsage("b", 100);

        LedgerStats first = ledger.getStats();
        LedgerStats second = ledger.getStats();
        assertEquals(first, second);
        assertEquals(500L, first.totalAllocated());
        assertEquals(300L, first.totalUsed());
        assertEquals(0.4d, first.fragmentationRatio(), 1e-9);
        assertEquals(0.3d, first.averageUtilization(), 1e-9);
    }

    @Test
    void reportUsageShouldValidateBounds() {
        newLedger(1000);
        ledger.allocate("a", 200, payload("a"));

        assertThrows(IllegalArgumentException.class, () -> ledger.reportUsage("a", 201));
        assertThrows(IllegalArgumentException.class, () -> ledger.reportUsage("a", -1));
        assertThrows(RecordNotFoundException.class, () -> ledger.reportUsage("missing", 1));
        assertEquals(200L, ledger.getStats().totalUsed());
    }

    @Test
    void defragmentShouldBeNoOpBelowThreshold() {
        newLedger(1000);
        ledger.allocate("a", 500, payload("a"), 0);
        ledger.allocate("b", 500, payload("b"), 2);
        ledger.reportUsage("a", 450);
        LedgerStats before = ledger.getStats();
        listener.clear();

        assertFalse(ledger.defragment());

        assertEquals(before, ledger.getStats());
        assertTrue(listener.events().isEmpty());
    }

    @Test
    void defragmentShouldRebuildFromLiveRecordsHighestTierFirst() {
        newLedger(1000);
        TestPayload dead = payload("dead");
        ledger.allocate("low", 400, payload("low"), 0);
        ledger.allocate("high", 300, payload("high"), 3);
        ledger.allocate("dead", 100, dead, 1);
        ledger.reportUsage("low", 100);
        dead.destroy();
        listener.clear();

        assertTrue(ledger.defragment());

        LedgerStats after = ledger.getStats();
        assertEquals(2, after.blockCount());
        assertEquals(700L, after.totalAllocated());
        assertEquals(700L, after.totalUsed());
        assertEquals(0.0d, after.fragmentationRatio());

        List<String> reinserted = new ArrayList<>();
        for (LedgerEvent.Allocated allocated : listener.eventsOf(LedgerEvent.Allocated.class)) {
            reinserted.add(allocated.id());
        }
        assertEquals(List.of("high", "low"), reinserted);
        assertEquals(List.of(new LedgerEvent.DefragmentComplete(after)),
            listener.eventsOf(LedgerEvent.DefragmentComplete.class));
    }

    @Test
    void listenerMayCallBackIntoLedger() {
        newLedger(1000);
        List<LedgerStats> seen = new ArrayList<>();
        ledger.subscribe(event -> {
            if (event instanceof LedgerEvent.Allocated) {
                seen.add(ledger.getStats());
            }
        });

        ledger.allocate("a", 100, payload("a"));

        assertEquals(1, seen.size());
        assertEquals(100L, seen.get(0).totalAllocated());
    }

    @Test
    void closedSubscriptionShouldStopDelivery() {
        newLedger(1000);
        RecordingListener other = new RecordingListener();
        LedgerEventBus.Subscription subscription = ledger.subscribe(other);
        ledger.allocate("a", 100, payload("a"));
        subscription.close();
        ledger.allocate("b", 100, payload("b"));

        assertEquals(1, other.events().size());
    }

    @Test
    void destroyShouldTerminateLedger() {
        newLedger(1000);
        ledger.allocate("a", 100, payload("a"));

        ledger.destroy();

        assertEquals(List.of(new LedgerEvent.Destroyed()), listener.eventsOf(LedgerEvent.Destroyed.class));
        LedgerTerminatedException e = assertThrows(LedgerTerminatedException.class, () -> ledger.access("a"));
        assertEquals(LedgerStatusCodes.SERVICE_UNAVAILABLE, e.reasonCode());
        assertThrows(LedgerTerminatedException.class, () -> ledger.allocate("b", 1, payload("b")));
        assertThrows(LedgerTerminatedException.class, ledger::getStats);
        assertThrows(LedgerTerminatedException.class, ledger::defragment);
        assertThrows(LedgerTerminatedException.class, ledger::sweep);
        assertThrows(LedgerTerminatedException.class, () -> ledger.release("a"));
        assertThrows(LedgerTerminatedException.class, ledger::destroy);

        ledger.close();
        assertEquals(1, listener.eventsOf(LedgerEvent.Destroyed.class).size());
    }

    @Test
    void budgetInvariantShouldHoldAcrossMixedOperations() {
        long budget = 5_000;
        newLedger(budget);
        java.util.Random random = new java.util.Random(42);
        List<TestPayload> live = new ArrayList<>();
        for (int i = 0; i < 2_000; i++) {
            int op = random.nextInt(10);
            String id = "r" + random.nextInt(60);
            try {
                if (op < 5) {
                    TestPayload p = payload(id);
                    live.add(p);
                    ledger.allocate(id, 1 + random.nextInt(900), p, random.nextInt(4));
                } else if (op < 6 && !live.isEmpty()) {
                    live.remove(random.nextInt(live.size())).destroy();
                } else if (op < 7) {
                    ledger.release(id);
                } else if (op < 8) {
                    ledger.access(id);
                } else if (op < 9) {
                    ledger.sweep();
                } else {
                    clock.advance(random.nextInt(100_000));
                }
            } catch (LedgerException expected) {
                // budget pressure and missing ids are part of the workload
            }
            LedgerStats stats = ledger.getStats();
            assertTrue(stats.totalAllocated() <= budget, "budget exceeded at step " + i + ": " + stats);
            assertTrue(stats.totalUsed() <= stats.totalAllocated());
        }
    }
}
