package com.acme.deeptree.ledger.memory;

import com.acme.deeptree.ledger.eviction.EvictionDecision;
import com.acme.deeptree.ledger.eviction.EvictionPolicy;
import com.acme.deeptree.ledger.eviction.PriorityRecencyEvictionPolicy;
import com.acme.deeptree.ledger.telemetry.LedgerEvent;
import com.acme.deeptree.ledger.telemetry.LedgerEventBus;
import com.acme.deeptree.ledger.telemetry.LedgerEventListener;
import com.acme.deeptree.ledger.telemetry.LedgerStats;
import com.acme.deeptree.ledger.util.LedgerDefaults;
import com.acme.deeptree.ledger.util.LedgerStatusCodes;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Allocation ledger with a hard byte budget, priority/recency eviction, a periodic
 * liveness sweep and on-demand compaction.
 *
 * <h3>Concurrency Protocol</h3>
 * <ul>
 *   <li>One {@link ReentrantLock} guards the table and the running totals. Every
 *       operation, including the scheduled sweep, holds it from its first read to its
 *       last write, so check-evict-insert in {@code allocate} and the whole compaction
 *       are atomic to other callers.</li>
 *   <li>Events are buffered while the lock is held and published after it is released.
 *       A listener may therefore call back into the ledger, for instance to compact after
 *       a sweep.</li>
 *   <li>Payloads the collector clears are reported on a {@link ReferenceQueue}. The queue is
 *       drained under the lock by the sweep thread every {@link LedgerDefaults#RECLAIM_POLL_INTERVAL_MS}
 *       at most, and at the start of {@code allocate}, {@code freeUpSpace} and {@code defragment}.</li>
 *   <li>{@link #destroy()} flips the terminated flag first, then waits for an in-flight
 *       sweep before clearing the table.</li>
 * </ul>
 *
 * <h3>Budget invariant</h3>
 * The sum of {@code sizeBytes} over all records never exceeds {@code maxBudgetBytes}
 * once an operation returns.
 */
public final class BudgetedAllocationLedger implements AllocationLedger {
    private static final Logger LOG = Logger.getLogger(BudgetedAllocationLedger.class.getName());

    private static final Comparator<AllocationRecord> REINSERT_ORDER =
        Comparator.comparingInt(AllocationRecord::priorityTier).reversed();

    private final LedgerConfig config;
    private final LedgerClock clock;
    private final PayloadHandleFactory handleFactory;
    private final EvictionPolicy evictionPolicy;
    private final LedgerEventBus eventBus = new LedgerEventBus();

    private final ReentrantLock lock = new ReentrantLock();
    private final ReferenceQueue<Object> collected = new ReferenceQueue<>();
    private final Map<String, AllocationRecord> records = new HashMap<>();
    private long totalSizeBytes;
    private long totalUsedBytes;

    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private final ScheduledExecutorService sweeper;
    private volatile Thread sweeperThread;

    public BudgetedAllocationLedger(LedgerConfig config) {
        this(config, LedgerClock.monotonic(), PayloadHandles.standard());
    }

    public BudgetedAllocationLedger(LedgerConfig config, LedgerClock clock, PayloadHandleFactory handleFactory) {
        this(config, clock, handleFactory, new PriorityRecencyEvictionPolicy(config.idleThresholdMillis()));
    }

    public BudgetedAllocationLedger(LedgerConfig config,
                                    LedgerClock clock,
                                    PayloadHandleFactory handleFactory,
                                    EvictionPolicy evictionPolicy) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.handleFactory = Objects.requireNonNull(handleFactory, "handleFactory");
        this.evictionPolicy = Objects.requireNonNull(evictionPolicy, "evictionPolicy");

        this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ledger-liveness-sweep");
            t.setDaemon(true);
            sweeperThread = t;
            return t;
        });
        long interval = config.sweepIntervalMillis();
        sweeper.scheduleAtFixedRate(this::scheduledSweep, interval, interval, TimeUnit.MILLISECONDS);
        long reclaimPoll = Math.min(interval, LedgerDefaults.RECLAIM_POLL_INTERVAL_MS);
        sweeper.scheduleWithFixedDelay(this::scheduledReclaim, reclaimPoll, reclaimPoll, TimeUnit.MILLISECONDS);
        LOG.info(() -> "Allocation ledger started: maxBudgetBytes=" + config.maxBudgetBytes()
            + " idleThresholdMs=" + config.idleThresholdMillis()
            + " sweepIntervalMs=" + interval);
    }

    @Override
    public void allocate(String id, long sizeBytes, Object payload, int priorityTier) {
        validate(id, sizeBytes, priorityTier);
        Objects.requireNonNull(payload, "payload");
        allocate(id, sizeBytes, handleFactory.handleFor(payload), priorityTier);
    }

    @Override
    public void allocate(String id, long sizeBytes, PayloadHandle handle, int priorityTier) {
        validate(id, sizeBytes, priorityTier);
        Objects.requireNonNull(handle, "handle");
        List<LedgerEvent> events = new ArrayList<>(4);
        lock.lock();
        try {
            ensureActive();
            drainCollectedLocked(events);
            allocateLocked(id, sizeBytes, handle, priorityTier, events);
        } finally {
            lock.unlock();
            eventBus.publishAll(events);
        }
    }

    private void allocateLocked(String id, long sizeBytes, PayloadHandle handle, int priorityTier,
                                List<LedgerEvent> events) {
        long max = config.maxBudgetBytes();
        if (sizeBytes > max) {
            throw denied(id, sizeBytes, 0L, events);
        }

        // The replaced record's bytes count as free; it is put back if the new record does not fit.
        AllocationRecord previous = records.remove(id);
        if (previous != null) {
            totalSizeBytes -= previous.sizeBytes();
            totalUsedBytes -= previous.usedBytes();
        }
        if (totalSizeBytes + sizeBytes > max) {
            long freed = freeUpSpaceLocked(sizeBytes, events);
            if (freed < sizeBytes || totalSizeBytes + sizeBytes > max) {
                if (previous != null) {
                    insertLocked(previous);
                }
                throw denied(id, sizeBytes, freed, events);
            }
        }

        if (previous != null) {
            previous.unwatch();
            if (previous.handle().isAlive()) {
                events.add(new LedgerEvent.Released(id, previous.sizeBytes()));
            }
        }
        AllocationRecord record = new AllocationRecord(id, sizeBytes, priorityTier, handle, clock.nowMillis());
        insertLocked(record);
        handle.tryResolve().ifPresent(payload -> record.watch(new CollectedPayload(payload, collected, record)));
        events.add(new LedgerEvent.Allocated(id, sizeBytes));
    }

    private void insertLocked(AllocationRecord record) {
        records.put(record.id(), record);
        totalSizeBytes += record.sizeBytes();
        totalUsedBytes += record.usedBytes();
    }

    private static InsufficientBudgetException denied(String id, long sizeBytes, long freed, List<LedgerEvent> events) {
        events.add(new LedgerEvent.AllocationFailed(id, sizeBytes, LedgerStatusCodes.INSUFFICIENT_STORAGE));
        return new InsufficientBudgetException(id, sizeBytes, freed);
    }

    @Override
    public long freeUpSpace(long requiredBytes) {
        if (requiredBytes < 0) {
            throw new IllegalArgumentException("requiredBytes must be >= 0, got " + requiredBytes);
        }
        List<LedgerEvent> events = new ArrayList<>();
        lock.lock();
        try {
            ensureActive();
            drainCollectedLocked(events);
            long freed = freeUpSpaceLocked(requiredBytes, events);
            if (freed < requiredBytes) {
                throw new InsufficientBudgetException(requiredBytes, freed);
            }
            return freed;
        } finally {
            lock.unlock();
            eventBus.publishAll(events);
        }
    }

    /** Returns the bytes freed; may be less than required. */
    private long freeUpSpaceLocked(long requiredBytes, List<LedgerEvent> events) {
        long now = clock.nowMillis();
        long freed = 0L;
        for (AllocationRecord candidate : evictionPolicy.order(records.values())) {
            if (freed >= requiredBytes) {
                break;
            }
            EvictionDecision decision = evictionPolicy.decide(candidate, candidate.handle().isAlive(), now);
            if (!decision.removes()) {
                continue;
            }
            removeLocked(candidate);
            freed += candidate.sizeBytes();
            if (decision == EvictionDecision.EVICT_IDLE) {
                events.add(new LedgerEvent.Freed(candidate.id(), candidate.sizeBytes()));
            } else {
                LOG.fine(() -> "Dropped dead record during eviction: " + candidate.id());
            }
        }
        return freed;
    }

    @Override
    public Object access(String id) {
        lock.lock();
        try {
            ensureActive();
            AllocationRecord record = records.get(id);
            if (record == null) {
                throw new RecordNotFoundException(id);
            }
            Optional<Object> payload = record.handle().tryResolve();
            if (payload.isEmpty()) {
                removeLocked(record);
                throw new PayloadReclaimedException(id);
            }
            record.touch(clock.nowMillis());
            return payload.get();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long release(String id) {
        List<LedgerEvent> events = new ArrayList<>(1);
        lock.lock();
        try {
            ensureActive();
            AllocationRecord record = records.get(id);
            if (record == null) {
                throw new RecordNotFoundException(id);
            }
            removeLocked(record);
            events.add(new LedgerEvent.Released(id, record.sizeBytes()));
            return record.sizeBytes();
        } finally {
            lock.unlock();
            eventBus.publishAll(events);
        }
    }

    @Override
    public void reportUsage(String id, long usedBytes) {
        lock.lock();
        try {
            ensureActive();
            AllocationRecord record = records.get(id);
            if (record == null) {
                throw new RecordNotFoundException(id);
            }
            if (usedBytes < 0 || usedBytes > record.sizeBytes()) {
                throw new IllegalArgumentException(
                    "usedBytes must be within [0, " + record.sizeBytes() + "], got " + usedBytes);
            }
            totalUsedBytes += usedBytes - record.usedBytes();
            record.usedBytes(usedBytes);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean contains(String id) {
        lock.lock();
        try {
            ensureActive();
            return records.containsKey(id);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long sweep() {
        List<LedgerEvent> events = new ArrayList<>(1);
        lock.lock();
        try {
            ensureActive();
            long freed = 0L;
            Iterator<AllocationRecord> it = records.values().iterator();
            while (it.hasNext()) {
                AllocationRecord record = it.next();
                if (!record.handle().isAlive()) {
                    it.remove();
                    subtract(record);
                    freed += record.sizeBytes();
                }
            }
            if (freed > 0) {
                events.add(new LedgerEvent.SweepComplete(freed));
            }
            return freed;
        } finally {
            lock.unlock();
            eventBus.publishAll(events);
        }
    }

    private void scheduledSweep() {
        if (terminated.get()) {
            return;
        }
        try {
            long freed = sweep();
            if (freed > 0) {
                LOG.fine(() -> "Liveness sweep freed " + freed + " bytes");
            }
        } catch (LedgerTerminatedException e) {
            LOG.fine("Liveness sweep skipped: ledger destroyed");
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Liveness sweep failed", e);
        }
    }

    private void scheduledReclaim() {
        if (terminated.get()) {
            return;
        }
        List<LedgerEvent> events = new ArrayList<>();
        lock.lock();
        try {
            if (!terminated.get()) {
                drainCollectedLocked(events);
            }
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Reclaim of collected payloads failed", e);
        } finally {
            lock.unlock();
            eventBus.publishAll(events);
        }
    }

    /** Drops records whose payload the collector has cleared since the last drain. */
    private void drainCollectedLocked(List<LedgerEvent> events) {
        Reference<?> ref;
        while ((ref = collected.poll()) != null) {
            AllocationRecord record = ((CollectedPayload) ref).record;
            if (records.remove(record.id(), record)) {
                subtract(record);
                events.add(new LedgerEvent.Reclaimed(record.id(), record.sizeBytes()));
            }
        }
    }

    @Override
    public boolean defragment() {
        List<LedgerEvent> events = new ArrayList<>();
        lock.lock();
        try {
            ensureActive();
            drainCollectedLocked(events);
            LedgerStats before = statsLocked();
            if (before.fragmentationRatio() < config.defragMinRatio()) {
                return false;
            }

            List<AllocationRecord> live = new ArrayList<>(records.size());
            for (AllocationRecord record : records.values()) {
                record.unwatch();
                if (record.handle().isAlive()) {
                    live.add(record);
                }
            }
            live.sort(REINSERT_ORDER);

            records.clear();
            totalSizeBytes = 0L;
            totalUsedBytes = 0L;

            int dropped = 0;
            for (AllocationRecord record : live) {
                try {
                    allocateLocked(record.id(), record.sizeBytes(), record.handle(), record.priorityTier(), events);
                } catch (InsufficientBudgetException e) {
                    dropped++;
                    LOG.fine(() -> "Defragmentation dropped " + record.id() + ": " + e.getMessage());
                }
            }

            LedgerStats after = statsLocked();
            events.add(new LedgerEvent.DefragmentComplete(after));
            int droppedCount = dropped;
            LOG.info(() -> "Defragmentation completed: fragmentationRatio " + before.fragmentationRatio()
                + " -> " + after.fragmentationRatio() + ", blocks " + before.blockCount()
                + " -> " + after.blockCount() + ", dropped=" + droppedCount);
            return true;
        } finally {
            lock.unlock();
            eventBus.publishAll(events);
        }
    }

    @Override
    public LedgerStats getStats() {
        lock.lock();
        try {
            ensureActive();
            return statsLocked();
        } finally {
            lock.unlock();
        }
    }

    private LedgerStats statsLocked() {
        return LedgerStats.of(totalSizeBytes, totalUsedBytes, records.size(), config.maxBudgetBytes());
    }

    @Override
    public long maxBudgetBytes() {
        return config.maxBudgetBytes();
    }

    @Override
    public LedgerEventBus.Subscription subscribe(LedgerEventListener listener) {
        ensureActive();
        return eventBus.subscribe(listener);
    }

    @Override
    public void destroy() {
        if (!terminated.compareAndSet(false, true)) {
            throw new LedgerTerminatedException();
        }
        sweeper.shutdown();
        if (Thread.currentThread() != sweeperThread) {
            try {
                if (!sweeper.awaitTermination(LedgerDefaults.SWEEP_SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS)) {
                    LOG.warning("Liveness sweep did not finish within "
                        + LedgerDefaults.SWEEP_SHUTDOWN_WAIT_MS + "ms of destroy");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        int dropped;
        lock.lock();
        try {
            dropped = records.size();
            records.values().forEach(AllocationRecord::unwatch);
            records.clear();
            totalSizeBytes = 0L;
            totalUsedBytes = 0L;
        } finally {
            lock.unlock();
        }
        LOG.info("Allocation ledger destroyed, dropped " + dropped + " records");
        eventBus.publish(new LedgerEvent.Destroyed());
    }

    @Override
    public void close() {
        if (terminated.get()) {
            return;
        }
        try {
            destroy();
        } catch (LedgerTerminatedException e) {
            LOG.fine("Ledger already destroyed by a concurrent caller");
        }
    }

    private void removeLocked(AllocationRecord record) {
        if (records.remove(record.id(), record)) {
            subtract(record);
        }
    }

    private void subtract(AllocationRecord record) {
        record.unwatch();
        totalSizeBytes -= record.sizeBytes();
        totalUsedBytes -= record.usedBytes();
    }

    private void ensureActive() {
        if (terminated.get()) {
            throw new LedgerTerminatedException();
        }
    }

    /** Enqueued on {@link #collected} once the payload of {@code record} is collected. */
    private static final class CollectedPayload extends WeakReference<Object> {
        private final AllocationRecord record;

        CollectedPayload(Object payload, ReferenceQueue<Object> queue, AllocationRecord record) {
            super(payload, queue);
            this.record = record;
        }
    }

    private static void validate(String id, long sizeBytes, int priorityTier) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (sizeBytes <= 0) {
            throw new IllegalArgumentException("sizeBytes must be positive, got " + sizeBytes);
        }
        if (priorityTier < 0) {
            throw new IllegalArgumentException("priorityTier must be >= 0, got " + priorityTier);
        }
    }
}
