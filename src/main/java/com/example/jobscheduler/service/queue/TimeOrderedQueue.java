package com.example.jobscheduler.service.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Min-heap of pending job ids keyed by run time.
 * <p>
 * Equal run times are served in insertion order. Removal is lazy: {@link #remove(UUID)}
 * drops the id from the pending index and the stale heap entry is discarded once it
 * surfaces at the head. A job therefore counts as pending if and only if it is in the index.
 * <p>
 * Guarded by its own lock. Callers that also hold the job store lock must acquire
 * that lock first.
 */
@Slf4j
@Component
public class TimeOrderedQueue {

    private final PriorityQueue<Entry> heap = new PriorityQueue<>(
            Comparator.comparing(Entry::runAt).thenComparingLong(Entry::sequence));

    /**
     * Live entry per pending job id; heap entries not referenced here are tombstones
     */
    private final Map<UUID, Entry> pending = new HashMap<>();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private long nextSequence = 0;

    /**
     * Add a pending entry for a job. An existing entry for the same id is superseded.
     */
    public void insert(UUID jobId, Instant runAt) {
        lock.lock();
        try {
            var entry = new Entry(jobId, runAt, nextSequence++);
            var previous = pending.put(jobId, entry);
            if (previous != null) {
                log.debug("Superseded pending entry for job {} ({} -> {})", jobId, previous.runAt(), runAt);
            }
            heap.add(entry);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Earliest pending id if it is due at {@code now}, without removing it
     */
    public Optional<UUID> peekDue(Instant now) {
        lock.lock();
        try {
            var head = liveHead();
            if (head == null || head.runAt().isAfter(now)) {
                return Optional.empty();
            }
            return Optional.of(head.jobId());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return the earliest pending id if it is due at {@code now}
     */
    public Optional<UUID> popDue(Instant now) {
        lock.lock();
        try {
            var head = liveHead();
            if (head == null || head.runAt().isAfter(now)) {
                return Optional.empty();
            }
            heap.poll();
            pending.remove(head.jobId());
            return Optional.of(head.jobId());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tombstone the pending entry of a job.
     *
     * @return true if the job had a pending entry
     */
    public boolean remove(UUID jobId) {
        lock.lock();
        try {
            return pending.remove(jobId) != null;
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(UUID jobId) {
        lock.lock();
        try {
            return pending.containsKey(jobId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of pending (non-tombstoned) entries
     */
    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run time of the earliest pending entry
     */
    public Optional<Instant> nextDueTime() {
        lock.lock();
        try {
            var head = liveHead();
            return head != null ? Optional.of(head.runAt()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until the earliest entry is due, an entry is inserted, or {@code maxWait} elapses.
     *
     * @param now     current time as seen by the caller's clock
     * @param maxWait upper bound on the wait
     * @return true if an entry is due at {@code now} without waiting
     */
    public boolean awaitDue(Instant now, Duration maxWait) throws InterruptedException {
        lock.lock();
        try {
            var head = liveHead();
            if (head != null && !head.runAt().isAfter(now)) {
                return true;
            }
            var waitNanos = maxWait.toNanos();
            if (head != null) {
                waitNanos = Math.min(waitNanos, Duration.between(now, head.runAt()).toNanos());
            }
            if (waitNanos > 0) {
                changed.awaitNanos(waitNanos);
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wake any thread blocked in {@link #awaitDue(Instant, Duration)}
     */
    public void wakeUp() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop tombstones from the top of the heap and return the first live entry
     */
    private Entry liveHead() {
        var head = heap.peek();
        while (head != null && pending.get(head.jobId()) != head) {
            heap.poll();
            head = heap.peek();
        }
        return head;
    }

    private record Entry(UUID jobId, Instant runAt, long sequence) {
    }
}
