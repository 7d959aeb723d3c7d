package io.failforge.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable failure accumulator owned by one running aggregation block.
 *
 * <p>Every mutation happens under one lock, so appends from worker threads
 * never interleave. A failure position can be reserved up front with
 * {@link #reserve()}; nested blocks use it so their result is ordered by when
 * they were entered.
 */
public final class FailureCollector {

    private final long ownerId;
    private final ReentrantLock lock;
    private final List<Slot> failureSlots;
    private final List<Throwable> otherErrors;
    private final Map<Throwable, Boolean> seen;
    private boolean closed;

    public FailureCollector(long ownerId) {
        this.ownerId = ownerId;
        this.lock = new ReentrantLock();
        this.failureSlots = new ArrayList<Slot>();
        this.otherErrors = new ArrayList<Throwable>();
        this.seen = new IdentityHashMap<Throwable, Boolean>();
    }

    public long ownerId() {
        return ownerId;
    }

    /**
     * Append a failure unless this exact object was collected before.
     */
    public boolean addFailure(Throwable failure) {
        Objects.requireNonNull(failure, "failure");
        lock.lock();
        try {
            if (closed || !markSeen(failure)) {
                return false;
            }
            Slot slot = new Slot();
            slot.value = failure;
            failureSlots.add(slot);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take a reported failure unless this collector is closed. A failure seen
     * before counts as taken.
     *
     * @return {@code false} only when the collector no longer accepts failures
     */
    public boolean accept(Throwable failure) {
        Objects.requireNonNull(failure, "failure");
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            if (markSeen(failure)) {
                Slot slot = new Slot();
                slot.value = failure;
                failureSlots.add(slot);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean addOtherError(Throwable error) {
        Objects.requireNonNull(error, "error");
        lock.lock();
        try {
            if (closed || !markSeen(error)) {
                return false;
            }
            otherErrors.add(error);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reserve the next failure position, or return {@code null} once closed.
     */
    public Slot reserve() {
        lock.lock();
        try {
            if (closed) {
                return null;
            }
            Slot slot = new Slot();
            failureSlots.add(slot);
            return slot;
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(Throwable throwable) {
        lock.lock();
        try {
            return seen.containsKey(throwable);
        } finally {
            lock.unlock();
        }
    }

    public List<Throwable> failures() {
        lock.lock();
        try {
            List<Throwable> values = new ArrayList<Throwable>(failureSlots.size());
            for (Slot slot : failureSlots) {
                if (slot.value != null) {
                    values.add(slot.value);
                }
            }
            return Collections.unmodifiableList(values);
        } finally {
            lock.unlock();
        }
    }

    public List<Throwable> otherErrors() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<Throwable>(otherErrors));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            int count = otherErrors.size();
            for (Slot slot : failureSlots) {
                if (slot.value != null) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Refuse further additions. Called once the owning block stops collecting.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    private boolean markSeen(Throwable throwable) {
        return seen.put(throwable, Boolean.TRUE) == null;
    }

    /**
     * A failure position that is filled at most once.
     */
    public final class Slot {

        private Throwable value;

        private Slot() {
        }

        public boolean fill(Throwable failure) {
            Objects.requireNonNull(failure, "failure");
            lock.lock();
            try {
                if (value != null) {
                    throw new IllegalStateException("slot already filled");
                }
                if (closed || !markSeen(failure)) {
                    return false;
                }
                value = failure;
                return true;
            } finally {
                lock.unlock();
            }
        }
    }
}
