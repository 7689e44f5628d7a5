package com.chatrelay.common.mailbox;

import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO with a single consumer and any number of producers.
 * <ul>
 *   <li>{@link #offer} never blocks: when full the new item is dropped.</li>
 *   <li>{@link #close} stops further offers, wakes blocked {@link #take} callers and fires the
 *   signal so an event-driven consumer can finish draining.</li>
 * </ul>
 */
public class Mailbox<T> {

    public static final int DEFAULT_CAPACITY = 128;

    private final int capacity;
    private final ArrayDeque<T> items;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmptyOrClosed = lock.newCondition();
    private boolean closed;

    private volatile Runnable signal = () -> { };

    public Mailbox() {
        this(DEFAULT_CAPACITY);
    }

    public Mailbox(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * Wake-up hook run after every accepted offer and once on close. Runs on the producer's
     * thread, outside the lock, so it must be cheap.
     */
    public void onSignal(Runnable signal) {
        this.signal = signal == null ? () -> { } : signal;
    }

    public OfferResult offer(T item) {
        if (item == null) throw new NullPointerException("item");
        lock.lock();
        try {
            if (closed) return OfferResult.CLOSED;
            if (items.size() >= capacity) return OfferResult.DROPPED_FULL;
            items.addLast(item);
            notEmptyOrClosed.signal();
        } finally {
            lock.unlock();
        }
        signal.run();
        return OfferResult.ACCEPTED;
    }

    /** Next item, or {@code null} if nothing is queued right now. */
    public T poll() {
        lock.lock();
        try {
            return items.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until an item is available. Returns {@code null} once the mailbox is closed and
     * drained.
     */
    public T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty() && !closed) {
                notEmptyOrClosed.await();
            }
            return items.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /** @return true if this call closed the mailbox, false if it was already closed */
    public boolean close() {
        lock.lock();
        try {
            if (closed) return false;
            closed = true;
            notEmptyOrClosed.signalAll();
        } finally {
            lock.unlock();
        }
        signal.run();
        return true;
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public boolean isDrained() {
        lock.lock();
        try {
            return closed && items.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        lock.lock();
        try {
            return items.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /** Discards queued items, returning how many were dropped. */
    public int clear() {
        lock.lock();
        try {
            int n = items.size();
            items.clear();
            return n;
        } finally {
            lock.unlock();
        }
    }
}
