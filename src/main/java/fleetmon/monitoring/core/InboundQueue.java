package fleetmon.monitoring.core;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO channel with an explicit end of stream.
 *
 * Producers call {@link #send} (blocks while full) or {@link #offer} (fails
 * fast). The consumer calls {@link #receive}, which returns empty once the
 * queue is closed and every element sent before closing has been taken.
 *
 * @param <T> element type
 */
public final class InboundQueue<T> {

    private final String name;
    private final int capacity;
    private final ArrayDeque<T> items;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private boolean closed = false;

    public InboundQueue(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.name = name;
        this.capacity = capacity;
        this.items = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Enqueue, waiting for space if the queue is full.
     *
     * @throws IllegalStateException if the queue is closed (also when closed while waiting)
     */
    public void send(T item) throws InterruptedException {
        Objects.requireNonNull(item, "item");
        lock.lockInterruptibly();
        try {
            while (items.size() >= capacity && !closed) {
                notFull.await();
            }
            ensureOpen();
            items.addLast(item);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enqueue without waiting.
     *
     * @return false if the queue is full
     * @throws IllegalStateException if the queue is closed
     */
    public boolean offer(T item) {
        Objects.requireNonNull(item, "item");
        lock.lock();
        try {
            ensureOpen();
            if (items.size() >= capacity) {
                return false;
            }
            items.addLast(item);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the next element, waiting until one arrives.
     *
     * @return the next element, or empty at end of stream
     */
    public Optional<T> receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty() && !closed) {
                notEmpty.await();
            }
            T item = items.pollFirst();
            if (item != null) {
                notFull.signal();
            }
            return Optional.ofNullable(item);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Mark end of stream. Elements already queued are still delivered.
     * Idempotent.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
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

    public String name() {
        return name;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Queue '" + name + "' is closed");
        }
    }
}
