package com.lucsartech.tint.pipeline;

import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded, closable FIFO connecting two pipeline stages.
 *
 * <p>Closing publishes a single end-of-stream marker (poison pill) behind the buffered items.
 * A receiver that takes the marker puts it back before returning, so every receiver sharing the
 * queue observes the closure once the remaining items have been drained.
 *
 * <p>Sending after {@link #close()} is a programming error and fails with {@link IllegalStateException}.
 */
public final class WorkQueue<T> {

    private static final Object END_OF_STREAM = new Object();

    private final String name;
    private final int capacity;
    private final BlockingQueue<Object> queue;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public WorkQueue(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Enqueue an item, blocking while the queue is full.
     */
    public void send(T item) throws InterruptedException {
        if (item == null) {
            throw new IllegalArgumentException("Cannot send null on queue " + name);
        }
        if (closed.get()) {
            throw new IllegalStateException("Send on closed queue " + name);
        }
        queue.put(item);
    }

    /**
     * Take the next item, blocking while the queue is empty and open.
     *
     * @return the item, or empty once the queue is closed and drained
     */
    @SuppressWarnings("unchecked")
    public Optional<T> receive() throws InterruptedException {
        Object next = queue.take();
        if (next == END_OF_STREAM) {
            // no sender is left, so the slot just freed is still available
            queue.put(END_OF_STREAM);
            return Optional.empty();
        }
        return Optional.of((T) next);
    }

    /**
     * Mark the end of the stream, blocking while the buffer is full. Idempotent.
     * Must only be called once every sender has returned.
     */
    public void close() throws InterruptedException {
        if (closed.compareAndSet(false, true)) {
            queue.put(END_OF_STREAM);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int capacity() {
        return capacity;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "WorkQueue[" + name + ", capacity=" + capacity + ", closed=" + closed.get() + "]";
    }
}
