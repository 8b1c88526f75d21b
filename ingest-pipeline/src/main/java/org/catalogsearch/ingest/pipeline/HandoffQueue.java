package org.catalogsearch.ingest.pipeline;

import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded single-producer, single-consumer queue between the record streamer and the bulk
 * indexer.
 *
 * <p>The producer blocks while the queue is full and signals the end of the stream with
 * {@link #close()}.  The consumer blocks while the queue is empty and open; once closed, it
 * receives every remaining item and then an empty result.  A consumer that can no longer make
 * progress calls {@link #abandon()}, after which {@link #put} stops blocking and returns false.
 */
public class HandoffQueue<T> {
    public static final int DEFAULT_CAPACITY = 1000;

    private static final Object END = new Object();
    private static final long POLL_INTERVAL_MS = 100;

    private final BlockingQueue<Object> queue;
    private volatile boolean closed;
    private volatile boolean abandoned;
    private boolean endReached;

    public HandoffQueue() {
        this(DEFAULT_CAPACITY);
    }

    public HandoffQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be at least 1, was " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Waits for room and enqueues the item.
     *
     * @return false if the consumer abandoned the queue, in which case the item was dropped
     */
    public boolean put(T item) throws InterruptedException {
        if (closed) {
            throw new IllegalStateException("Queue is already closed");
        }
        while (!abandoned) {
            if (queue.offer(item, POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Marks the end of the stream.  Never blocks: if the queue is full the consumer finds the end
     * once it has drained what is left.
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        queue.offer(END);
    }

    /**
     * Waits for the next item.
     *
     * @return the item, or empty once the queue is closed and drained
     */
    @SuppressWarnings("unchecked")
    public Optional<T> take() throws InterruptedException {
        while (!endReached) {
            var item = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            if (item == END) {
                endReached = true;
            } else if (item != null) {
                return Optional.of((T) item);
            } else if (closed && queue.isEmpty()) {
                endReached = true;
            }
        }
        return Optional.empty();
    }

    /** Drops everything queued and releases a producer waiting for room. */
    public void abandon() {
        abandoned = true;
        queue.clear();
    }

    public boolean isAbandoned() {
        return abandoned;
    }

    public boolean isClosed() {
        return closed;
    }
}
