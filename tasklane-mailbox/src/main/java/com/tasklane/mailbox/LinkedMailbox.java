package com.tasklane.mailbox;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Lock-based mailbox over a {@link LinkedBlockingQueue}; the one to use when an actor needs a
 * bound.
 * <p>
 * With a bound, a full mailbox holds producers back: {@link #put} parks until the actor takes a
 * task, {@link #offer(Object, long, TimeUnit)} parks up to its deadline and {@link #offer(Object)}
 * answers false at once. Producers and the consumer use separate locks, so enqueueing does not
 * contend with the actor draining.
 *
 * @param <T> The type of queued elements
 */
public class LinkedMailbox<T> implements Mailbox<T> {

    private final LinkedBlockingQueue<T> queue;
    private final boolean bounded;

    /**
     * Creates a mailbox without a bound; producers never wait.
     */
    public LinkedMailbox() {
        this(new LinkedBlockingQueue<>(), false);
    }

    /**
     * Creates a mailbox holding at most {@code capacity} tasks.
     *
     * @param capacity the bound, at least 1
     */
    public LinkedMailbox(int capacity) {
        this(new LinkedBlockingQueue<>(requirePositive(capacity)), true);
    }

    private LinkedMailbox(LinkedBlockingQueue<T> queue, boolean bounded) {
        this.queue = queue;
        this.bounded = bounded;
    }

    @Override
    public boolean offer(T message) {
        return queue.offer(requireMessage(message));
    }

    /**
     * A non-positive timeout behaves like {@link #offer(Object)}.
     */
    @Override
    public boolean offer(T message, long timeout, TimeUnit unit) throws InterruptedException {
        requireMessage(message);
        if (timeout <= 0) {
            return queue.offer(message);
        }
        return queue.offer(message, timeout, unit);
    }

    @Override
    public void put(T message) throws InterruptedException {
        queue.put(requireMessage(message));
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    @Override
    public T take() throws InterruptedException {
        return queue.take();
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        return queue.drainTo(collection, maxElements);
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public int remainingCapacity() {
        return queue.remainingCapacity();
    }

    @Override
    public void clear() {
        queue.clear();
    }

    @Override
    public int capacity() {
        return bounded ? queue.size() + queue.remainingCapacity() : Integer.MAX_VALUE;
    }

    @Override
    public boolean isBounded() {
        return bounded;
    }

    @Override
    public String toString() {
        return "LinkedMailbox[size=" + queue.size()
                + ", capacity=" + (bounded ? String.valueOf(capacity()) : "unbounded") + "]";
    }

    private static <T> T requireMessage(T message) {
        return Objects.requireNonNull(message, "Message cannot be null");
    }

    private static int requirePositive(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Mailbox capacity must be at least 1, got " + capacity);
        }
        return capacity;
    }
}
