package com.tasklane.mailbox;

import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded mailbox backed by the JCTools {@link MpscUnboundedArrayQueue}.
 * <p>
 * Producers enqueue without taking a lock. The consumer only touches the lock when the queue is
 * empty and it has to park; producers acquire it to signal only while the consumer is parked.
 * Because the queue never fills, {@link #put} and {@link #offer(Object, long, TimeUnit)} never
 * wait, so this mailbox cannot provide backpressure.
 * <p>
 * Only one thread may call the removal methods.
 *
 * @param <T> The type of queued elements
 */
public class MpscMailbox<T> implements Mailbox<T> {

    /** JCTools requires a power-of-two chunk size of at least 2. */
    private static final int MIN_CHUNK_SIZE = 2;
    /** Largest power of two an int can hold. */
    static final int MAX_CHUNK_SIZE = 1 << 30;

    public static final int DEFAULT_CHUNK_SIZE = 128;

    private final MpscUnboundedArrayQueue<T> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final int chunkSize;

    private volatile boolean consumerParked = false;

    public MpscMailbox() {
        this(DEFAULT_CHUNK_SIZE);
    }

    /**
     * @param chunkSize size of each array chunk the queue links together; rounded up to a power of
     *                  two and clamped to [2, 2^30]
     */
    public MpscMailbox(int chunkSize) {
        this.chunkSize = effectiveChunkSize(chunkSize);
        this.queue = new MpscUnboundedArrayQueue<>(this.chunkSize);
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        boolean added = queue.offer(message);
        if (added && consumerParked) {
            lock.lock();
            try {
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }
        return added;
    }

    @Override
    public boolean offer(T message, long timeout, TimeUnit unit) {
        return offer(message);
    }

    @Override
    public void put(T message) {
        offer(message);
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        T message = queue.poll();
        if (message != null || timeout <= 0) {
            return message;
        }

        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            consumerParked = true;
            while (true) {
                // re-check after publishing the parked flag, a producer may have missed it
                message = queue.poll();
                if (message != null) {
                    return message;
                }
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
        } finally {
            consumerParked = false;
            lock.unlock();
        }
    }

    @Override
    public T take() throws InterruptedException {
        T message = queue.poll();
        if (message != null) {
            return message;
        }

        lock.lockInterruptibly();
        try {
            consumerParked = true;
            while ((message = queue.poll()) == null) {
                notEmpty.await();
            }
            return message;
        } finally {
            consumerParked = false;
            lock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        int count = 0;
        T message;
        while (count < maxElements && (message = queue.poll()) != null) {
            collection.add(message);
            count++;
        }
        return count;
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
        return Integer.MAX_VALUE;
    }

    @Override
    public void clear() {
        queue.clear();
    }

    @Override
    public int capacity() {
        return Integer.MAX_VALUE;
    }

    /**
     * @return the chunk size actually used, after rounding
     */
    public int getChunkSize() {
        return chunkSize;
    }

    @Override
    public String toString() {
        return "MpscMailbox[size=" + queue.size() + ", chunkSize=" + chunkSize + "]";
    }

    static int effectiveChunkSize(int requested) {
        if (requested >= MAX_CHUNK_SIZE) {
            return MAX_CHUNK_SIZE;
        }
        int value = Math.max(MIN_CHUNK_SIZE, requested);
        int highest = Integer.highestOneBit(value);
        return highest == value ? value : highest << 1;
    }
}
