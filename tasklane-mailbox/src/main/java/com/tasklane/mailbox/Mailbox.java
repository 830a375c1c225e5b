package com.tasklane.mailbox;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Ordered queue of pending work for a single actor.
 * <p>
 * Any number of producer threads may enqueue concurrently. Exactly one consumer, the actor's
 * execution loop, dequeues. Elements leave the mailbox in the order the mailbox accepted them.
 * Implementations reject {@code null} elements with a {@link NullPointerException}.
 *
 * @param <T> The type of elements held in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Enqueues the element if there is room right now.
     *
     * @param message the element to add
     * @return true if the element was accepted, false if the mailbox is full
     */
    boolean offer(T message);

    /**
     * Enqueues the element, waiting up to the given time for room to become available.
     *
     * @param message the element to add
     * @param timeout how long to wait before giving up
     * @param unit    the unit of {@code timeout}
     * @return true if the element was accepted, false if the wait elapsed
     * @throws InterruptedException if interrupted while waiting; the element is not enqueued
     */
    boolean offer(T message, long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Enqueues the element, waiting as long as necessary for room.
     *
     * @param message the element to add
     * @throws InterruptedException if interrupted while waiting; the element is not enqueued
     */
    void put(T message) throws InterruptedException;

    /**
     * Removes the head of the mailbox without waiting.
     *
     * @return the head element, or null if the mailbox is empty
     */
    T poll();

    /**
     * Removes the head of the mailbox, waiting up to the given time for an element to arrive.
     *
     * @param timeout how long to wait before giving up
     * @param unit    the unit of {@code timeout}
     * @return the head element, or null if the wait elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Removes the head of the mailbox, waiting as long as necessary.
     *
     * @return the head element
     * @throws InterruptedException if interrupted while waiting
     */
    T take() throws InterruptedException;

    /**
     * Moves up to {@code maxElements} elements, in order, into the given collection.
     *
     * @param collection  the destination
     * @param maxElements upper bound on the number of elements moved
     * @return the number of elements moved
     */
    int drainTo(Collection<? super T> collection, int maxElements);

    /**
     * @return the number of queued elements
     */
    int size();

    /**
     * @return true if nothing is queued
     */
    boolean isEmpty();

    /**
     * @return how many more elements fit without waiting, or {@link Integer#MAX_VALUE} if unbounded
     */
    int remainingCapacity();

    /**
     * Discards every queued element.
     */
    void clear();

    /**
     * Total capacity, or {@link Integer#MAX_VALUE} if unbounded.
     *
     * @return the capacity
     */
    default int capacity() {
        int remaining = remainingCapacity();
        if (remaining == Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return size() + remaining;
    }

    /**
     * @return true if producers can be made to wait for room
     */
    default boolean isBounded() {
        return capacity() != Integer.MAX_VALUE;
    }
}
