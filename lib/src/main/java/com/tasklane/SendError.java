package com.tasklane;

/**
 * Reasons an enqueue attempt was refused.
 * None of them changes the actor's state.
 */
public enum SendError {
    /**
     * The actor has stopped, or is stopping, and accepts no more tasks.
     */
    CLOSED,

    /**
     * The bounded mailbox had no room within the enqueue timeout.
     */
    QUEUE_FULL,

    /**
     * The producer was interrupted while waiting for room. The task was not enqueued.
     */
    CANCELLED,

    /**
     * The actor is poisoned and configured with {@link PoisonPolicy#REJECT_AT_SEND}.
     */
    POISONED
}
