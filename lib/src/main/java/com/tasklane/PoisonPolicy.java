package com.tasklane;

/**
 * What a send does once the actor is poisoned.
 */
public enum PoisonPolicy {
    /**
     * The task is still accepted into the mailbox. The execution loop then rejects it without
     * running it, resolving any waiting caller with {@link Outcome.Poisoned}.
     */
    ENQUEUE_THEN_REJECT,

    /**
     * The send fails immediately with {@link SendError#POISONED}; submit-and-wait callers get
     * {@link Outcome.Poisoned} straight away. Tasks accepted before the failure are still
     * rejected by the loop.
     */
    REJECT_AT_SEND
}
