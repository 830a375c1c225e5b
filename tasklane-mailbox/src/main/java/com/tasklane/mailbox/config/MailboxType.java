package com.tasklane.mailbox.config;

/**
 * Queue implementation backing an actor's mailbox.
 *
 * <ul>
 *   <li>{@link #LINKED} - {@code LinkedBlockingQueue}, bounded or unbounded (default)</li>
 *   <li>{@link #MPSC} - JCTools lock-free MPSC queue, unbounded only</li>
 * </ul>
 */
public enum MailboxType {
    /**
     * General-purpose blocking queue. Required for bounded mailboxes and backpressure.
     */
    LINKED,

    /**
     * Lock-free multi-producer queue for actors fed by many threads at high rates.
     * Always unbounded.
     */
    MPSC
}
