package com.tasklane;

/**
 * A task as it sits in the mailbox, with its sequence number and, for submit-and-wait, the
 * reply to resolve.
 *
 * @param sequence per-actor submission number, used for logging
 * @param task     the work
 * @param reply    the waiting caller's reply, or null for fire-and-forget
 */
record Envelope(long sequence, Task task, PendingReply reply) {

    void resolve(Outcome outcome) {
        if (reply != null) {
            reply.complete(outcome);
        }
    }
}
