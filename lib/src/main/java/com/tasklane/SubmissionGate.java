package com.tasklane;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Admission control between producers and the execution loop.
 * <p>
 * A producer increments the in-flight count before checking whether the gate is closed, and
 * decrements it once its enqueue attempt is over. Closing publishes the mode before the loop
 * reads the count. So once the loop sees the gate closed with nothing in flight, no producer can
 * still add to the mailbox, and draining it resolves every accepted task.
 */
final class SubmissionGate {

    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicReference<ShutdownMode> closedWith = new AtomicReference<>();

    /**
     * @return true if the caller may enqueue; it must then call {@link #exit()}
     */
    boolean enter() {
        inFlight.incrementAndGet();
        if (closedWith.get() != null) {
            inFlight.decrementAndGet();
            return false;
        }
        return true;
    }

    void exit() {
        inFlight.decrementAndGet();
    }

    /**
     * Closes the gate. A graceful close may later be escalated to hard, never the reverse.
     *
     * @return true if this call changed the mode
     */
    boolean close(ShutdownMode mode) {
        while (true) {
            ShutdownMode current = closedWith.get();
            if (current == mode || current == ShutdownMode.HARD) {
                return false;
            }
            if (closedWith.compareAndSet(current, mode)) {
                return true;
            }
        }
    }

    boolean isOpen() {
        return closedWith.get() == null;
    }

    boolean isHardClosed() {
        return closedWith.get() == ShutdownMode.HARD;
    }

    /**
     * @return true once closed and no producer is mid-enqueue
     */
    boolean isSettled() {
        return closedWith.get() != null && inFlight.get() == 0;
    }
}
