package com.tasklane;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.lang.ref.Reference;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A reference to a running actor through which tasks are submitted.
 * <p>
 * Handles are safe to use from many threads. {@link #copy()} creates another handle to the same
 * actor; each handle must be closed once. When the last handle is closed the actor stops, by
 * default gracefully: tasks already accepted still run, new ones are refused with
 * {@link SendError#CLOSED}. A handle that becomes unreachable without being closed is released
 * when the garbage collector finds it, with a warning.
 *
 * <pre>{@code
 * try (ActorHandle writer = Actors.spawn()) {
 *     writer.send(Task.of(() -> journal.append(entry)));
 *     Outcome outcome = writer.sendAndWait(() -> {
 *         journal.flush();
 *         return TaskResult.ok();
 *     });
 * }
 * }</pre>
 */
public final class ActorHandle implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ActorHandle.class);
    private static final Cleaner CLEANER = Cleaner.create();

    private final ActorCell cell;
    private final Lease lease;
    private final Cleaner.Cleanable cleanable;

    /**
     * Wraps one handle reference the caller has already counted on the cell.
     */
    ActorHandle(ActorCell cell) {
        this.cell = cell;
        this.lease = new Lease(cell);
        this.cleanable = CLEANER.register(this, lease);
    }

    public String actorId() {
        return cell.getActorId();
    }

    /**
     * Fire-and-forget. Waits for mailbox room according to the actor's configured enqueue timeout.
     *
     * @param task the work to run
     * @return success once the task is queued, or a {@link SendException} saying why it was not
     */
    public Result<Void> send(Task task) {
        return enqueue(task, cell.getConfig().getEnqueueTimeout());
    }

    /**
     * Fire-and-forget, waiting at most {@code enqueueTimeout} for mailbox room.
     * A zero timeout does not wait.
     */
    public Result<Void> send(Task task, Duration enqueueTimeout) {
        return enqueue(task, requireTimeout(enqueueTimeout));
    }

    /**
     * Fire-and-forget without waiting. A full mailbox fails with {@link SendError#QUEUE_FULL}.
     */
    public Result<Void> trySend(Task task) {
        return send(task, Duration.ZERO);
    }

    /**
     * Submits a task and returns at once with a reply that resolves when the task finishes or
     * is refused.
     *
     * @param task the work to run
     * @return the pending reply
     */
    public PendingReply submit(Task task) {
        return submitWithTimeout(task, cell.getConfig().getEnqueueTimeout());
    }

    public PendingReply submit(Task task, Duration enqueueTimeout) {
        return submitWithTimeout(task, requireTimeout(enqueueTimeout));
    }

    /**
     * Submits a task and blocks until its outcome is known.
     *
     * @param task the work to run
     * @return how the task ended
     */
    public Outcome sendAndWait(Task task) {
        return submit(task).await();
    }

    /**
     * Submits a task and blocks until its outcome is known or the timeout expires. The timeout
     * covers both waiting for mailbox room and waiting for the task. Timing out does not retract
     * the task.
     *
     * @throws TimeoutException if no outcome is available in time
     */
    public Outcome sendAndWait(Task task, Duration timeout) throws TimeoutException {
        requireTimeout(timeout);
        long deadline = System.nanoTime() + timeout.toNanos();
        PendingReply reply = submit(task, timeout);
        return reply.await(Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
    }

    public ActorState state() {
        return cell.state();
    }

    public boolean isPoisoned() {
        return cell.state() == ActorState.POISONED;
    }

    public Optional<Throwable> poisonCause() {
        return cell.poisonCause();
    }

    /**
     * @return true until the actor starts shutting down
     */
    public boolean isAcceptingTasks() {
        return cell.isAcceptingTasks();
    }

    public boolean isTerminated() {
        return cell.isTerminated();
    }

    /**
     * @return the number of tasks currently queued, not counting the one running
     */
    public int pendingTasks() {
        return cell.pendingTasks();
    }

    /**
     * Creates another handle to the same actor. The copy must be closed independently.
     *
     * @return a new handle
     */
    public ActorHandle copy() {
        try {
            ensureOpen();
            cell.retain();
            return new ActorHandle(cell);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Stops the actor gracefully, whatever other handles exist.
     */
    public void stop() {
        stop(ShutdownMode.GRACEFUL);
    }

    /**
     * Stops the actor. A graceful stop can later be escalated to a hard one.
     */
    public void stop(ShutdownMode mode) {
        ensureOpen();
        cell.stop(mode);
    }

    /**
     * Waits for the actor's execution loop to finish.
     *
     * @return true if it terminated within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return cell.awaitTermination(timeout);
    }

    public boolean isClosed() {
        return lease.released.get();
    }

    /**
     * Releases this handle. Idempotent. Closing the last handle stops the actor.
     */
    @Override
    public void close() {
        lease.explicit = true;
        cleanable.clean();
    }

    @Override
    public String toString() {
        return "ActorHandle{actor=" + cell.getActorId() + ", state=" + cell.state()
                + (isClosed() ? ", closed" : "") + "}";
    }

    // The fences keep this handle, and so its lease, alive until the cell has the task. Otherwise
    // a temporary such as Actors.spawn().send(task) could be released mid-call.
    private Result<Void> enqueue(Task task, Duration enqueueTimeout) {
        try {
            ensureOpen();
            return cell.send(task, enqueueTimeout);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    private PendingReply submitWithTimeout(Task task, Duration enqueueTimeout) {
        try {
            ensureOpen();
            return cell.submit(task, enqueueTimeout);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    private void ensureOpen() {
        if (lease.released.get()) {
            throw new IllegalStateException("Handle to actor " + cell.getActorId() + " is closed");
        }
    }

    private static Duration requireTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be zero or positive, got " + timeout);
        }
        return timeout;
    }

    /**
     * Cleaner action; must not reference the handle.
     */
    private static final class Lease implements Runnable {
        private final ActorCell cell;
        private final AtomicBoolean released = new AtomicBoolean();
        private volatile boolean explicit;

        Lease(ActorCell cell) {
            this.cell = cell;
        }

        @Override
        public void run() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            if (!explicit) {
                logger.warn("Handle to actor {} was garbage collected without being closed", cell.getActorId());
            }
            cell.release();
        }
    }
}
