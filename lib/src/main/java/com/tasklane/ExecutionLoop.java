package com.tasklane;

import com.tasklane.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;
import java.util.function.Consumer;

/**
 * The single consumer of an actor's mailbox.
 * <p>
 * Runs on one dedicated thread and executes tasks one at a time, in mailbox order. The first
 * failing task poisons the actor; from then on every task is resolved with
 * {@link Outcome.Poisoned} without running. The loop exits once the gate is closed, no producer
 * is mid-enqueue and the mailbox is empty, so every accepted task gets exactly one outcome.
 */
final class ExecutionLoop {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionLoop.class);

    /** Upper bound on how long an idle loop takes to notice it was stopped. */
    static final long IDLE_POLL_MS = 20;
    private static final long START_TIMEOUT_SECONDS = 5;

    private final String actorId;
    private final Mailbox<Envelope> mailbox;
    private final SubmissionGate gate;
    private final ActorEventListener listener;
    private final ThreadFactory threadFactory;
    private final Runnable onTerminated;

    private final AtomicReference<Throwable> poisonCause = new AtomicReference<>();
    private final CountDownLatch started = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile Thread thread;

    ExecutionLoop(String actorId,
                  Mailbox<Envelope> mailbox,
                  SubmissionGate gate,
                  ActorEventListener listener,
                  ThreadFactory threadFactory,
                  Runnable onTerminated) {
        this.actorId = actorId;
        this.mailbox = mailbox;
        this.gate = gate;
        this.listener = listener;
        this.threadFactory = threadFactory;
        this.onTerminated = onTerminated;
    }

    /**
     * Starts the loop thread and waits until it is running.
     */
    void start() {
        if (thread != null) {
            logger.debug("Actor {} execution loop already started", actorId);
            return;
        }
        thread = threadFactory.newThread(this::run);
        thread.start();
        try {
            if (!started.await(START_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Actor {} execution loop did not start within {}s", actorId, START_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for actor {} to start", actorId);
            Thread.currentThread().interrupt();
        }
    }

    ActorState state() {
        return poisonCause.get() == null ? ActorState.RUNNING : ActorState.POISONED;
    }

    boolean isPoisoned() {
        return poisonCause.get() != null;
    }

    /**
     * @return the failure that poisoned the actor, or null while running
     */
    Throwable getPoisonCause() {
        return poisonCause.get();
    }

    boolean isTerminated() {
        return terminated.getCount() == 0;
    }

    boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void run() {
        started.countDown();
        logger.info("Actor {} execution loop started", actorId);
        try {
            processUntilClosed();
        } catch (InterruptedException e) {
            logger.warn("Actor {} execution loop interrupted, discarding queued tasks", actorId);
            gate.close(ShutdownMode.HARD);
        } finally {
            if (gate.isOpen()) {
                gate.close(ShutdownMode.HARD);
            }
            discardRemaining();
            logger.info("Actor {} execution loop stopped", actorId);
            notifyListener(l -> l.onActorStopped(actorId));
            try {
                onTerminated.run();
            } catch (RuntimeException e) {
                logger.warn("Actor {} termination callback failed", actorId, e);
            }
            terminated.countDown();
        }
    }

    private void processUntilClosed() throws InterruptedException {
        while (true) {
            Envelope envelope = mailbox.poll(IDLE_POLL_MS, TimeUnit.MILLISECONDS);
            if (envelope == null) {
                if (gate.isSettled() && mailbox.isEmpty()) {
                    return;
                }
                continue;
            }
            if (gate.isHardClosed()) {
                reject(envelope, Outcome.shutdown());
            } else {
                execute(envelope);
            }
        }
    }

    private void execute(Envelope envelope) {
        Throwable poisoned = poisonCause.get();
        if (poisoned != null) {
            reject(envelope, Outcome.poisoned(poisoned));
            return;
        }

        TaskResult result;
        try {
            result = envelope.task().run();
            if (result == null) {
                result = TaskResult.failed("Task returned no result");
            }
        } catch (Throwable t) {
            result = TaskResult.failed(t);
        }

        if (Thread.interrupted()) {
            logger.warn("Actor {} task #{} left the interrupt flag set; cleared it", actorId, envelope.sequence());
        }

        if (result.isOk()) {
            envelope.resolve(Outcome.success());
            return;
        }

        Throwable cause = ((TaskResult.Failed) result).cause();
        poisonCause.compareAndSet(null, cause);
        logger.error("Actor {} task #{} failed; actor is poisoned", actorId, envelope.sequence(), cause);
        notifyListener(l -> l.onTaskFailed(actorId, envelope.sequence(), cause));
        notifyListener(l -> l.onActorPoisoned(actorId, cause));
        envelope.resolve(Outcome.failure(cause));
    }

    private void reject(Envelope envelope, Outcome outcome) {
        logger.debug("Actor {} rejected task #{}: {}", actorId, envelope.sequence(), outcome);
        envelope.resolve(outcome);
        notifyListener(l -> l.onTaskRejected(actorId, envelope.sequence(), outcome));
    }

    /**
     * Resolves whatever is left once the gate is hard-closed, waiting out producers still
     * mid-enqueue. Pulling elements also unblocks producers waiting on a full mailbox.
     */
    private void discardRemaining() {
        boolean interrupted = Thread.interrupted();
        while (true) {
            Envelope envelope = mailbox.poll();
            if (envelope != null) {
                reject(envelope, Outcome.shutdown());
            } else if (gate.isSettled() && mailbox.isEmpty()) {
                break;
            } else {
                LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(1));
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void notifyListener(Consumer<ActorEventListener> event) {
        try {
            event.accept(listener);
        } catch (RuntimeException e) {
            logger.warn("Actor {} event listener threw; ignoring", actorId, e);
        }
    }
}
