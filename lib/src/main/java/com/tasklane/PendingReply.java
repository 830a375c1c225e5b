package com.tasklane;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * One-shot slot through which the runtime hands a task's {@link Outcome} to the caller that
 * submitted it.
 * <p>
 * The runtime writes the slot exactly once. Readers may read it any number of times and always
 * see the same outcome. Abandoning the wait does not retract the task; it may still run and
 * its outcome is simply not observed.
 */
public final class PendingReply {
    private static final Logger logger = LoggerFactory.getLogger(PendingReply.class);

    private final CompletableFuture<Outcome> future = new CompletableFuture<>();
    private final String actorId;
    private final long sequence;

    PendingReply(String actorId, long sequence) {
        this.actorId = actorId;
        this.sequence = sequence;
    }

    /**
     * Writes the outcome. A second write is a runtime bug; it is ignored and logged.
     */
    boolean complete(Outcome outcome) {
        boolean written = future.complete(outcome);
        if (!written) {
            logger.warn("Actor {} task #{} already resolved with {}, ignoring {}",
                    actorId, sequence, future.getNow(null), outcome);
        }
        return written;
    }

    /**
     * Blocks until the outcome is available.
     *
     * @return the outcome
     */
    public Outcome await() {
        return future.join();
    }

    /**
     * Blocks until the outcome is available or the timeout expires.
     *
     * @param timeout the maximum time to wait
     * @return the outcome
     * @throws TimeoutException if the outcome is not available in time
     */
    public Outcome await(Duration timeout) throws TimeoutException {
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActorException("Interrupted while awaiting reply", e, actorId);
        } catch (ExecutionException e) {
            // the future is only ever completed normally
            throw new ActorException("Reply completed exceptionally", e.getCause(), actorId);
        }
    }

    /**
     * @return the outcome if already written, without blocking
     */
    public Optional<Outcome> poll() {
        return Optional.ofNullable(future.getNow(null));
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * Registers a callback run once the outcome is written, on the thread that writes it or
     * immediately on the caller if it already is.
     */
    public void onComplete(Consumer<Outcome> callback) {
        future.thenAccept(callback);
    }

    /**
     * A dependent view for composition. Completing the returned future does not affect this reply.
     *
     * @return a future completed with the outcome
     */
    public CompletableFuture<Outcome> future() {
        return future.copy();
    }

    public String getActorId() {
        return actorId;
    }

    /**
     * @return the per-actor sequence number assigned to the submitted task
     */
    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "PendingReply{actor=" + actorId + ", task=#" + sequence
                + ", outcome=" + poll().map(Object::toString).orElse("pending") + "}";
    }
}
