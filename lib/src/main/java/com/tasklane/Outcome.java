package com.tasklane;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * What happened to a task submitted with {@link ActorHandle#submit(Task)}.
 * <p>
 * Exactly one outcome is delivered per accepted task. {@link Success} and {@link Failure} mean the
 * task body ran; every other variant means it never did.
 */
public sealed interface Outcome
        permits Outcome.Success, Outcome.Failure, Outcome.Poisoned, Outcome.Shutdown, Outcome.Rejected {

    /**
     * The task ran and succeeded.
     */
    record Success() implements Outcome {
    }

    /**
     * The task ran and failed. This failure poisoned the actor.
     *
     * @param cause the failure reported or thrown by the task
     */
    record Failure(Throwable cause) implements Outcome {
        public Failure {
            Objects.requireNonNull(cause, "cause cannot be null");
        }
    }

    /**
     * The task was not run because an earlier task had already poisoned the actor.
     *
     * @param poisonCause the failure that poisoned the actor
     */
    record Poisoned(Throwable poisonCause) implements Outcome {
        public Poisoned {
            Objects.requireNonNull(poisonCause, "poisonCause cannot be null");
        }
    }

    /**
     * The task was accepted but discarded by a hard stop before it could run.
     */
    record Shutdown() implements Outcome {
    }

    /**
     * The task was never accepted into the mailbox.
     *
     * @param error why the enqueue was refused
     */
    record Rejected(SendError error) implements Outcome {
        public Rejected {
            Objects.requireNonNull(error, "error cannot be null");
        }
    }

    static Outcome success() {
        return new Success();
    }

    static Outcome failure(Throwable cause) {
        return new Failure(cause);
    }

    static Outcome poisoned(Throwable poisonCause) {
        return new Poisoned(poisonCause);
    }

    static Outcome shutdown() {
        return new Shutdown();
    }

    static Outcome rejected(SendError error) {
        return new Rejected(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * @return true if the task body was invoked, whether it succeeded or not
     */
    default boolean hasRun() {
        return this instanceof Success || this instanceof Failure;
    }

    /**
     * @return the task failure, or the poison cause for a rejected task; empty otherwise
     */
    default Optional<Throwable> failureCause() {
        if (this instanceof Failure) {
            return Optional.of(((Failure) this).cause());
        }
        if (this instanceof Poisoned) {
            return Optional.of(((Poisoned) this).poisonCause());
        }
        return Optional.empty();
    }

    /**
     * @throws OutcomeException unless this is {@link Success}
     */
    default void ensureSuccess() {
        if (!isSuccess()) {
            throw new OutcomeException(this);
        }
    }

    default void ifSuccess(Runnable action) {
        if (isSuccess()) {
            action.run();
        }
    }

    default void ifFailure(Consumer<Throwable> consumer) {
        if (this instanceof Failure) {
            consumer.accept(((Failure) this).cause());
        }
    }
}
