package com.tasklane;

/**
 * Hooks for observing what happens inside an actor, in particular the failures of
 * fire-and-forget tasks, which no caller waits for.
 * <p>
 * Callbacks run on the actor's execution thread, so they must return quickly. Exceptions thrown
 * from a callback are logged and do not affect the actor.
 */
public interface ActorEventListener {

    ActorEventListener NO_OP = new ActorEventListener() {
    };

    /**
     * A task ran and failed. Called before {@link #onActorPoisoned}.
     *
     * @param actorId  the actor
     * @param sequence the task's sequence number
     * @param cause    the failure
     */
    default void onTaskFailed(String actorId, long sequence, Throwable cause) {
    }

    /**
     * The actor entered {@link ActorState#POISONED}.
     */
    default void onActorPoisoned(String actorId, Throwable cause) {
    }

    /**
     * An accepted task was resolved without running, either because the actor is poisoned or
     * because a hard stop discarded it.
     */
    default void onTaskRejected(String actorId, long sequence, Outcome outcome) {
    }

    /**
     * The execution loop has exited; every accepted task has an outcome.
     */
    default void onActorStopped(String actorId) {
    }
}
