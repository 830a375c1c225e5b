package com.tasklane;

/**
 * Health of an actor. The only transition is {@code RUNNING -> POISONED}, taken when a task fails.
 */
public enum ActorState {
    /** Tasks are executed. This is the initial state. */
    RUNNING,

    /** A task failed; every later task is rejected without running. Terminal. */
    POISONED
}
