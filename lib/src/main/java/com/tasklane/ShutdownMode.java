package com.tasklane;

/**
 * How an actor stops.
 */
public enum ShutdownMode {
    /**
     * Stop accepting tasks, run everything already queued, then stop.
     */
    GRACEFUL,

    /**
     * Stop accepting tasks and let the running task finish. Queued tasks are resolved with
     * {@link Outcome.Shutdown} without running.
     */
    HARD
}
