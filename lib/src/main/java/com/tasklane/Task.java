package com.tasklane;

import java.util.Objects;

/**
 * A deferred unit of work executed by an actor.
 * <p>
 * A task fails if it returns {@link TaskResult.Failed}, returns {@code null}, or throws. The
 * first failure poisons the actor it ran on.
 */
@FunctionalInterface
public interface Task {

    /**
     * Runs the task on the actor's execution thread.
     *
     * @return the result of the work
     * @throws Exception any exception, treated as a failure with the exception as cause
     */
    TaskResult run() throws Exception;

    /**
     * Adapts a runnable. The task succeeds unless the runnable throws.
     *
     * @param action the work to run
     * @return a task wrapping {@code action}
     */
    static Task of(Runnable action) {
        Objects.requireNonNull(action, "action cannot be null");
        return () -> {
            action.run();
            return TaskResult.ok();
        };
    }
}
