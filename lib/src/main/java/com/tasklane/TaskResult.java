package com.tasklane;

import java.util.Objects;

/**
 * Success or failure reported by a {@link Task}. Carries no payload beyond the failure cause.
 */
public sealed interface TaskResult permits TaskResult.Ok, TaskResult.Failed {

    /**
     * The task completed successfully.
     */
    record Ok() implements TaskResult {
        @Override
        public boolean isOk() {
            return true;
        }
    }

    /**
     * The task failed.
     *
     * @param cause why it failed
     */
    record Failed(Throwable cause) implements TaskResult {
        public Failed {
            Objects.requireNonNull(cause, "cause cannot be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }
    }

    boolean isOk();

    static TaskResult ok() {
        return new Ok();
    }

    static TaskResult failed(Throwable cause) {
        return new Failed(cause);
    }

    static TaskResult failed(String message) {
        return new Failed(new TaskFailureException(message));
    }
}
