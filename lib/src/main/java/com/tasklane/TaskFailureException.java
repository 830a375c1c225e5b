package com.tasklane;

/**
 * Cause recorded for a task that reported failure with a message instead of an exception.
 */
public class TaskFailureException extends ActorException {

    public TaskFailureException(String message) {
        super(message);
    }
}
