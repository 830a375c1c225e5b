package com.tasklane;

/**
 * Thrown by {@link Outcome#ensureSuccess()} when a task did not run successfully.
 */
public class OutcomeException extends ActorException {

    private final Outcome outcome;

    public OutcomeException(Outcome outcome) {
        super("Task did not succeed: " + outcome, outcome.failureCause().orElse(null));
        this.outcome = outcome;
    }

    public Outcome getOutcome() {
        return outcome;
    }
}
