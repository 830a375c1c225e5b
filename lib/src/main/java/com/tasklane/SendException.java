package com.tasklane;

import java.util.Optional;

/**
 * Failure value of a fire-and-forget send: the task never entered the mailbox.
 */
public class SendException extends ActorException {

    private final SendError error;

    public SendException(SendError error, String actorId) {
        this(error, actorId, null);
    }

    public SendException(SendError error, String actorId, Throwable cause) {
        super("Actor " + actorId + " refused task: " + error, cause, actorId);
        this.error = error;
    }

    public SendError getError() {
        return error;
    }

    /**
     * Extracts the send error from a failed send result.
     *
     * @param result the value returned by a send
     * @return the error, or empty if the send succeeded
     */
    public static Optional<SendError> errorOf(Result<?> result) {
        return result.failureCause()
                .filter(SendException.class::isInstance)
                .map(cause -> ((SendException) cause).getError());
    }
}
