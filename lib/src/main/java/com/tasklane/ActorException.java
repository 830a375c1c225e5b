package com.tasklane;

/**
 * Base class for errors raised by the actor runtime.
 */
public class ActorException extends RuntimeException {

    /** Id of the actor involved, or null when not tied to one actor. */
    private final String actorId;

    public ActorException(String message) {
        this(message, null, null);
    }

    public ActorException(String message, Throwable cause) {
        this(message, cause, null);
    }

    /**
     * @param message the detail message
     * @param cause   the underlying cause, may be null
     * @param actorId the actor involved, may be null
     */
    public ActorException(String message, Throwable cause, String actorId) {
        super(message, cause);
        this.actorId = actorId;
    }

    /**
     * @return the id of the actor involved, or null if not specified
     */
    public String getActorId() {
        return actorId;
    }
}
