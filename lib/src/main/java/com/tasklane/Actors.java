package com.tasklane;

import com.tasklane.config.ActorConfig;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Spawns standalone actors that do not belong to an {@link ActorSystem}.
 * Such an actor lives until its last handle is closed or it is stopped explicitly.
 */
public final class Actors {
    private static final AtomicLong ANONYMOUS_IDS = new AtomicLong();

    private Actors() {
    }

    public static ActorHandle spawn() {
        return spawn(new ActorConfig());
    }

    public static ActorHandle spawn(ActorConfig config) {
        return spawn("actor-" + ANONYMOUS_IDS.incrementAndGet(), config);
    }

    /**
     * @param actorId used in logs and the thread name; not checked for uniqueness
     * @param config  copied, later changes do not affect the actor
     * @return the first handle to the new actor
     */
    public static ActorHandle spawn(String actorId, ActorConfig config) {
        ActorConfig effective = config != null ? config.copy() : new ActorConfig();
        ActorCell cell = new ActorCell(actorId, effective, terminated -> { });
        cell.start();
        return new ActorHandle(cell);
    }
}
