package com.tasklane;

import com.tasklane.builder.ActorBuilder;
import com.tasklane.config.ActorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A registry of named actors sharing default settings, with a single place to shut them all down.
 * <p>
 * Actors are registered under a unique id while they run and removed once they terminate, so an
 * id becomes available again after its actor has stopped. Handles returned by the system behave
 * exactly like those from {@link Actors}; closing the last one stops the actor.
 */
public class ActorSystem {
    private static final Logger logger = LoggerFactory.getLogger(ActorSystem.class);

    private final ActorConfig defaultConfig;
    private final ConcurrentHashMap<String, ActorCell> actors = new ConcurrentHashMap<>();
    private volatile boolean shutdown = false;

    public ActorSystem() {
        this(new ActorConfig());
    }

    /**
     * @param defaultConfig settings for actors spawned without their own; copied
     */
    public ActorSystem(ActorConfig defaultConfig) {
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "Default config cannot be null").copy();
    }

    public ActorHandle spawn() {
        return spawn(generateActorId(), defaultConfig);
    }

    public ActorHandle spawn(String actorId) {
        return spawn(actorId, defaultConfig);
    }

    /**
     * Spawns and registers an actor.
     *
     * @param actorId unique among the running actors of this system
     * @param config  the actor's settings, or null for the system defaults; copied
     * @return the first handle to the actor
     * @throws IllegalArgumentException if a running actor already uses the id
     * @throws IllegalStateException    if the system has been shut down
     */
    public ActorHandle spawn(String actorId, ActorConfig config) {
        Objects.requireNonNull(actorId, "Actor id cannot be null");
        ensureRunning();

        ActorConfig effective = (config != null ? config : defaultConfig).copy();
        ActorCell cell = new ActorCell(actorId, effective, this::deregister);
        if (actors.putIfAbsent(actorId, cell) != null) {
            throw new IllegalArgumentException("Actor with id " + actorId + " is already running");
        }
        if (shutdown) {
            actors.remove(actorId, cell);
            throw new IllegalStateException("Actor system is shut down");
        }
        cell.start();
        logger.debug("Registered actor {}", actorId);
        return new ActorHandle(cell);
    }

    /**
     * Starts a fluent builder seeded with the system defaults.
     */
    public ActorBuilder actorOf() {
        return new ActorBuilder(this, defaultConfig);
    }

    /**
     * @return the ids of the registered actors, a snapshot
     */
    public Set<String> getActorIds() {
        return Set.copyOf(actors.keySet());
    }

    public boolean isRunning(String actorId) {
        ActorCell cell = actors.get(actorId);
        return cell != null && !cell.isTerminated();
    }

    /**
     * Stops one actor without closing the handles to it.
     *
     * @return true if an actor with that id was registered
     */
    public boolean stopActor(String actorId, ShutdownMode mode) {
        ActorCell cell = actors.get(actorId);
        if (cell == null) {
            logger.debug("No actor {} to stop", actorId);
            return false;
        }
        cell.stop(mode);
        return true;
    }

    public ActorConfig getDefaultConfig() {
        return defaultConfig.copy();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Generates a unique ID for an actor.
     *
     * @return A string representation of a UUID to be used as an actor ID
     */
    public String generateActorId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stops every actor gracefully and waits for each, up to its stop timeout, to drain.
     * Further spawns are refused.
     */
    public void shutdown() {
        shutdown(ShutdownMode.GRACEFUL);
    }

    /**
     * Stops every actor hard: queued tasks resolve with {@link Outcome.Shutdown} instead of running.
     */
    public void shutdownNow() {
        shutdown(ShutdownMode.HARD);
    }

    private void shutdown(ShutdownMode mode) {
        shutdown = true;
        List<ActorCell> cells = new ArrayList<>(actors.values());
        logger.info("Shutting down {} actor(s) ({})", cells.size(), mode);

        cells.forEach(cell -> cell.stop(mode));
        for (ActorCell cell : cells) {
            Duration timeout = cell.getConfig().getStopTimeout();
            try {
                if (!cell.awaitTermination(timeout)) {
                    logger.warn("Actor {} did not stop within {}", cell.getActorId(), timeout);
                }
            } catch (InterruptedException e) {
                logger.warn("Interrupted while waiting for actor {} to stop", cell.getActorId());
                Thread.currentThread().interrupt();
                return;
            }
        }
        logger.info("Actor system shut down");
    }

    private void ensureRunning() {
        if (shutdown) {
            throw new IllegalStateException("Actor system is shut down");
        }
    }

    private void deregister(ActorCell cell) {
        if (actors.remove(cell.getActorId(), cell)) {
            logger.debug("Deregistered actor {}", cell.getActorId());
        }
    }
}
