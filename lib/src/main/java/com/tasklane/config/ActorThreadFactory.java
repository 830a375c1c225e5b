package com.tasklane.config;

import java.util.concurrent.ThreadFactory;

/**
 * Creates the dedicated execution thread of each actor.
 * <p>
 * Threads are named {@code <prefix>-<actorId>} so they can be identified in logs, thread dumps
 * and profilers. They are daemon threads by default: queued tasks are not guaranteed to run if
 * the JVM exits before an actor drains.
 */
public class ActorThreadFactory {
    public static final String DEFAULT_NAME_PREFIX = "tasklane";
    private static final boolean DEFAULT_DAEMON = true;

    private String namePrefix = DEFAULT_NAME_PREFIX;
    private boolean daemon = DEFAULT_DAEMON;
    private int priority = Thread.NORM_PRIORITY;

    /**
     * Creates a thread factory for one actor.
     *
     * @param actorId the actor the thread will serve
     * @return a factory producing threads named after the actor
     */
    public ThreadFactory createThreadFactory(String actorId) {
        String name = namePrefix + "-" + actorId;
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(daemon);
            thread.setPriority(priority);
            return thread;
        };
    }

    public String getNamePrefix() {
        return namePrefix;
    }

    public ActorThreadFactory setNamePrefix(String namePrefix) {
        this.namePrefix = (namePrefix == null || namePrefix.isBlank()) ? DEFAULT_NAME_PREFIX : namePrefix;
        return this;
    }

    public boolean isDaemon() {
        return daemon;
    }

    public ActorThreadFactory setDaemon(boolean daemon) {
        this.daemon = daemon;
        return this;
    }

    public int getPriority() {
        return priority;
    }

    public ActorThreadFactory setPriority(int priority) {
        if (priority < Thread.MIN_PRIORITY || priority > Thread.MAX_PRIORITY) {
            throw new IllegalArgumentException("Thread priority out of range: " + priority);
        }
        this.priority = priority;
        return this;
    }

    public ActorThreadFactory copy() {
        return new ActorThreadFactory()
                .setNamePrefix(namePrefix)
                .setDaemon(daemon)
                .setPriority(priority);
    }
}
