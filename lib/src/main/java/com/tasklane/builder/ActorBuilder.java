package com.tasklane.builder;

import com.tasklane.ActorEventListener;
import com.tasklane.ActorHandle;
import com.tasklane.ActorSystem;
import com.tasklane.PoisonPolicy;
import com.tasklane.ShutdownMode;
import com.tasklane.config.ActorConfig;
import com.tasklane.config.ActorThreadFactory;
import com.tasklane.mailbox.config.MailboxConfig;
import com.tasklane.mailbox.config.MailboxType;

import java.time.Duration;

/**
 * Builder for spawning actors in an {@link ActorSystem} with a fluent API.
 * Starts from a copy of the system's default settings.
 */
public class ActorBuilder {

    private final ActorSystem system;
    private final ActorConfig config;
    private String id;

    /**
     * Creates a new ActorBuilder.
     *
     * @param system     The actor system the actor will be registered in
     * @param baseConfig The settings to start from; copied
     */
    public ActorBuilder(ActorSystem system, ActorConfig baseConfig) {
        this.system = system;
        this.config = baseConfig.copy();
    }

    /**
     * Sets the explicit ID for the actor. Without one, the system generates a UUID.
     *
     * @param id The ID for the actor
     * @return This builder for method chaining
     */
    public ActorBuilder withId(String id) {
        this.id = id;
        return this;
    }

    /**
     * Bounds the mailbox. Producers then wait, or fail, while it is full.
     *
     * @param capacity The maximum number of queued tasks; zero or less means unbounded
     * @return This builder for method chaining
     */
    public ActorBuilder withMailboxCapacity(int capacity) {
        config.getMailboxConfig().setCapacity(capacity);
        return this;
    }

    public ActorBuilder withMailboxType(MailboxType mailboxType) {
        config.getMailboxConfig().setMailboxType(mailboxType);
        return this;
    }

    public ActorBuilder withMailboxConfig(MailboxConfig mailboxConfig) {
        config.setMailboxConfig(mailboxConfig != null ? mailboxConfig.copy() : null);
        return this;
    }

    public ActorBuilder withPoisonPolicy(PoisonPolicy poisonPolicy) {
        config.setPoisonPolicy(poisonPolicy);
        return this;
    }

    /**
     * @param mode How the actor stops once its last handle is closed
     * @return This builder for method chaining
     */
    public ActorBuilder withReleaseShutdownMode(ShutdownMode mode) {
        config.setReleaseShutdownMode(mode);
        return this;
    }

    /**
     * @param timeout How long a send waits for mailbox room; null waits indefinitely
     * @return This builder for method chaining
     */
    public ActorBuilder withEnqueueTimeout(Duration timeout) {
        config.setEnqueueTimeout(timeout);
        return this;
    }

    public ActorBuilder withStopTimeout(Duration timeout) {
        config.setStopTimeout(timeout);
        return this;
    }

    public ActorBuilder withListener(ActorEventListener listener) {
        config.setListener(listener);
        return this;
    }

    public ActorBuilder withThreadFactory(ActorThreadFactory threadFactory) {
        config.setThreadFactory(threadFactory);
        return this;
    }

    /**
     * Spawns the actor.
     *
     * @return The first handle to the new actor
     */
    public ActorHandle spawn() {
        String actorId = id != null ? id : system.generateActorId();
        return system.spawn(actorId, config);
    }
}
