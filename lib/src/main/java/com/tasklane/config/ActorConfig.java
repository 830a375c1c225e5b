package com.tasklane.config;

import com.tasklane.ActorEventListener;
import com.tasklane.PoisonPolicy;
import com.tasklane.ShutdownMode;
import com.tasklane.mailbox.config.MailboxConfig;

import java.time.Duration;

/**
 * Per-actor settings. Setters return {@code this} for chaining; null arguments restore defaults.
 */
public class ActorConfig {
    public static final PoisonPolicy DEFAULT_POISON_POLICY = PoisonPolicy.ENQUEUE_THEN_REJECT;
    public static final ShutdownMode DEFAULT_RELEASE_SHUTDOWN_MODE = ShutdownMode.GRACEFUL;
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(10);

    private MailboxConfig mailboxConfig = new MailboxConfig();
    private PoisonPolicy poisonPolicy = DEFAULT_POISON_POLICY;
    private ShutdownMode releaseShutdownMode = DEFAULT_RELEASE_SHUTDOWN_MODE;
    private Duration enqueueTimeout;
    private Duration stopTimeout = DEFAULT_STOP_TIMEOUT;
    private ActorThreadFactory threadFactory = new ActorThreadFactory();
    private ActorEventListener listener = ActorEventListener.NO_OP;

    public MailboxConfig getMailboxConfig() {
        return mailboxConfig;
    }

    public ActorConfig setMailboxConfig(MailboxConfig mailboxConfig) {
        this.mailboxConfig = mailboxConfig != null ? mailboxConfig : new MailboxConfig();
        return this;
    }

    public PoisonPolicy getPoisonPolicy() {
        return poisonPolicy;
    }

    /**
     * @param poisonPolicy what sends do once the actor is poisoned
     * @return This ActorConfig instance
     */
    public ActorConfig setPoisonPolicy(PoisonPolicy poisonPolicy) {
        this.poisonPolicy = poisonPolicy != null ? poisonPolicy : DEFAULT_POISON_POLICY;
        return this;
    }

    public ShutdownMode getReleaseShutdownMode() {
        return releaseShutdownMode;
    }

    /**
     * @param releaseShutdownMode how the actor stops once its last handle is released
     * @return This ActorConfig instance
     */
    public ActorConfig setReleaseShutdownMode(ShutdownMode releaseShutdownMode) {
        this.releaseShutdownMode = releaseShutdownMode != null ? releaseShutdownMode : DEFAULT_RELEASE_SHUTDOWN_MODE;
        return this;
    }

    /**
     * @return how long a send waits for room in a full bounded mailbox; null means indefinitely
     */
    public Duration getEnqueueTimeout() {
        return enqueueTimeout;
    }

    public ActorConfig setEnqueueTimeout(Duration enqueueTimeout) {
        if (enqueueTimeout != null && enqueueTimeout.isNegative()) {
            throw new IllegalArgumentException("Enqueue timeout cannot be negative: " + enqueueTimeout);
        }
        this.enqueueTimeout = enqueueTimeout;
        return this;
    }

    /**
     * @return how long a system shutdown waits for this actor to terminate
     */
    public Duration getStopTimeout() {
        return stopTimeout;
    }

    public ActorConfig setStopTimeout(Duration stopTimeout) {
        this.stopTimeout = stopTimeout != null ? stopTimeout : DEFAULT_STOP_TIMEOUT;
        return this;
    }

    public ActorThreadFactory getThreadFactory() {
        return threadFactory;
    }

    public ActorConfig setThreadFactory(ActorThreadFactory threadFactory) {
        this.threadFactory = threadFactory != null ? threadFactory : new ActorThreadFactory();
        return this;
    }

    public ActorEventListener getListener() {
        return listener;
    }

    public ActorConfig setListener(ActorEventListener listener) {
        this.listener = listener != null ? listener : ActorEventListener.NO_OP;
        return this;
    }

    /**
     * Deep copy; the listener instance is shared.
     */
    public ActorConfig copy() {
        return new ActorConfig()
                .setMailboxConfig(mailboxConfig.copy())
                .setPoisonPolicy(poisonPolicy)
                .setReleaseShutdownMode(releaseShutdownMode)
                .setEnqueueTimeout(enqueueTimeout)
                .setStopTimeout(stopTimeout)
                .setThreadFactory(threadFactory.copy())
                .setListener(listener);
    }

    @Override
    public String toString() {
        return "ActorConfig{" + mailboxConfig
                + ", poisonPolicy=" + poisonPolicy
                + ", releaseShutdownMode=" + releaseShutdownMode
                + ", enqueueTimeout=" + (enqueueTimeout != null ? enqueueTimeout : "unlimited")
                + ", stopTimeout=" + stopTimeout + "}";
    }
}
