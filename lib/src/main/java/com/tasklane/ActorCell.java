package com.tasklane;

import com.tasklane.config.ActorConfig;
import com.tasklane.mailbox.Mailbox;
import com.tasklane.mailbox.config.DefaultMailboxProvider;
import com.tasklane.mailbox.config.MailboxProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * The shared core of one actor: mailbox, admission gate, execution loop and handle count.
 * Every {@link ActorHandle} to the same actor points at the same cell.
 */
final class ActorCell {
    private static final Logger logger = LoggerFactory.getLogger(ActorCell.class);
    private static final MailboxProvider<Envelope> MAILBOX_PROVIDER = new DefaultMailboxProvider<>();

    private final String actorId;
    private final ActorConfig config;
    private final Mailbox<Envelope> mailbox;
    private final SubmissionGate gate = new SubmissionGate();
    private final ExecutionLoop loop;
    private final AtomicInteger handles = new AtomicInteger(1);
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Creates a cell holding one handle reference. The loop is not running until {@link #start()}.
     *
     * @param onTerminated run on the loop thread once the actor has terminated
     */
    ActorCell(String actorId, ActorConfig config, Consumer<ActorCell> onTerminated) {
        this.actorId = Objects.requireNonNull(actorId, "Actor id cannot be null");
        this.config = config;
        this.mailbox = MAILBOX_PROVIDER.createMailbox(config.getMailboxConfig());
        this.loop = new ExecutionLoop(
                actorId,
                mailbox,
                gate,
                config.getListener(),
                config.getThreadFactory().createThreadFactory(actorId),
                () -> onTerminated.accept(this));
    }

    void start() {
        loop.start();
        logger.debug("Actor {} spawned with {}", actorId, mailbox);
    }

    Result<Void> send(Task task, Duration enqueueTimeout) {
        Objects.requireNonNull(task, "Task cannot be null");
        long seq = sequence.incrementAndGet();
        SendError error = enqueue(new Envelope(seq, task, null), enqueueTimeout);
        if (error == null) {
            return Result.success(null);
        }
        return Result.failure(new SendException(error, actorId));
    }

    PendingReply submit(Task task, Duration enqueueTimeout) {
        Objects.requireNonNull(task, "Task cannot be null");
        long seq = sequence.incrementAndGet();
        PendingReply reply = new PendingReply(actorId, seq);
        SendError error = enqueue(new Envelope(seq, task, reply), enqueueTimeout);
        if (error == SendError.POISONED) {
            reply.complete(Outcome.poisoned(loop.getPoisonCause()));
        } else if (error != null) {
            reply.complete(Outcome.rejected(error));
        }
        return reply;
    }

    /**
     * @return null if the envelope entered the mailbox, otherwise why it did not
     */
    private SendError enqueue(Envelope envelope, Duration enqueueTimeout) {
        if (config.getPoisonPolicy() == PoisonPolicy.REJECT_AT_SEND && loop.isPoisoned()) {
            logger.debug("Actor {} is poisoned, refusing task #{}", actorId, envelope.sequence());
            return SendError.POISONED;
        }
        if (!gate.enter()) {
            logger.debug("Actor {} is stopping, refusing task #{}", actorId, envelope.sequence());
            return SendError.CLOSED;
        }
        try {
            if (offer(envelope, enqueueTimeout)) {
                logger.trace("Actor {} accepted task #{}", actorId, envelope.sequence());
                return null;
            }
            logger.debug("Actor {} mailbox full, refusing task #{}", actorId, envelope.sequence());
            return SendError.QUEUE_FULL;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Interrupted while enqueueing task #{} on actor {}", envelope.sequence(), actorId);
            return SendError.CANCELLED;
        } finally {
            gate.exit();
        }
    }

    private boolean offer(Envelope envelope, Duration enqueueTimeout) throws InterruptedException {
        if (enqueueTimeout == null) {
            mailbox.put(envelope);
            return true;
        }
        if (enqueueTimeout.isZero()) {
            return mailbox.offer(envelope);
        }
        return mailbox.offer(envelope, enqueueTimeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    void retain() {
        handles.updateAndGet(count -> {
            if (count <= 0) {
                throw new IllegalStateException("All handles to actor " + actorId + " were released");
            }
            return count + 1;
        });
    }

    void release() {
        int remaining = handles.decrementAndGet();
        if (remaining == 0) {
            logger.debug("Last handle to actor {} released", actorId);
            stop(config.getReleaseShutdownMode());
        }
    }

    void stop(ShutdownMode mode) {
        if (gate.close(mode)) {
            logger.info("Stopping actor {} ({})", actorId, mode);
        }
    }

    String getActorId() {
        return actorId;
    }

    ActorConfig getConfig() {
        return config;
    }

    ActorState state() {
        return loop.state();
    }

    Optional<Throwable> poisonCause() {
        return Optional.ofNullable(loop.getPoisonCause());
    }

    boolean isAcceptingTasks() {
        return gate.isOpen();
    }

    boolean isTerminated() {
        return loop.isTerminated();
    }

    boolean awaitTermination(Duration timeout) throws InterruptedException {
        return loop.awaitTermination(timeout);
    }

    int pendingTasks() {
        return mailbox.size();
    }
}
