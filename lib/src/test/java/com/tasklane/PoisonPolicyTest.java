package com.tasklane;

import com.tasklane.config.ActorConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Poison policies")
class PoisonPolicyTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    @Test
    @DisplayName("ENQUEUE_THEN_REJECT accepts sends and resolves them as poisoned without running")
    void enqueueThenRejectAcceptsButNeverRuns() throws Exception {
        try (ActorHandle actor = Actors.spawn(new ActorConfig().setPoisonPolicy(PoisonPolicy.ENQUEUE_THEN_REJECT))) {
            RuntimeException cause = new RuntimeException("first failure");
            actor.sendAndWait(() -> TaskResult.failed(cause));
            AtomicBoolean ran = new AtomicBoolean(false);

            Result<Void> sent = actor.send(Task.of(() -> ran.set(true)));
            PendingReply reply = actor.submit(Task.of(() -> ran.set(true)));

            assertTrue(sent.isSuccess());
            assertEquals(new Outcome.Poisoned(cause), reply.await(WAIT));
            assertFalse(ran.get());
        }
    }

    @Test
    @DisplayName("REJECT_AT_SEND refuses sends once poisoned")
    void rejectAtSendRefusesImmediately() {
        try (ActorHandle actor = Actors.spawn(new ActorConfig().setPoisonPolicy(PoisonPolicy.REJECT_AT_SEND))) {
            RuntimeException cause = new RuntimeException("first failure");
            actor.sendAndWait(() -> TaskResult.failed(cause));

            Result<Void> sent = actor.send(TaskResult::ok);
            PendingReply reply = actor.submit(TaskResult::ok);

            assertEquals(SendError.POISONED, SendException.errorOf(sent).orElseThrow());
            assertTrue(reply.isDone());
            assertEquals(new Outcome.Poisoned(cause), reply.poll().orElseThrow());
            assertEquals(0, actor.pendingTasks());
        }
    }

    @Test
    @DisplayName("A poisoned actor still stops when its last handle closes")
    void poisonedActorStillTerminates() throws InterruptedException {
        ActorHandle actor = Actors.spawn();
        actor.sendAndWait(() -> TaskResult.failed("broken"));

        actor.close();

        assertTrue(actor.awaitTermination(WAIT));
        assertEquals(ActorState.POISONED, actor.state());
    }

    @Test
    @DisplayName("Poisoning is permanent")
    void poisonIsTerminal() {
        try (ActorHandle actor = Actors.spawn()) {
            actor.sendAndWait(() -> TaskResult.failed("broken"));

            for (int i = 0; i < 5; i++) {
                assertInstanceOf(Outcome.Poisoned.class, actor.sendAndWait(TaskResult::ok));
            }
            assertEquals(ActorState.POISONED, actor.state());
        }
    }
}
