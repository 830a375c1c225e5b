package com.tasklane.builder;

import com.tasklane.ActorEventListener;
import com.tasklane.ActorHandle;
import com.tasklane.ActorSystem;
import com.tasklane.Outcome;
import com.tasklane.PoisonPolicy;
import com.tasklane.SendError;
import com.tasklane.SendException;
import com.tasklane.ShutdownMode;
import com.tasklane.TaskResult;
import com.tasklane.config.ActorConfig;
import com.tasklane.config.ActorThreadFactory;
import com.tasklane.mailbox.config.MailboxType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ActorBuilderTest {

    private ActorSystem system;

    @BeforeEach
    void setUp() {
        system = new ActorSystem();
    }

    @AfterEach
    void tearDown() {
        system.shutdownNow();
    }

    @Test
    void shouldSpawnWithExplicitId() {
        ActorHandle actor = system.actorOf().withId("built").spawn();

        assertEquals("built", actor.actorId());
        assertTrue(system.isRunning("built"));
    }

    @Test
    void shouldGenerateIdWhenNotSet() {
        ActorHandle actor = system.actorOf().spawn();

        assertNotNull(actor.actorId());
        assertTrue(system.getActorIds().contains(actor.actorId()));
    }

    @Test
    void shouldApplyMailboxCapacityAndEnqueueTimeout() throws InterruptedException {
        ActorHandle actor = system.actorOf()
                .withMailboxCapacity(1)
                .withMailboxType(MailboxType.LINKED)
                .withEnqueueTimeout(Duration.ofMillis(20))
                .spawn();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        actor.send(() -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return TaskResult.ok();
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));
        actor.send(TaskResult::ok);

        assertEquals(SendError.QUEUE_FULL, SendException.errorOf(actor.send(TaskResult::ok)).orElseThrow());
        release.countDown();
    }

    @Test
    void shouldApplyPoisonPolicy() {
        ActorHandle actor = system.actorOf().withPoisonPolicy(PoisonPolicy.REJECT_AT_SEND).spawn();
        actor.sendAndWait(() -> TaskResult.failed("broken"));

        assertEquals(SendError.POISONED, SendException.errorOf(actor.send(TaskResult::ok)).orElseThrow());
    }

    @Test
    void shouldApplyThreadFactory() {
        AtomicReference<String> threadName = new AtomicReference<>();
        ActorHandle actor = system.actorOf()
                .withId("named")
                .withThreadFactory(new ActorThreadFactory().setNamePrefix("billing"))
                .spawn();

        actor.sendAndWait(() -> {
            threadName.set(Thread.currentThread().getName());
            return TaskResult.ok();
        });

        assertEquals("billing-named", threadName.get());
    }

    @Test
    void shouldApplyListenerAndReleaseMode() throws InterruptedException {
        ActorEventListener listener = mock(ActorEventListener.class);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ActorHandle actor = system.actorOf()
                .withId("hard")
                .withListener(listener)
                .withReleaseShutdownMode(ShutdownMode.HARD)
                .withStopTimeout(Duration.ofSeconds(1))
                .spawn();
        actor.send(() -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return TaskResult.ok();
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));
        actor.send(TaskResult::ok);

        actor.close();
        release.countDown();

        assertTrue(actor.awaitTermination(Duration.ofSeconds(5)));
        verify(listener).onTaskRejected(eq("hard"), eq(2L), any(Outcome.Shutdown.class));
        verify(listener).onActorStopped("hard");
    }

    @Test
    void builderDoesNotChangeSystemDefaults() {
        system.actorOf().withPoisonPolicy(PoisonPolicy.REJECT_AT_SEND).withMailboxCapacity(3).spawn();

        ActorConfig defaults = system.getDefaultConfig();
        assertEquals(ActorConfig.DEFAULT_POISON_POLICY, defaults.getPoisonPolicy());
        assertFalse(defaults.getMailboxConfig().isBounded());
    }
}
