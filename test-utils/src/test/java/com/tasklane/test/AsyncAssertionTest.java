package com.tasklane.test;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AsyncAssertionTest {

    @Test
    void shouldWaitForConditionToBecomeTrue() {
        AtomicBoolean flag = new AtomicBoolean(false);
        startDelayed(() -> flag.set(true));

        AsyncAssertion.eventually(flag::get, Duration.ofSeconds(2));

        assertTrue(flag.get());
    }

    @Test
    void shouldThrowIfConditionNeverBecomesTrue() {
        AssertionError error = assertThrows(AssertionError.class,
                () -> AsyncAssertion.eventually(() -> false, Duration.ofMillis(100)));
        assertTrue(error.getMessage().contains("did not become true"));
    }

    @Test
    void shouldReportLastErrorFromCondition() {
        AssertionError error = assertThrows(AssertionError.class,
                () -> AsyncAssertion.eventually(() -> {
                    throw new IllegalStateException("not yet");
                }, Duration.ofMillis(50)));
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void shouldAwaitValue() {
        AtomicInteger counter = new AtomicInteger(0);
        startDelayed(() -> counter.set(42));

        int result = AsyncAssertion.awaitValue(counter::get, 42, Duration.ofSeconds(2));

        assertEquals(42, result);
    }

    @Test
    void shouldIncludeValueHistoryWhenValueNeverMatches() {
        AtomicInteger counter = new AtomicInteger(7);

        AssertionError error = assertThrows(AssertionError.class,
                () -> AsyncAssertion.awaitValue(counter::get, 99, Duration.ofMillis(100)));
        assertTrue(error.getMessage().contains("[7]"));
    }

    @Test
    void shouldEventuallyAssert() {
        AtomicInteger counter = new AtomicInteger(0);
        startDelayed(() -> counter.set(10));

        AsyncAssertion.eventuallyAssert(() -> assertEquals(10, counter.get()), Duration.ofSeconds(2));
    }

    @Test
    void assertNeverPassesWhenConditionStaysFalse() {
        AtomicBoolean flag = new AtomicBoolean(false);
        AsyncAssertion.assertNever(flag::get, Duration.ofMillis(100));
    }

    @Test
    void assertNeverFailsAsSoonAsConditionHolds() {
        AtomicBoolean flag = new AtomicBoolean(false);
        startDelayed(() -> flag.set(true));

        assertThrows(AssertionError.class, () -> AsyncAssertion.assertNever(flag::get, Duration.ofSeconds(2)));
    }

    private static void startDelayed(Runnable action) {
        Thread thread = new Thread(() -> {
            try {
                Thread.sleep(50);
                action.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        thread.setDaemon(true);
        thread.start();
    }
}
