package com.tasklane.test;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyProbeTest {

    @Test
    void sequentialSectionsNeverOverlap() throws Exception {
        ConcurrencyProbe probe = new ConcurrencyProbe();

        probe.run(() -> { });
        String value = probe.call(() -> "done");

        assertEquals("done", value);
        assertEquals(1, probe.maxConcurrency());
        assertEquals(0, probe.currentConcurrency());
        assertEquals(2, probe.completedCount());
    }

    @Test
    void detectsOverlappingSections() throws Exception {
        ConcurrencyProbe probe = new ConcurrencyProbe();
        CountDownLatch bothInside = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);

        Runnable section = () -> probe.run(() -> {
            bothInside.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        Thread first = new Thread(section);
        Thread second = new Thread(section);
        first.start();
        second.start();

        assertTrue(bothInside.await(5, TimeUnit.SECONDS));
        assertEquals(2, probe.currentConcurrency());
        release.countDown();
        first.join();
        second.join();

        assertEquals(2, probe.maxConcurrency());
        assertEquals(0, probe.currentConcurrency());
    }

    @Test
    void exitIsCountedWhenSectionThrows() {
        ConcurrencyProbe probe = new ConcurrencyProbe();

        assertThrows(IllegalStateException.class, () -> probe.run(() -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(0, probe.currentConcurrency());
        assertEquals(1, probe.completedCount());
    }
}
