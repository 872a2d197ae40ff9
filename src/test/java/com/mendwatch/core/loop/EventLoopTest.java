package com.mendwatch.core.loop;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EventLoopTest {

    private EventLoop loop;

    @BeforeEach
    void setUp() {
        loop = new EventLoop("test-loop");
    }

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    @DisplayName("submit completes with the callable's result on the loop thread")
    void submitRunsOnLoop() throws Exception {
        var result = loop.submit(() -> loop.isLoopThread() ? "on-loop" : "elsewhere");

        assertEquals("on-loop", result.get(2, TimeUnit.SECONDS));
        assertFalse(loop.isLoopThread());
    }

    @Test
    @DisplayName("submit completes exceptionally when the work throws")
    void submitPropagatesFailure() {
        var result = loop.submit(() -> {
            throw new IllegalStateException("scan failed");
        });

        var e = assertThrows(ExecutionException.class, () -> result.get(2, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    @DisplayName("work runs one item at a time in submission order")
    void runsInOrder() throws Exception {
        List<Integer> order = new CopyOnWriteArrayList<>();
        for (int i = 0; i < 20; i++) {
            int n = i;
            loop.execute(() -> order.add(n));
        }

        loop.submit(() -> null).get(2, TimeUnit.SECONDS);

        assertEquals(20, order.size());
        for (int i = 0; i < 20; i++) {
            assertEquals(i, order.get(i));
        }
    }

    @Test
    @DisplayName("scheduled jobs keep running after a failure")
    void scheduledJobSurvivesFailure() throws Exception {
        var runs = new AtomicInteger();
        var latch = new CountDownLatch(3);
        loop.scheduleAtFixedRate("flaky", () -> {
            latch.countDown();
            if (runs.incrementAndGet() == 1) {
                throw new IllegalStateException("first run fails");
            }
        }, Duration.ZERO, Duration.ofMillis(10));

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("submit after shutdown fails the future instead of throwing")
    void submitAfterShutdown() {
        loop.shutdown(Duration.ofSeconds(1));

        assertFalse(loop.isRunning());
        var result = loop.submit(() -> "late");
        assertTrue(result.isCompletedExceptionally());
    }
}
