package com.acme.vision.framebus.pipeline;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void shouldRetryWithFixedDelayUntilSuccess() {
        List<Duration> sleeps = new ArrayList<>();
        RetryPolicy policy = new RetryPolicy(Duration.ofSeconds(1), 0, sleeps::add);
        AtomicInteger calls = new AtomicInteger();

        Optional<String> result = policy.execute("open channel", () -> {
            if (calls.incrementAndGet() < 4) {
                throw new IOException("busy");
            }
            return "ok";
        }, () -> true);

        assertEquals(Optional.of("ok"), result);
        assertEquals(4, calls.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(1)), sleeps);
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        List<Duration> sleeps = new ArrayList<>();
        RetryPolicy policy = new RetryPolicy(Duration.ofMillis(5), 3, sleeps::add);
        AtomicInteger calls = new AtomicInteger();

        Optional<Object> result = policy.execute("open channel", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("still busy");
        }, () -> true);

        assertTrue(result.isEmpty());
        assertEquals(3, calls.get());
        assertEquals(2, sleeps.size());
    }

    @Test
    void shouldStopRetryingWhenCancelled() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(Duration.ZERO, 0, d -> { });

        Optional<Object> result = policy.execute("open channel", () -> {
            calls.incrementAndGet();
            throw new IOException("busy");
        }, () -> calls.get() < 5);

        assertTrue(result.isEmpty());
        assertEquals(5, calls.get());
    }

    @Test
    void shouldAbortAndKeepInterruptFlagWhenSleepIsInterrupted() {
        RetryPolicy policy = new RetryPolicy(Duration.ofMillis(1), 0, d -> {
            throw new InterruptedException();
        });
        try {
            Optional<Object> result = policy.execute("open channel", () -> {
                throw new IOException("busy");
            }, () -> true);
            assertTrue(result.isEmpty());
            assertTrue(Thread.interrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void shouldRejectNegativeArguments() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(Duration.ofMillis(-1), 0, Sleeper.SYSTEM));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(Duration.ZERO, -1, Sleeper.SYSTEM));
    }
}
