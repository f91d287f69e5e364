package com.acme.vision.framebus.pipeline;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

/**
 * Fixed-delay retry for operations that fail while a device is still coming up.
 * A {@code maxAttempts} of 0 retries until the operation succeeds or is cancelled.
 */
public final class RetryPolicy {
    private static final Logger LOG = Logger.getLogger(RetryPolicy.class.getName());

    private final Duration delay;
    private final int maxAttempts;
    private final Sleeper sleeper;

    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws Exception;
    }

    public RetryPolicy(Duration delay, int maxAttempts, Sleeper sleeper) {
        this.delay = Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0, got " + delay);
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Runs {@code attempt} until it returns a value.
     *
     * @param description what is being attempted, for log lines
     * @param keepGoing   checked before every attempt; returning {@code false} cancels
     * @return the result, or empty when attempts ran out, were cancelled or the thread
     * was interrupted
     */
    public <T> Optional<T> execute(String description, Attempt<T> attempt, BooleanSupplier keepGoing) {
        int attempts = 0;
        while (keepGoing.getAsBoolean()) {
            attempts++;
            try {
                return Optional.of(attempt.run());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            } catch (Exception e) {
                LOG.warning("Failed to " + description + " (attempt " + attempts
                    + (maxAttempts > 0 ? "/" + maxAttempts : "") + "): " + e.getMessage());
            }
            if (maxAttempts > 0 && attempts >= maxAttempts) {
                LOG.severe("Giving up after " + attempts + " attempts to " + description);
                return Optional.empty();
            }
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Duration delay() {
        return delay;
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
