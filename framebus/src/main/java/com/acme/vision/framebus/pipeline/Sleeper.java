package com.acme.vision.framebus.pipeline;

import java.time.Duration;

/**
 * Blocking pause, injectable so retry loops can be tested without real delays.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
