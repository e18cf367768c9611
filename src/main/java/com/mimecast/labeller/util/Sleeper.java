package com.mimecast.labeller.util;

import java.time.Duration;

/**
 * Blocking wait, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Thread.sleep backed sleeper.
     */
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    /**
     * Blocks for the given duration.
     *
     * @param duration Duration.
     * @throws InterruptedException When interrupted.
     */
    void sleep(Duration duration) throws InterruptedException;
}
