package com.mimecast.labeller.util;

import com.mimecast.labeller.config.SessionConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Capped exponential backoff with jitter.
 * <p>The wait before retry <i>n</i> (zero based) is:
 * <pre>
 *     wait = min(BASE * 2 ^ n, CAP) * (1 + JITTER * r),  r uniform in [-1, 1)
 * </pre>
 * <p>and the jittered value is clamped to CAP again.
 * <p> Defaults:
 * <ul>
 *     <li>Base: 2 seconds</li>
 *     <li>Cap: 15 seconds</li>
 *     <li>Jitter: 25%</li>
 * </ul>
 * <p> Example waits:
 * <ul>
 *     <li>Retry 0: 1.5 - 2.5 seconds</li>
 *     <li>Retry 1: 3.0 - 5.0 seconds</li>
 *     <li>Retry 2: 6.0 - 10.0 seconds</li>
 *     <li>Retry 3 and later: 11.25 - 15.0 seconds</li>
 * </ul>
 */
public class BackoffPolicy {

    private final long baseMillis;
    private final long capMillis;
    private final double jitter;
    private final DoubleSupplier random;

    /**
     * Constructs a new BackoffPolicy with a thread local random source.
     *
     * @param base   Base delay.
     * @param cap    Maximum delay.
     * @param jitter Jitter ratio.
     */
    public BackoffPolicy(Duration base, Duration cap, double jitter) {
        this(base, cap, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Constructs a new BackoffPolicy.
     *
     * @param base   Base delay.
     * @param cap    Maximum delay.
     * @param jitter Jitter ratio.
     * @param random Source of uniform values in [0, 1).
     */
    public BackoffPolicy(Duration base, Duration cap, double jitter, DoubleSupplier random) {
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("Jitter must be in [0, 1): " + jitter);
        }
        this.baseMillis = base.toMillis();
        this.capMillis = cap.toMillis();
        this.jitter = jitter;
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Builds the policy from session configuration.
     *
     * @param config SessionConfig instance.
     * @return BackoffPolicy instance.
     */
    public static BackoffPolicy from(SessionConfig config) {
        return new BackoffPolicy(config.getBackoffBase(), config.getBackoffCap(), config.getBackoffJitter());
    }

    /**
     * Gets the wait before the given retry.
     *
     * @param attempt Zero based retry number.
     * @return Duration.
     */
    public Duration delay(int attempt) {
        double nominal = nominalMillis(attempt);
        double offset = nominal * jitter * (2 * random.getAsDouble() - 1);
        long millis = Math.round(Math.min(nominal + offset, capMillis));
        return Duration.ofMillis(Math.max(0, millis));
    }

    /**
     * Gets the wait before the given retry without jitter.
     *
     * @param attempt Zero based retry number.
     * @return Milliseconds.
     */
    public long nominalMillis(int attempt) {
        int exponent = Math.min(Math.max(attempt, 0), 30);
        return Math.min(baseMillis * (1L << exponent), capMillis);
    }
}
