package com.mimecast.labeller.quota;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Rolling window permit counter.
 *
 * <p>Grants at most {@code permits} acquisitions within any {@code window}.
 * <p>Acquisitions are bucketed by epoch second; buckets older than the window are pruned on access.
 */
public class WindowLimiter {

    private final int permits;
    private final long windowSeconds;
    private final Clock clock;
    private final ConcurrentSkipListMap<Long, Integer> history = new ConcurrentSkipListMap<>();

    /**
     * Constructs a new WindowLimiter instance.
     *
     * @param permits Permits per window.
     * @param window  Window length, at least one second.
     * @param clock   Clock instance.
     */
    public WindowLimiter(int permits, Duration window, Clock clock) {
        if (permits <= 0) {
            throw new IllegalArgumentException("Permits must be positive: " + permits);
        }
        this.permits = permits;
        this.windowSeconds = Math.max(1, window.getSeconds());
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Takes a permit if one is free.
     *
     * @return True when granted.
     */
    public synchronized boolean tryAcquire() {
        long now = clock.instant().getEpochSecond();
        prune(now);
        if (used() >= permits) {
            return false;
        }
        history.merge(now, 1, Integer::sum);
        return true;
    }

    /**
     * Gets seconds until the oldest acquisition leaves the window.
     *
     * @return Seconds, zero when a permit is free now.
     */
    public synchronized long secondsUntilAvailable() {
        long now = clock.instant().getEpochSecond();
        prune(now);
        if (used() < permits || history.isEmpty()) {
            return 0;
        }
        return Math.max(1, history.firstKey() + windowSeconds - now);
    }

    /**
     * Gets permits used within the current window.
     *
     * @return Count.
     */
    public synchronized int getUsed() {
        prune(clock.instant().getEpochSecond());
        return used();
    }

    public int getPermits() {
        return permits;
    }

    private int used() {
        int total = 0;
        for (Map.Entry<Long, Integer> entry : history.entrySet()) {
            total += entry.getValue();
        }
        return total;
    }

    private void prune(long now) {
        history.headMap(now - windowSeconds, true).clear();
    }
}
