package com.mimecast.labeller.quota;

import com.mimecast.labeller.config.QuotaConfig;
import com.mimecast.labeller.error.RateLimitedException;
import com.mimecast.labeller.util.Principals;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Failed authentication tracking with exponential lockout.
 *
 * <p>Failures are counted per principal within a sliding window.
 * <p>Once the count reaches the threshold every further attempt is locked out for:
 * <pre>
 *     lockout = min(2 ^ (failures - threshold + 1) minutes, MAX)
 * </pre>
 * <p>With the defaults (threshold 5, max 64 minutes): 5 failures lock for 2 minutes,
 * 6 for 4, 7 for 8 and 10 or more for 64.
 * <p>A successful authentication clears both the failures and the lockout.
 */
public class AuthAttemptLimiter {
    private static final Logger log = LogManager.getLogger(AuthAttemptLimiter.class);

    private final ConcurrentMap<String, PrincipalState> states = new ConcurrentHashMap<>();
    private final Duration window;
    private final int threshold;
    private final Duration maxLockout;
    private final Clock clock;

    /**
     * Constructs a new AuthAttemptLimiter instance.
     *
     * @param config QuotaConfig instance.
     * @param clock  Clock instance.
     */
    public AuthAttemptLimiter(QuotaConfig config, Clock clock) {
        this(config.getAuthWindow(), config.getAuthFailureThreshold(), config.getMaxLockout(), clock);
    }

    /**
     * Constructs a new AuthAttemptLimiter instance.
     *
     * @param window     Sliding window.
     * @param threshold  Failures that trigger lockout.
     * @param maxLockout Longest lockout.
     * @param clock      Clock instance.
     */
    public AuthAttemptLimiter(Duration window, int threshold, Duration maxLockout, Clock clock) {
        this.window = Objects.requireNonNull(window, "window");
        this.threshold = threshold;
        this.maxLockout = Objects.requireNonNull(maxLockout, "maxLockout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Rejects the attempt if the principal is locked out.
     *
     * @param principal Principal.
     * @throws RateLimitedException With the remaining lockout seconds.
     */
    public void check(String principal) {
        PrincipalState state = states.get(principal);
        if (state == null) {
            return;
        }
        long remaining = state.remainingLockoutSeconds(clock.instant());
        if (remaining > 0) {
            throw new RateLimitedException("Too many failed authentication attempts. Try again in "
                    + remaining + " seconds.", remaining);
        }
    }

    /**
     * Records a failed authentication.
     *
     * @param principal Principal.
     * @return Failures counted within the window.
     */
    public int recordFailure(String principal) {
        PrincipalState state = states.computeIfAbsent(principal, p -> new PrincipalState());
        Instant now = clock.instant();
        int failures = state.recordFailure(now, window);
        if (failures >= threshold) {
            Duration lockout = lockoutFor(failures);
            state.lockUntil(now.plus(lockout));
            log.warn("Authentication locked out for principal {} for {} minutes ({} failures)",
                    Principals.hash(principal), lockout.toMinutes(), failures);
        }
        return failures;
    }

    /**
     * Records a successful authentication, clearing failures and lockout.
     *
     * @param principal Principal.
     */
    public void recordSuccess(String principal) {
        if (states.remove(principal) != null) {
            log.debug("Cleared failed authentication state for principal {}", Principals.hash(principal));
        }
    }

    /**
     * Gets failures counted within the window.
     *
     * @param principal Principal.
     * @return Count.
     */
    public int getFailureCount(String principal) {
        PrincipalState state = states.get(principal);
        return state == null ? 0 : state.count(clock.instant(), window);
    }

    /**
     * Gets remaining lockout seconds.
     *
     * @param principal Principal.
     * @return Seconds, zero if not locked out.
     */
    public long getRemainingLockoutSeconds(String principal) {
        PrincipalState state = states.get(principal);
        return state == null ? 0 : state.remainingLockoutSeconds(clock.instant());
    }

    Duration lockoutFor(int failures) {
        int exponent = Math.min(failures - threshold + 1, 20);
        Duration lockout = Duration.ofMinutes(1L << Math.max(exponent, 0));
        return lockout.compareTo(maxLockout) > 0 ? maxLockout : lockout;
    }

    /**
     * Per-principal failure history.
     */
    private static class PrincipalState {
        private final Deque<Instant> failures = new ArrayDeque<>();
        private Instant lockedUntil;

        synchronized int recordFailure(Instant now, Duration window) {
            prune(now, window);
            failures.addLast(now);
            return failures.size();
        }

        synchronized int count(Instant now, Duration window) {
            prune(now, window);
            return failures.size();
        }

        synchronized void lockUntil(Instant until) {
            lockedUntil = until;
        }

        synchronized long remainingLockoutSeconds(Instant now) {
            if (lockedUntil == null || !now.isBefore(lockedUntil)) {
                return 0;
            }
            return Math.max(1, Duration.between(now, lockedUntil).toSeconds());
        }

        private void prune(Instant now, Duration window) {
            Instant cutoff = now.minus(window);
            while (!failures.isEmpty() && !failures.peekFirst().isAfter(cutoff)) {
                failures.removeFirst();
            }
        }
    }
}
