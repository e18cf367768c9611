package com.mimecast.labeller.quota;

import com.mimecast.labeller.config.QuotaConfig;
import com.mimecast.labeller.error.RateLimitedException;
import com.mimecast.labeller.error.TransientConnectionException;
import com.mimecast.labeller.util.BackoffPolicy;
import com.mimecast.labeller.util.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Per-scope rate limiting for mailbox and classification calls.
 *
 * <p>Each {@link QuotaScope} has its own {@link WindowLimiter}; exhausting one scope never
 * affects the other.
 * <p>{@link #call(QuotaScope, Supplier)} additionally waits out provider throttling with
 * capped, jittered exponential backoff.
 */
public class QuotaGuard {
    private static final Logger log = LogManager.getLogger(QuotaGuard.class);

    private final Map<QuotaScope, WindowLimiter> limiters = new EnumMap<>(QuotaScope.class);
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;
    private final int maxThrottleRetries;

    /**
     * Constructs a new QuotaGuard instance.
     *
     * @param config  QuotaConfig instance.
     * @param backoff Backoff applied after throttling.
     * @param sleeper Sleeper instance.
     * @param clock   Clock instance.
     */
    public QuotaGuard(QuotaConfig config, BackoffPolicy backoff, Sleeper sleeper, Clock clock) {
        Objects.requireNonNull(config, "config");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.maxThrottleRetries = config.getMaxThrottleRetries();
        for (QuotaScope scope : QuotaScope.values()) {
            limiters.put(scope, new WindowLimiter(
                    config.getPermits(scope.key(), scope.getDefaultPermits()),
                    config.getWindow(scope.key()),
                    clock));
        }
    }

    /**
     * Takes one permit from a scope.
     *
     * @param scope Scope.
     * @throws RateLimitedException When the scope is exhausted.
     */
    public void acquire(QuotaScope scope) {
        WindowLimiter limiter = limiters.get(scope);
        if (!limiter.tryAcquire()) {
            long seconds = limiter.secondsUntilAvailable();
            log.debug("Quota exhausted for scope {} ({} permits), retry in {}s", scope, limiter.getPermits(), seconds);
            throw new RateLimitedException("Quota exhausted for " + scope.key() + " calls", seconds);
        }
    }

    /**
     * Runs an action under a scope permit, backing off on throttling.
     *
     * @param scope  Scope.
     * @param action Remote call.
     * @param <T>    Result type.
     * @return Action result.
     * @throws RateLimitedException When retries are exhausted.
     */
    public <T> T call(QuotaScope scope, Supplier<T> action) {
        int attempt = 0;
        while (true) {
            try {
                acquire(scope);
                return action.get();
            } catch (RateLimitedException e) {
                if (attempt >= maxThrottleRetries) {
                    log.warn("Giving up on {} call after {} throttled attempts", scope, attempt + 1);
                    throw e;
                }
                Duration wait = backoff.delay(attempt);
                Duration hinted = Duration.ofSeconds(e.getRemainingSeconds());
                if (hinted.compareTo(wait) > 0) {
                    wait = hinted;
                }
                log.warn("{} call rate limited ({}), retrying in {} ms",
                        scope, e.isProviderThrottled() ? "provider" : "local", wait.toMillis());
                pause(wait);
                attempt++;
            }
        }
    }

    /**
     * Runs an action under a scope permit, backing off on throttling.
     *
     * @param scope  Scope.
     * @param action Remote call.
     */
    public void run(QuotaScope scope, Runnable action) {
        call(scope, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Gets permits used in the current window of a scope.
     *
     * @param scope Scope.
     * @return Count.
     */
    public int getUsed(QuotaScope scope) {
        return limiters.get(scope).getUsed();
    }

    private void pause(Duration wait) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientConnectionException("Interrupted while waiting for quota", e);
        }
    }
}
