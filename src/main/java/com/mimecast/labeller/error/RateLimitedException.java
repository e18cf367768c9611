package com.mimecast.labeller.error;

/**
 * A local quota is exhausted, the provider throttled us, or a principal is locked out.
 *
 * <p>Carries the seconds until a retry may succeed.
 */
public class RateLimitedException extends LabellerException {

    private final long remainingSeconds;
    private final boolean providerThrottled;

    public RateLimitedException(String message, long remainingSeconds) {
        this(message, remainingSeconds, false);
    }

    public RateLimitedException(String message, long remainingSeconds, boolean providerThrottled) {
        super(ErrorKind.RATE_LIMITED, message);
        this.remainingSeconds = Math.max(0, remainingSeconds);
        this.providerThrottled = providerThrottled;
    }

    /**
     * Gets seconds until the limit lifts.
     *
     * @return Seconds, zero when unknown.
     */
    public long getRemainingSeconds() {
        return remainingSeconds;
    }

    /**
     * Checks if the remote provider reported the throttling.
     *
     * @return Boolean.
     */
    public boolean isProviderThrottled() {
        return providerThrottled;
    }
}
