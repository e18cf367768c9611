package com.mimecast.labeller.quota;

import com.mimecast.labeller.error.RateLimitedException;
import com.mimecast.labeller.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AuthAttemptLimiterTest {

    private static final String PRINCIPAL = "user@example.com";

    private MutableClock clock;
    private AuthAttemptLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        limiter = new AuthAttemptLimiter(Duration.ofMinutes(15), 5, Duration.ofMinutes(64), clock);
    }

    @Test
    void belowThresholdIsNotLocked() {
        for (int i = 0; i < 4; i++) {
            limiter.recordFailure(PRINCIPAL);
        }

        assertDoesNotThrow(() -> limiter.check(PRINCIPAL));
        assertEquals(4, limiter.getFailureCount(PRINCIPAL));
    }

    @Test
    void thresholdLocksOutWithRemainingSeconds() {
        for (int i = 0; i < 5; i++) {
            limiter.recordFailure(PRINCIPAL);
        }

        RateLimitedException e = assertThrows(RateLimitedException.class, () -> limiter.check(PRINCIPAL));
        assertEquals(120, e.getRemainingSeconds());

        clock.advance(Duration.ofSeconds(90));
        assertEquals(30, limiter.getRemainingLockoutSeconds(PRINCIPAL));

        clock.advance(Duration.ofSeconds(30));
        assertDoesNotThrow(() -> limiter.check(PRINCIPAL));
    }

    @Test
    void lockoutDoublesAndCaps() {
        assertEquals(Duration.ofMinutes(2), limiter.lockoutFor(5));
        assertEquals(Duration.ofMinutes(4), limiter.lockoutFor(6));
        assertEquals(Duration.ofMinutes(8), limiter.lockoutFor(7));
        assertEquals(Duration.ofMinutes(64), limiter.lockoutFor(10));
        assertEquals(Duration.ofMinutes(64), limiter.lockoutFor(30));
    }

    @Test
    void failuresOutsideWindowAreForgotten() {
        for (int i = 0; i < 4; i++) {
            limiter.recordFailure(PRINCIPAL);
        }
        clock.advance(Duration.ofMinutes(16));

        assertEquals(1, limiter.recordFailure(PRINCIPAL));
        assertDoesNotThrow(() -> limiter.check(PRINCIPAL));
    }

    @Test
    void successClearsFailuresAndLockout() {
        for (int i = 0; i < 6; i++) {
            limiter.recordFailure(PRINCIPAL);
        }
        limiter.recordSuccess(PRINCIPAL);

        assertEquals(0, limiter.getFailureCount(PRINCIPAL));
        assertEquals(0, limiter.getRemainingLockoutSeconds(PRINCIPAL));
        assertDoesNotThrow(() -> limiter.check(PRINCIPAL));
    }

    @Test
    void principalsAreTrackedSeparately() {
        for (int i = 0; i < 5; i++) {
            limiter.recordFailure(PRINCIPAL);
        }

        assertDoesNotThrow(() -> limiter.check("other@example.com"));
    }
}
