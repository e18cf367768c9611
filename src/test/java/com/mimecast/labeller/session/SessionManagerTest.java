package com.mimecast.labeller.session;

import com.mimecast.labeller.config.SessionConfig;
import com.mimecast.labeller.credentials.Secret;
import com.mimecast.labeller.error.AuthenticationException;
import com.mimecast.labeller.error.RateLimitedException;
import com.mimecast.labeller.error.TransientConnectionException;
import com.mimecast.labeller.error.ValidationException;
import com.mimecast.labeller.quota.AuthAttemptLimiter;
import com.mimecast.labeller.util.BackoffPolicy;
import com.mimecast.labeller.util.MutableClock;
import com.mimecast.labeller.util.RecordingSleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionManagerTest {

    private static final String PRINCIPAL = "user@example.com";

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final BackoffPolicy backoff = new BackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(15), 0.25, () -> 0.5);

    private MailboxTransport transport;
    private RecordingSleeper sleeper;
    private AuthAttemptLimiter limiter;
    private SessionManager manager;
    private final List<String> transitions = new ArrayList<>();

    @BeforeEach
    void setUp() {
        transport = mock(MailboxTransport.class);
        when(transport.name()).thenReturn("password");
        when(transport.authenticate(anyString(), any(Secret.class))).thenAnswer(i -> mock(MailboxConnection.class));
        sleeper = new RecordingSleeper();
        limiter = new AuthAttemptLimiter(Duration.ofMinutes(15), 5, Duration.ofMinutes(64), clock);
        manager = new SessionManager(new SessionConfig(new HashMap<>()), transport, limiter, backoff, sleeper, clock);
        manager.addListener((session, previous, current) -> transitions.add(previous + "->" + current));
    }

    @AfterEach
    void tearDown() {
        manager.shutdown(Duration.ofSeconds(1));
    }

    @Test
    void authenticateConnects() {
        MailboxSession session = manager.authenticate(PRINCIPAL, Secret.of("pw"));

        assertEquals(SessionState.CONNECTED, session.getState());
        assertEquals("password", session.getTransport());
        assertEquals(1, manager.getActiveCount());
        assertEquals(List.of("null->CONNECTING", "CONNECTING->CONNECTED"), transitions);
        assertEquals("CONNECTED", session.toSnapshot().getState());
    }

    @Test
    void malformedPrincipalIsRejectedBeforeAnyRemoteCall() {
        assertThrows(ValidationException.class, () -> manager.authenticate("not-an-address", Secret.of("pw")));
        verify(transport, never()).authenticate(anyString(), any(Secret.class));
    }

    @Test
    void clearedSecretIsRejected() {
        Secret secret = Secret.of("pw");
        secret.clear();
        assertThrows(ValidationException.class, () -> manager.authenticate(PRINCIPAL, secret));
    }

    @Test
    void sixthSessionEvictsLeastRecentlyActive() {
        List<MailboxSession> created = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            created.add(manager.authenticate(PRINCIPAL, Secret.of("pw")));
            clock.advance(Duration.ofSeconds(10));
        }
        // First session used most recently, second one becomes the oldest.
        manager.connection(created.get(0));
        clock.advance(Duration.ofSeconds(10));

        MailboxSession sixth = manager.authenticate(PRINCIPAL, Secret.of("pw"));

        MailboxSession evicted = created.get(1);
        assertEquals(SessionState.DISCONNECTED, evicted.getState());
        assertEquals(5, manager.getSessions(PRINCIPAL).size());
        assertTrue(manager.getSessions(PRINCIPAL).contains(sixth));
        assertFalse(manager.getSessions(PRINCIPAL).contains(evicted));
        assertEquals(SessionState.CONNECTED, created.get(0).getState());
        verify(transport, times(1)).disconnect(any(MailboxConnection.class));
    }

    @Test
    void badCredentialsAreNotRetried() {
        when(transport.authenticate(anyString(), any(Secret.class))).thenThrow(new AuthenticationException("Invalid credentials"));

        assertThrows(AuthenticationException.class, () -> manager.authenticate(PRINCIPAL, Secret.of("bad")));

        verify(transport, times(1)).authenticate(anyString(), any(Secret.class));
        assertEquals(1, limiter.getFailureCount(PRINCIPAL));
        assertTrue(sleeper.getWaits().isEmpty());
        assertEquals(0, manager.getActiveCount());
        assertEquals("CONNECTING->ERROR", transitions.get(transitions.size() - 1));
    }

    @Test
    void lockedOutPrincipalMakesNoRemoteCall() {
        when(transport.authenticate(anyString(), any(Secret.class))).thenThrow(new AuthenticationException("Invalid credentials"));
        for (int i = 0; i < 5; i++) {
            assertThrows(AuthenticationException.class, () -> manager.authenticate(PRINCIPAL, Secret.of("bad")));
        }

        RateLimitedException e = assertThrows(RateLimitedException.class,
                () -> manager.authenticate(PRINCIPAL, Secret.of("bad")));

        assertEquals(120, e.getRemainingSeconds());
        verify(transport, times(5)).authenticate(anyString(), any(Secret.class));
    }

    @Test
    void transientConnectFailuresBackOff() {
        MailboxConnection connection = mock(MailboxConnection.class);
        when(transport.authenticate(anyString(), any(Secret.class)))
                .thenThrow(new TransientConnectionException("reset"))
                .thenThrow(new TransientConnectionException("reset"))
                .thenThrow(new TransientConnectionException("reset"))
                .thenReturn(connection);

        MailboxSession session = manager.authenticate(PRINCIPAL, Secret.of("pw"));

        assertArrayEquals(new long[]{2000, 4000, 8000}, sleeper.getWaitMillis());
        assertEquals(3, session.getRetryCount());
        assertSame(connection, manager.connection(session));
    }

    @Test
    void connectGivesUpAfterMaxRetries() {
        when(transport.authenticate(anyString(), any(Secret.class))).thenThrow(new TransientConnectionException("unreachable"));

        assertThrows(TransientConnectionException.class, () -> manager.authenticate(PRINCIPAL, Secret.of("pw")));

        verify(transport, times(6)).authenticate(anyString(), any(Secret.class));
        assertArrayEquals(new long[]{2000, 4000, 8000, 15000, 15000}, sleeper.getWaitMillis());
        assertEquals(0, limiter.getFailureCount(PRINCIPAL));
    }

    @Test
    void keepaliveFailuresReachThresholdThenReconnect() {
        MailboxConnection first = mock(MailboxConnection.class);
        MailboxConnection second = mock(MailboxConnection.class);
        when(transport.authenticate(anyString(), any(Secret.class))).thenReturn(first).thenReturn(second);
        when(transport.keepalive(first)).thenReturn(false);

        MailboxSession session = manager.authenticate(PRINCIPAL, Secret.of("pw"));
        transitions.clear();

        assertEquals(KeepaliveResult.PROBE_FAILED, manager.keepalive(session));
        assertEquals(KeepaliveResult.PROBE_FAILED, manager.keepalive(session));
        assertEquals(SessionState.CONNECTED, session.getState());

        assertEquals(KeepaliveResult.RECONNECTED, manager.keepalive(session));

        assertEquals(List.of("CONNECTED->ERROR", "ERROR->CONNECTING", "CONNECTING->CONNECTED"), transitions);
        assertSame(second, manager.connection(session));
        assertEquals(0, session.getProbeFailures());
        assertArrayEquals(new long[]{2000}, sleeper.getWaitMillis());
        verify(transport).disconnect(first);
    }

    @Test
    void reconnectBacksOffThenStaysInError() {
        MailboxConnection first = mock(MailboxConnection.class);
        when(transport.authenticate(anyString(), any(Secret.class)))
                .thenReturn(first)
                .thenThrow(new TransientConnectionException("unreachable"));
        when(transport.keepalive(first)).thenReturn(false);

        MailboxSession session = manager.authenticate(PRINCIPAL, Secret.of("pw"));
        manager.keepalive(session);
        manager.keepalive(session);

        assertEquals(KeepaliveResult.FAILED, manager.keepalive(session));
        assertEquals(SessionState.ERROR, session.getState());
        assertTrue(session.isExhausted());
        assertEquals(5, session.getRetryCount());
        assertArrayEquals(new long[]{2000, 4000, 8000, 15000, 15000}, sleeper.getWaitMillis());
        verify(transport, times(6)).authenticate(anyString(), any(Secret.class));

        // Later keepalives leave the session alone.
        assertEquals(KeepaliveResult.FAILED, manager.keepalive(session));
        assertEquals(KeepaliveResult.FAILED, manager.keepalive(session));
        assertEquals(SessionState.ERROR, session.getState());
        assertEquals(5, session.getRetryCount());
        assertEquals(5, sleeper.getWaits().size());
        verify(transport, times(6)).authenticate(anyString(), any(Secret.class));
    }

    @Test
    void rejectedReconnectIsNotRetriedByLaterKeepalives() {
        MailboxConnection first = mock(MailboxConnection.class);
        when(transport.authenticate(anyString(), any(Secret.class)))
                .thenReturn(first)
                .thenThrow(new AuthenticationException("Token revoked"));
        when(transport.keepalive(first)).thenReturn(false);

        MailboxSession session = manager.authenticate(PRINCIPAL, Secret.of("pw"));
        for (int i = 0; i < 3; i++) {
            manager.keepalive(session);
        }

        assertEquals(KeepaliveResult.FAILED, manager.keepalive(session));
        assertEquals(SessionState.ERROR, session.getState());
        assertTrue(session.isExhausted());
        verify(transport, times(2)).authenticate(anyString(), any(Secret.class));
    }

    @Test
    void successfulProbeResetsFailureCount() {
        MailboxConnection connection = mock(MailboxConnection.class);
        when(transport.authenticate(anyString(), any(Secret.class))).thenReturn(connection);
        when(transport.keepalive(connection)).thenReturn(false, false, true);

        MailboxSession session = manager.authenticate(PRINCIPAL, Secret.of("pw"));
        manager.keepalive(session);
        manager.keepalive(session);

        assertEquals(KeepaliveResult.OK, manager.keepalive(session));
        assertEquals(0, session.getProbeFailures());
        assertEquals(SessionState.CONNECTED, session.getState());
    }

    @Test
    void sweepClosesStaleAndProbesIdle() {
        MailboxConnection stale = mock(MailboxConnection.class);
        MailboxConnection busy = mock(MailboxConnection.class);
        when(transport.authenticate(anyString(), any(Secret.class))).thenReturn(stale).thenReturn(busy);
        when(transport.keepalive(busy)).thenReturn(true);

        MailboxSession staleSession = manager.authenticate(PRINCIPAL, Secret.of("pw"));
        MailboxSession busySession = manager.authenticate(PRINCIPAL, Secret.of("pw"));

        clock.advance(Duration.ofMinutes(26));
        manager.connection(busySession);

        assertEquals(1, manager.sweep());
        assertEquals(SessionState.DISCONNECTED, staleSession.getState());
        assertEquals(SessionState.CONNECTED, busySession.getState());
        verify(transport).disconnect(stale);
        verify(transport).keepalive(busy);
        verify(transport, never()).keepalive(stale);
    }

    @Test
    void keepaliveDoesNotCountAsActivity() {
        MailboxConnection connection = mock(MailboxConnection.class);
        when(transport.authenticate(anyString(), any(Secret.class))).thenReturn(connection);
        when(transport.keepalive(connection)).thenReturn(true);

        MailboxSession session = manager.authenticate(PRINCIPAL, Secret.of("pw"));
        Instant activity = session.getLastActivityAt();

        clock.advance(Duration.ofMinutes(12));
        manager.sweep();
        assertEquals(activity, session.getLastActivityAt());

        clock.advance(Duration.ofMinutes(14));
        assertEquals(1, manager.sweep());
    }

    @Test
    void disconnectIsIdempotent() {
        MailboxConnection connection = mock(MailboxConnection.class);
        when(transport.authenticate(anyString(), any(Secret.class))).thenReturn(connection);
        MailboxSession session = manager.authenticate(PRINCIPAL, Secret.of("pw"));

        manager.disconnect(session);
        manager.disconnect(session);

        verify(transport, times(1)).disconnect(connection);
        assertEquals(SessionState.DISCONNECTED, session.getState());
        assertEquals(0, manager.getActiveCount());
        assertThrows(TransientConnectionException.class, () -> manager.connection(session));
    }

    @Test
    void shutdownClosesEverySession() {
        MailboxSession a = manager.authenticate(PRINCIPAL, Secret.of("pw"));
        MailboxSession b = manager.authenticate("other@example.com", Secret.of("pw"));
        manager.start();
        assertTrue(manager.isRunning());

        assertEquals(0, manager.shutdown(Duration.ofSeconds(2)));

        assertFalse(manager.isRunning());
        assertEquals(SessionState.DISCONNECTED, a.getState());
        assertEquals(SessionState.DISCONNECTED, b.getState());
        assertEquals(0, manager.getActiveCount());
        verify(transport, times(2)).disconnect(any(MailboxConnection.class));
    }

    @Test
    void statsCountByStateAndHashedPrincipal() {
        manager.authenticate(PRINCIPAL, Secret.of("pw"));
        manager.authenticate(PRINCIPAL, Secret.of("pw"));

        SessionStats stats = manager.stats();

        assertEquals(2, stats.getTotal());
        Map<SessionState, Integer> byState = stats.getByState();
        assertEquals(2, byState.get(SessionState.CONNECTED));
        assertFalse(stats.getByPrincipal().containsKey(PRINCIPAL));
    }
}
