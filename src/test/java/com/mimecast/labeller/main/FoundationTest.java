package com.mimecast.labeller.main;

import com.mimecast.labeller.batch.CancellationToken;
import com.mimecast.labeller.config.LabellerConfig;
import com.mimecast.labeller.config.MailboxConfig;
import com.mimecast.labeller.session.MailboxTransport;
import com.mimecast.labeller.util.RecordingSleeper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FoundationTest {

    @Test
    void transportFollowsAuthMode() {
        assertEquals("oauth", Foundation.transportFor(new MailboxConfig(Map.of("authMode", "oauth"))).name());
        assertEquals("password", Foundation.transportFor(new MailboxConfig(Map.of("authMode", "password"))).name());
    }

    @Test
    void wiresMigratedStoreAndCancelsActiveRun() {
        MailboxTransport transport = mock(MailboxTransport.class);
        when(transport.name()).thenReturn("password");
        LabellerConfig config = new LabellerConfig(Map.of(
                "store", Map.of("jdbcUrl", "jdbc:h2:mem:foundation_test;MODE=PostgreSQL;DB_CLOSE_DELAY=-1"),
                "classifier", Map.of("labels", List.of("Finance"))));

        try (Foundation foundation = new Foundation(config, transport, (items, labels) -> List.of(), null,
                new RecordingSleeper(), Clock.systemUTC())) {
            assertTrue(foundation.getSessions().isRunning());
            assertTrue(foundation.getCredentials().isEmpty());
            assertTrue(foundation.getStore().listRecentRuns(5).isEmpty());

            assertFalse(foundation.cancelActiveRun());
            CancellationToken token = foundation.newRunToken();
            assertTrue(foundation.cancelActiveRun());
            assertTrue(token.isCancelled());

            assertFalse(foundation.awaitActiveRun(Duration.ofMillis(50)));
            Thread stopper = new Thread(token::markStopped);
            stopper.start();
            assertTrue(foundation.awaitActiveRun(Duration.ofSeconds(5)));

            foundation.close();
            assertFalse(foundation.getSessions().isRunning());
        }
    }
}
