package com.mimecast.labeller.main;

import com.mimecast.labeller.batch.BatchCoordinator;
import com.mimecast.labeller.batch.CancellationToken;
import com.mimecast.labeller.batch.Classifier;
import com.mimecast.labeller.batch.HttpClassifier;
import com.mimecast.labeller.config.LabellerConfig;
import com.mimecast.labeller.config.MailboxConfig;
import com.mimecast.labeller.credentials.CredentialStore;
import com.mimecast.labeller.credentials.VaultCredentialStore;
import com.mimecast.labeller.db.DataSources;
import com.mimecast.labeller.db.Migrations;
import com.mimecast.labeller.error.LabellerException;
import com.mimecast.labeller.quota.AuthAttemptLimiter;
import com.mimecast.labeller.quota.QuotaGuard;
import com.mimecast.labeller.reconcile.ReconciliationEngine;
import com.mimecast.labeller.reconcile.SuggestionLifecycle;
import com.mimecast.labeller.session.MailboxTransport;
import com.mimecast.labeller.session.SessionManager;
import com.mimecast.labeller.session.imap.ImapConnector;
import com.mimecast.labeller.session.imap.OAuthImapTransport;
import com.mimecast.labeller.session.imap.PasswordImapTransport;
import com.mimecast.labeller.store.FolderCache;
import com.mimecast.labeller.store.StateStore;
import com.mimecast.labeller.util.BackoffPolicy;
import com.mimecast.labeller.util.Sleeper;
import com.zaxxer.hikari.HikariDataSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Component wiring.
 *
 * <p>Builds every component once from a {@link LabellerConfig}: the migrated store, quota
 * guard, session manager, classifier, reconciliation engine and batch coordinator.
 * <br>Session state changes are recorded as snapshots in the store.
 */
public class Foundation implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(Foundation.class);

    private final LabellerConfig config;
    private final HikariDataSource dataSource;
    private final StateStore store;
    private final FolderCache folderCache;
    private final QuotaGuard quota;
    private final SessionManager sessions;
    private final SuggestionLifecycle lifecycle;
    private final ReconciliationEngine engine;
    private final BatchCoordinator coordinator;
    private final CredentialStore credentials;
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile CancellationToken activeRun;

    /**
     * Wires production components.
     *
     * @param config LabellerConfig instance.
     * @return Foundation instance.
     */
    public static Foundation create(LabellerConfig config) {
        return new Foundation(config,
                transportFor(config.getMailbox()),
                new HttpClassifier(config.getClassifier()),
                config.getVault().isEnabled() ? VaultCredentialStore.from(config.getVault()) : null,
                Sleeper.SYSTEM,
                Clock.systemUTC());
    }

    /**
     * Constructs a new Foundation instance.
     *
     * @param config      LabellerConfig instance.
     * @param transport   Mailbox transport.
     * @param classifier  Classifier instance.
     * @param credentials Credential store, may be null.
     * @param sleeper     Sleeper for backoff waits.
     * @param clock       Clock instance.
     */
    public Foundation(LabellerConfig config, MailboxTransport transport, Classifier classifier,
                      CredentialStore credentials, Sleeper sleeper, Clock clock) {
        this.config = config;
        this.credentials = credentials;
        this.dataSource = DataSources.create(config.getStore());
        try {
            int applied = Migrations.apply(dataSource, clock);
            log.debug("Schema at version {} ({} migrations applied)", Migrations.currentVersion(dataSource), applied);

            this.store = new StateStore(dataSource, clock, config.getStore().getFolderCacheTtl());
            this.folderCache = new FolderCache(store, config.getStore().getFolderCacheTtl());

            BackoffPolicy backoff = BackoffPolicy.from(config.getSession());
            this.quota = new QuotaGuard(config.getQuota(), backoff, sleeper, clock);
            AuthAttemptLimiter authLimiter = new AuthAttemptLimiter(config.getQuota(), clock);
            this.sessions = new SessionManager(config.getSession(), transport, authLimiter, backoff, sleeper, clock);
            this.sessions.addListener((session, previous, current) -> {
                try {
                    store.saveSessionSnapshot(session.toSnapshot());
                } catch (LabellerException e) {
                    log.warn("Could not record session {} {} -> {}: {}", session.getId(), previous, current, e.getMessage());
                }
            });

            this.lifecycle = new SuggestionLifecycle(store);
            this.engine = new ReconciliationEngine(store, quota);
            this.coordinator = new BatchCoordinator(config.getBatch(), store, quota, classifier,
                    config.getClassifier().getLabels(), lifecycle, engine, clock);
            this.sessions.start();
        } catch (RuntimeException e) {
            DataSources.close(dataSource);
            throw e;
        }
    }

    /**
     * Picks the IMAP transport for the configured authentication mode.
     *
     * @param config MailboxConfig instance.
     * @return MailboxTransport instance.
     */
    static MailboxTransport transportFor(MailboxConfig config) {
        ImapConnector connector = new ImapConnector(config);
        return switch (config.getAuthMode()) {
            case OAUTH -> new OAuthImapTransport(connector);
            case PASSWORD -> new PasswordImapTransport(connector);
        };
    }

    public LabellerConfig getConfig() {
        return config;
    }

    public StateStore getStore() {
        return store;
    }

    public FolderCache getFolderCache() {
        return folderCache;
    }

    public QuotaGuard getQuota() {
        return quota;
    }

    public SessionManager getSessions() {
        return sessions;
    }

    public SuggestionLifecycle getLifecycle() {
        return lifecycle;
    }

    public ReconciliationEngine getEngine() {
        return engine;
    }

    public BatchCoordinator getCoordinator() {
        return coordinator;
    }

    public Optional<CredentialStore> getCredentials() {
        return Optional.ofNullable(credentials);
    }

    /**
     * Creates the cancellation token of the run about to start.
     *
     * @return CancellationToken instance.
     */
    public CancellationToken newRunToken() {
        CancellationToken token = new CancellationToken();
        activeRun = token;
        return token;
    }

    /**
     * Cancels the active run, if any, at its next page boundary.
     *
     * @return True if a run was cancelled.
     */
    public boolean cancelActiveRun() {
        CancellationToken token = activeRun;
        if (token == null) {
            return false;
        }
        token.cancel();
        return true;
    }

    /**
     * Waits for the active run, if any, to stop at a page boundary.
     *
     * @param timeout Maximum wait.
     * @return True if no run is active or it stopped in time.
     */
    public boolean awaitActiveRun(Duration timeout) {
        CancellationToken token = activeRun;
        return token == null || token.awaitStopped(timeout);
    }

    /**
     * Stops the session manager within its grace period.
     * <p>Used by the shutdown hook; the data source stays open for the run still unwinding.
     */
    public void shutdownSessions() {
        sessions.shutdown(config.getSession().getShutdownGrace());
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        shutdownSessions();
        DataSources.close(dataSource);
        log.debug("Foundation closed");
    }
}
