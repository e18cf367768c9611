package com.mimecast.labeller.main;

import com.mimecast.labeller.batch.CancellationToken;
import com.mimecast.labeller.batch.RunOutcome;
import com.mimecast.labeller.batch.RunRequest;
import com.mimecast.labeller.credentials.CredentialStore;
import com.mimecast.labeller.credentials.Secret;
import com.mimecast.labeller.error.AuthenticationException;
import com.mimecast.labeller.error.ErrorKind;
import com.mimecast.labeller.error.LabellerException;
import com.mimecast.labeller.error.RateLimitedException;
import com.mimecast.labeller.error.ValidationException;
import com.mimecast.labeller.quota.QuotaScope;
import com.mimecast.labeller.reconcile.ApplyReport;
import com.mimecast.labeller.reconcile.ReconcileReport;
import com.mimecast.labeller.session.MailFolder;
import com.mimecast.labeller.session.MailboxConnection;
import com.mimecast.labeller.session.MailboxSession;
import com.mimecast.labeller.store.CleanupReport;
import com.mimecast.labeller.store.StateStore;
import com.mimecast.labeller.store.domain.AuditLogEntry;
import com.mimecast.labeller.store.domain.ProcessingRun;
import com.mimecast.labeller.store.domain.RunStatus;
import com.mimecast.labeller.store.domain.SessionSnapshot;
import com.mimecast.labeller.store.domain.Suggestion;
import com.mimecast.labeller.store.domain.SuggestionStatus;
import com.mimecast.labeller.util.Principals;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Command line front end.
 *
 * <p>Commands:
 * <ul>
 *     <li><b>classify</b> [--limit N] [--apply] [--folder NAME] [--resume RUN_ID]
 *     <li><b>review</b> &lt;run-id&gt; [--approve-above C] [--reject-below C]
 *     <li><b>apply</b> &lt;run-id&gt;
 *     <li><b>reconcile</b> [&lt;run-id&gt;]
 *     <li><b>sessions</b>
 *     <li><b>cleanup</b> [--days N]
 *     <li><b>login</b>, <b>logout</b>, <b>auth-status</b>
 * </ul>
 * <p>Run commands only act on runs of the given principal.
 * <p>Every command returns 0 on full success and 1 on any failure.
 */
public class LabellerCLI {
    private static final Logger log = LogManager.getLogger(LabellerCLI.class);

    /**
     * Commands in usage order.
     */
    public static final List<String> COMMANDS = List.of("classify", "review", "apply", "reconcile", "sessions", "cleanup",
            "login", "logout", "auth-status");

    static final double HIGH_CONFIDENCE = 0.8;
    static final double MEDIUM_CONFIDENCE = 0.5;
    private static final int LISTING_LIMIT = 20;
    private static final int TOP_SUGGESTIONS = 10;

    private final Foundation foundation;
    private final String principal;
    private final PasswordPrompt prompt;
    private final PrintStream out;

    /**
     * Constructs a new LabellerCLI instance.
     *
     * @param foundation Foundation instance.
     * @param principal  Principal from the command line or config, may be null.
     * @param prompt     Fallback secret input.
     * @param out        Output stream.
     */
    public LabellerCLI(Foundation foundation, String principal, PasswordPrompt prompt, PrintStream out) {
        this.foundation = foundation;
        this.principal = principal;
        this.prompt = prompt;
        this.out = out;
    }

    /**
     * Runs a command.
     *
     * @param command Command name.
     * @param args    Command arguments.
     * @return Exit code.
     */
    public int run(String command, String[] args) {
        try {
            return switch (command) {
                case "classify" -> classify(parse(classifyOptions(), args));
                case "review" -> review(parse(reviewOptions(), args));
                case "apply" -> apply(parse(new Options(), args));
                case "reconcile" -> reconcile(parse(new Options(), args));
                case "sessions" -> sessions();
                case "cleanup" -> cleanup(parse(cleanupOptions(), args));
                case "login" -> login();
                case "logout" -> logout();
                case "auth-status" -> authStatus();
                default -> throw new ValidationException("Unknown command: " + command + " (expected one of " + COMMANDS + ")");
            };
        } catch (LabellerException e) {
            log.error("Command {} failed", command, e);
            log(error(e.getKind(), e.getMessage()
                    + (e instanceof RateLimitedException ? ", retry in " + ((RateLimitedException) e).getRemainingSeconds() + "s" : "")));
            return 1;
        } catch (ParseException e) {
            log(error(ErrorKind.VALIDATION, e.getMessage()));
            return 1;
        }
    }

    private int classify(CommandLine cmd) {
        String owner = requirePrincipal();
        Integer limit = cmd.hasOption("limit") ? parseInt(cmd.getOptionValue("limit"), "limit") : null;
        String folder = cmd.getOptionValue("folder", foundation.getConfig().getMailbox().getFolder());
        String resume = cmd.getOptionValue("resume");
        if (resume != null) {
            requireOwnedRun(resume, owner);
        }

        RunOutcome outcome = withSession(owner, connection -> {
            CancellationToken token = foundation.newRunToken();
            if (resume != null) {
                return foundation.getCoordinator().resume(resume, connection, token);
            }
            requireFolder(owner, folder, connection);
            return foundation.getCoordinator().start(new RunRequest(owner, folder, limit, cmd.hasOption("apply")), connection, token);
        });

        ProcessingRun run = outcome.getRun();
        printRun(run);
        Optional<ApplyReport> report = outcome.getApplyReport();
        report.ifPresent(r -> log("Applied:         " + r));

        if (run.getStatus() != RunStatus.COMPLETED) {
            log("Run paused, resume with: classify --resume " + run.getId());
            return 1;
        }
        return report.map(ApplyReport::isClean).orElse(true) ? 0 : 1;
    }

    private int review(CommandLine cmd) {
        String runId = requireRunId(cmd);
        Double approveAbove = cmd.hasOption("approve-above") ? parseConfidence(cmd.getOptionValue("approve-above"), "approve-above") : null;
        Double rejectBelow = cmd.hasOption("reject-below") ? parseConfidence(cmd.getOptionValue("reject-below"), "reject-below") : null;
        if (approveAbove != null && rejectBelow != null && rejectBelow > approveAbove) {
            throw new ValidationException("--reject-below cannot exceed --approve-above");
        }

        StateStore store = foundation.getStore();
        ProcessingRun run = store.getRun(runId);
        printRun(run);

        List<Suggestion> suggestions = store.findSuggestions(runId, null);
        int high = 0;
        int medium = 0;
        int low = 0;
        int noMatch = 0;
        for (Suggestion suggestion : suggestions) {
            if (suggestion.getStatus() == SuggestionStatus.NO_MATCH || suggestion.getLabels().isEmpty()) {
                noMatch++;
            } else if (suggestion.bestConfidence() >= HIGH_CONFIDENCE) {
                high++;
            } else if (suggestion.bestConfidence() >= MEDIUM_CONFIDENCE) {
                medium++;
            } else {
                low++;
            }
        }
        log("");
        log("Confidence breakdown:");
        log("  High (>= " + HIGH_CONFIDENCE + "):   " + high);
        log("  Medium (>= " + MEDIUM_CONFIDENCE + "): " + medium);
        log("  Low:            " + low);
        log("  No match:       " + noMatch);

        List<Suggestion> pending = store.findSuggestions(runId, SuggestionStatus.PENDING);
        log("");
        log("Top pending suggestions:");
        log("-".repeat(70));
        for (Suggestion suggestion : pending.subList(0, Math.min(TOP_SUGGESTIONS, pending.size()))) {
            log(String.format(Locale.ROOT, "  #%-6d %-20s %.2f  %s", suggestion.getId(),
                    suggestion.best().map(l -> l.getLabel()).orElse("-"),
                    suggestion.bestConfidence(),
                    suggestion.getSubject() != null ? suggestion.getSubject() : ""));
        }

        int approved = 0;
        int rejected = 0;
        for (Suggestion suggestion : pending) {
            if (approveAbove != null && suggestion.bestConfidence() >= approveAbove) {
                foundation.getLifecycle().approve(suggestion.getId());
                approved++;
            } else if (rejectBelow != null && suggestion.bestConfidence() < rejectBelow) {
                foundation.getLifecycle().reject(suggestion.getId());
                rejected++;
            }
        }
        if (approveAbove != null || rejectBelow != null) {
            log("");
            log("Approved: " + approved + ", rejected: " + rejected);
        }
        return 0;
    }

    private int apply(CommandLine cmd) {
        String runId = requireRunId(cmd);
        String owner = requirePrincipal();
        ProcessingRun run = requireOwnedRun(runId, owner);

        ApplyReport report = withSession(owner, connection -> {
            foundation.getQuota().run(QuotaScope.MAILBOX, () -> connection.selectFolder(run.getFolder()));
            return foundation.getEngine().apply(runId, connection);
        });
        log("Run " + runId + ": " + report);
        if (report.getPendingReconciliation() > 0) {
            log("Some changes reached the mailbox but were not recorded, run: reconcile " + runId);
        }
        return report.isClean() ? 0 : 1;
    }

    private int reconcile(CommandLine cmd) {
        List<String> rest = cmd.getArgList();
        String only = rest.isEmpty() ? null : rest.get(0);

        Set<String> runIds = new LinkedHashSet<>();
        for (AuditLogEntry entry : foundation.getStore().findUnsynced(only)) {
            runIds.add(entry.getRunId());
        }
        if (runIds.isEmpty()) {
            log("Nothing to reconcile");
            return 0;
        }

        String owner = requirePrincipal();
        if (only != null) {
            requireOwnedRun(only, owner);
        }
        List<ProcessingRun> owned = new ArrayList<>();
        for (String runId : runIds) {
            ProcessingRun run = foundation.getStore().getRun(runId);
            if (run.getPrincipal().equalsIgnoreCase(owner)) {
                owned.add(run);
            } else {
                log("Skipping run " + runId + " of another principal");
            }
        }
        if (owned.isEmpty()) {
            log("Nothing to reconcile for " + Principals.hash(owner));
            return 0;
        }

        boolean clean = withSession(owner, connection -> {
            boolean ok = true;
            for (ProcessingRun run : owned) {
                String runId = run.getId();
                foundation.getQuota().run(QuotaScope.MAILBOX, () -> connection.selectFolder(run.getFolder()));
                ReconcileReport report = foundation.getEngine().reconcile(runId, connection);
                log("Run " + runId + ": " + report);
                ok &= report.isClean();
            }
            return ok;
        });
        return clean ? 0 : 1;
    }

    private int sessions() {
        StateStore store = foundation.getStore();

        log("Recent runs:");
        log("-".repeat(70));
        for (ProcessingRun run : store.listRecentRuns(LISTING_LIMIT)) {
            log(String.format(Locale.ROOT, "  %s  %-11s %-12s %5d/%-5s %5.1f%%  %s", run.getId(), run.getStatus(),
                    Principals.hash(run.getPrincipal()), run.getProcessedItems(),
                    run.getItemLimit() != null ? run.getItemLimit() : "-",
                    run.progressPercentage(), run.getCreatedAt()));
        }

        log("");
        log("Recorded sessions:");
        log("-".repeat(70));
        for (SessionSnapshot snapshot : store.listSessionSnapshots(LISTING_LIMIT)) {
            log(String.format(Locale.ROOT, "  %s  %-12s %-8s %-12s retries=%d  last=%s%s", snapshot.getId(),
                    snapshot.getState(), snapshot.getTransport(), Principals.hash(snapshot.getPrincipal()),
                    snapshot.getRetryCount(), snapshot.getLastActivityAt(),
                    snapshot.getClosedAt() != null ? "  closed=" + snapshot.getClosedAt() : ""));
        }
        return 0;
    }

    private int cleanup(CommandLine cmd) {
        int days = cmd.hasOption("days")
                ? parseInt(cmd.getOptionValue("days"), "days")
                : foundation.getConfig().getStore().getRetentionDays();
        CleanupReport report = foundation.getStore().cleanup(days);
        log("Removed " + report.getRuns() + " runs, " + report.getSessions() + " sessions and "
                + report.getFolders() + " cached folders older than " + days + " days");
        return 0;
    }

    /**
     * Verifies a prompted secret against the mailbox and stores it.
     */
    private int login() {
        String owner = requirePrincipal();
        CredentialStore credentials = requireCredentialStore();
        Secret secret = prompt.read(owner)
                .orElseThrow(() -> new AuthenticationException("No secret entered for " + Principals.hash(owner)));
        try {
            MailboxSession session = foundation.getSessions().authenticate(owner, secret);
            foundation.getSessions().disconnect(session);
            credentials.put(owner, secret);
        } finally {
            secret.clear();
        }
        log("Stored credential for " + Principals.hash(owner));
        return 0;
    }

    private int logout() {
        String owner = requirePrincipal();
        requireCredentialStore().delete(owner);
        for (MailboxSession session : foundation.getSessions().getSessions(owner)) {
            foundation.getSessions().disconnect(session);
        }
        log("Removed stored credential for " + Principals.hash(owner));
        return 0;
    }

    private int authStatus() {
        String owner = requirePrincipal();
        log("Principal:         " + Principals.hash(owner));
        log("Auth mode:         " + foundation.getConfig().getMailbox().getAuthMode().name().toLowerCase(Locale.ROOT));

        Optional<CredentialStore> credentials = foundation.getCredentials();
        if (credentials.isEmpty()) {
            log("Stored credential: no credential store configured");
        } else {
            Optional<Secret> stored = credentials.get().get(owner);
            stored.ifPresent(Secret::clear);
            log("Stored credential: " + (stored.isPresent() ? "yes" : "no"));
        }

        log("");
        log("Recorded sessions:");
        log("-".repeat(70));
        for (SessionSnapshot snapshot : foundation.getStore().listSessionSnapshots(LISTING_LIMIT)) {
            if (snapshot.getPrincipal().equalsIgnoreCase(owner)) {
                log(String.format(Locale.ROOT, "  %s  %-12s %-8s retries=%d  last=%s", snapshot.getId(),
                        snapshot.getState(), snapshot.getTransport(), snapshot.getRetryCount(),
                        snapshot.getLastActivityAt()));
            }
        }
        return 0;
    }

    /**
     * Authenticates, runs the work and disconnects.
     */
    private <T> T withSession(String owner, Function<MailboxConnection, T> work) {
        Secret secret = resolveSecret(owner);
        MailboxSession session = null;
        try {
            session = foundation.getSessions().authenticate(owner, secret);
            return work.apply(foundation.getSessions().connection(session));
        } finally {
            if (session != null) {
                foundation.getSessions().disconnect(session);
            }
            secret.clear();
        }
    }

    private Secret resolveSecret(String owner) {
        Optional<Secret> stored = foundation.getCredentials().flatMap(store -> store.get(owner));
        if (stored.isPresent()) {
            log.debug("Using stored credential for {}", Principals.hash(owner));
            return stored.get();
        }
        return prompt.read(owner)
                .orElseThrow(() -> new AuthenticationException("No credential available for " + Principals.hash(owner)));
    }

    private void requireFolder(String owner, String folder, MailboxConnection connection) {
        List<MailFolder> folders = foundation.getQuota().call(QuotaScope.MAILBOX,
                () -> foundation.getFolderCache().getFolders(owner, connection));
        for (MailFolder candidate : folders) {
            if (candidate.getName().equals(folder)) {
                return;
            }
        }
        throw new ValidationException("Folder '" + folder + "' does not exist");
    }

    private CredentialStore requireCredentialStore() {
        return foundation.getCredentials()
                .orElseThrow(() -> new ValidationException("No credential store configured, enable vault"));
    }

    private ProcessingRun requireOwnedRun(String runId, String owner) {
        ProcessingRun run = foundation.getStore().getRun(runId);
        if (!run.getPrincipal().equalsIgnoreCase(owner)) {
            throw new ValidationException("Run " + runId + " belongs to another principal");
        }
        return run;
    }

    private String requirePrincipal() {
        if (principal == null || principal.isBlank()) {
            throw new ValidationException("No principal given, use --principal or mailbox.principal");
        }
        if (!Principals.isValid(principal)) {
            throw new ValidationException("Malformed principal");
        }
        return principal;
    }

    private static String requireRunId(CommandLine cmd) {
        List<String> rest = cmd.getArgList();
        if (rest.isEmpty() || rest.get(0).isBlank()) {
            throw new ValidationException("Missing run id");
        }
        return rest.get(0);
    }

    private static int parseInt(String value, String option) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ValidationException("--" + option + " expects a whole number, got: " + value, e);
        }
    }

    private static double parseConfidence(String value, String option) {
        double confidence;
        try {
            confidence = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ValidationException("--" + option + " expects a number, got: " + value, e);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new ValidationException("--" + option + " must be between 0 and 1");
        }
        return confidence;
    }

    private void printRun(ProcessingRun run) {
        log("Run:             " + run.getId());
        log("Status:          " + run.getStatus());
        log("Folder:          " + run.getFolder());
        log(String.format(Locale.ROOT, "Progress:        %d items (%.1f%%)", run.getProcessedItems(), run.progressPercentage()));
        log("Suggestions:     " + run.getGeneratedSuggestions());
        log("Applied:         " + run.getAppliedSuggestions());
        if (!run.getErrorLog().isEmpty()) {
            log("Errors:");
            run.getErrorLog().forEach(error -> log("  " + error));
        }
    }

    static String error(ErrorKind kind, String message) {
        return "error[" + kind.name().toLowerCase(Locale.ROOT) + "]: " + message;
    }

    private static CommandLine parse(Options options, String[] args) throws ParseException {
        return new DefaultParser().parse(options, args);
    }

    private static Options classifyOptions() {
        Options options = new Options();
        options.addOption(null, "limit", true, "Maximum items to process");
        options.addOption(null, "apply", false, "Apply confident suggestions when the run completes");
        options.addOption(null, "folder", true, "Folder to classify");
        options.addOption(null, "resume", true, "Resume a paused run");
        return options;
    }

    private static Options reviewOptions() {
        Options options = new Options();
        options.addOption(null, "approve-above", true, "Approve pending suggestions at or above confidence");
        options.addOption(null, "reject-below", true, "Reject pending suggestions below confidence");
        return options;
    }

    private static Options cleanupOptions() {
        Options options = new Options();
        options.addOption(null, "days", true, "Retention in days");
        return options;
    }

    private void log(String string) {
        out.println(string);
    }
}
