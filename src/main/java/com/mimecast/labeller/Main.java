package com.mimecast.labeller;

import com.mimecast.labeller.config.LabellerConfig;
import com.mimecast.labeller.error.ErrorKind;
import com.mimecast.labeller.error.LabellerException;
import com.mimecast.labeller.main.Foundation;
import com.mimecast.labeller.main.LabellerCLI;
import com.mimecast.labeller.main.PasswordPrompt;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Parses the global options then hands the command and its arguments to {@link LabellerCLI}.
 * <br>Global options go before the command: {@code --principal me@example.com classify --limit 50}.
 *
 * @see LabellerCLI
 */
public class Main {

    /**
     * Application jar name.
     */
    private static final String NAME = "labeller.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME + " [options] <command> [args]";

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Mailbox label suggestions with review and reconciliation";

    /**
     * Default configuration path.
     */
    public static final String DEFAULT_CONFIG = "cfg/labeller.json5";

    private final String[] args;
    private final PrintStream out;
    private int exitCode;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        System.exit(new Main(args, System.out).getExitCode());
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     * @param out  Output stream.
     */
    Main(String[] args, PrintStream out) {
        this.args = args;
        this.out = out;

        // Parse options.
        Options options = options();
        Optional<CommandLine> opt = parseArgs(options);
        if (opt.isEmpty()) {
            exitCode = 1;
            return;
        }
        CommandLine cmd = opt.get();

        // Disable logging unless debugging.
        if (!cmd.hasOption("debug")) {
            Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.OFF);
        }

        List<String> rest = cmd.getArgList();
        if (cmd.hasOption("help")) {
            optionsUsage(options);
            exitCode = 0;
        } else if (rest.isEmpty()) {
            optionsUsage(options);
            exitCode = 1;
        } else if (rest.get(0).startsWith("-")) {
            // Parsing stops at the first unknown token, so a stray option lands here.
            log("Options error: Unrecognized option: " + rest.get(0));
            log("");
            optionsUsage(options);
            exitCode = 1;
        } else {
            exitCode = run(cmd, rest.get(0), rest.subList(1, rest.size()).toArray(new String[0]));
        }
    }

    /**
     * Loads configuration, wires components and runs the command.
     *
     * @param cmd     CommandLine instance.
     * @param command Command name.
     * @param rest    Command arguments.
     * @return Exit code.
     */
    private int run(CommandLine cmd, String command, String[] rest) {
        LabellerConfig config;
        try {
            config = LabellerConfig.load(Path.of(cmd.getOptionValue("config", DEFAULT_CONFIG)));
        } catch (IOException e) {
            log("error[" + ErrorKind.VALIDATION.name().toLowerCase() + "]: Unable to read configuration: " + e.getMessage());
            return 1;
        }

        String principal = cmd.getOptionValue("principal", config.getMailbox().getPrincipal());
        try (Foundation foundation = Foundation.create(config)) {
            Duration grace = config.getSession().getShutdownGrace();
            Thread hook = new Thread(() -> {
                if (foundation.cancelActiveRun()) {
                    log("Cancelling, the run will pause at the next page boundary");
                    // Sessions stay open until the page in flight is stored.
                    if (!foundation.awaitActiveRun(grace)) {
                        log("Run did not reach a page boundary within " + grace.getSeconds() + "s");
                    }
                }
                foundation.shutdownSessions();
            }, "Labeller-Shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            try {
                return new LabellerCLI(foundation, principal, PasswordPrompt.CONSOLE, out).run(command, rest);
            } finally {
                removeHook(hook);
            }
        } catch (LabellerException e) {
            log("error[" + e.getKind().name().toLowerCase() + "]: " + e.getMessage());
            return 1;
        }
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption("c", "config", true, "Configuration file (default " + DEFAULT_CONFIG + ")");
        options.addOption("p", "principal", true, "Mailbox principal");
        options.addOption(null, "debug", false, "Enable logging");
        options.addOption("h", "help", false, "Show usage");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    public void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");

        // Capture System.out to get help output.
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos);
        PrintStream oldOut = System.out;
        System.setOut(ps);

        try {
            HelpFormatter formatter = HelpFormatter.builder()
                .setShowSince(false)
                .get();
            formatter.printHelp(" ", "", options, "", true);
            System.out.flush();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        } finally {
            System.setOut(oldOut);
        }

        log(baos.toString());
        log("Commands: " + String.join(", ", LabellerCLI.COMMANDS));
        log("");
    }

    /**
     * Parser for CLI arguments.
     * <p>Parsing stops at the command name so its own options are left for the command.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args, true);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // Already shutting down; the hook is running.
            LogManager.getLogger(Main.class).debug("Shutdown in progress, keeping hook");
        }
    }

    /**
     * Gets args.
     *
     * @return String array.
     */
    public String[] getArgs() {
        return Arrays.copyOf(args, args.length);
    }

    /**
     * Gets the process exit code.
     *
     * @return 0 on full success, 1 otherwise.
     */
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    public void log(String string) {
        out.println(string);
    }
}
