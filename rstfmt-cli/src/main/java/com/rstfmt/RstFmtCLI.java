package com.rstfmt;

import com.rstfmt.cli.CheckCommand;
import com.rstfmt.cli.DumpCommand;
import com.rstfmt.cli.FormatCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Main CLI entry point for rstfmt.
 *
 * <p>rstfmt reformats reStructuredText into a canonical layout at a target line width.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code format} - Format files to standard output or in place</li>
 *   <li>{@code check} - Verify that formatting is stable for the given files</li>
 *   <li>{@code dump} - Print the parsed document tree</li>
 * </ul>
 *
 * <p>Without a command, {@code format} runs, so files and standard input are formatted
 * directly.
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -q, --quiet} - Suppress all log output except errors</li>
 *   <li>{@code --debug} - Enable debug logging</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Format a file to standard output
 * rstfmt format README.rst
 *
 * # Rewrite files at width 88
 * rstfmt format -i -w 88 docs/*.rst
 *
 * # Format standard input
 * cat README.rst | rstfmt
 * }</pre>
 */
@Command(
    name = "rstfmt",
    mixinStandardHelpOptions = true,
    version = "rstfmt 1.0.0-SNAPSHOT",
    description = "Formatter for reStructuredText",
    subcommands = {
        FormatCommand.class,
        CheckCommand.class,
        DumpCommand.class
    }
)
public class RstFmtCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RstFmtCLI.class);

    /** Command run when the arguments name none. */
    static final String DEFAULT_COMMAND = "format";

    private static final Set<String> GLOBAL_OPTIONS = Set.of("-q", "--quiet", "--debug");
    private static final Set<String> ROOT_ONLY_OPTIONS = Set.of("-h", "--help", "-V", "--version");

    @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
    private boolean quiet;

    @Option(names = {"--debug"}, description = "Enable debug logging")
    private boolean debug;

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    /**
     * Configures the logback root level from the global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (debug) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    private int execute(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    public boolean isQuiet() {
        return quiet;
    }

    public boolean isDebug() {
        return debug;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        RstFmtCLI cli = new RstFmtCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::execute);
    }

    /**
     * Inserts {@value #DEFAULT_COMMAND} after the global options unless the arguments already
     * name a command or ask for help or the version.
     *
     * @param commandLine command line whose subcommands are recognized
     * @param args raw arguments
     * @return arguments with a command
     */
    public static String[] withDefaultCommand(CommandLine commandLine, String... args) {
        int i = 0;
        while (i < args.length && GLOBAL_OPTIONS.contains(args[i])) {
            i++;
        }
        if (i < args.length
            && (commandLine.getSubcommands().containsKey(args[i]) || ROOT_ONLY_OPTIONS.contains(args[i]))) {
            return args;
        }
        List<String> result = new ArrayList<>(Arrays.asList(args));
        result.add(i, DEFAULT_COMMAND);
        return result.toArray(new String[0]);
    }

    /**
     * Runs the arguments, falling back to {@value #DEFAULT_COMMAND}.
     *
     * @param commandLine configured command line
     * @param args raw arguments
     * @return exit code
     */
    public static int executeWithDefault(CommandLine commandLine, String... args) {
        return commandLine.execute(withDefaultCommand(commandLine, args));
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = executeWithDefault(commandLine(), args);
        System.exit(exitCode);
    }
}
