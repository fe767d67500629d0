package com.rstfmt.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rstfmt.core.check.ConsistencyViolationException;
import com.rstfmt.core.check.IdempotenceChecker;
import com.rstfmt.core.config.ConfigLoader;
import com.rstfmt.core.config.RstFmtConfig;
import com.rstfmt.core.format.NodeFormatter;
import com.rstfmt.core.parser.RstParseException;
import com.rstfmt.core.parser.RstParser;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to verify that formatting is stable without writing any output.
 *
 * <p>Prints one line per input: {@code ok <file>} or {@code FAILED <file>: <reason>}.
 */
@Command(
    name = "check",
    description = "Verify that formatting is stable at the configured widths",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: .rstfmt.yaml)"
    )
    private Path configPath = Path.of(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"--dump-dir"},
        description = "Directory for dump1.txt, dump2.txt, out1.txt and out2.txt on failure "
            + "(overrides config; default: system temporary directory)"
    )
    private Path dumpDirectory;

    @Parameters(arity = "0..*", paramLabel = "FILE", description = "Files to check")
    private List<String> files = new ArrayList<>();

    @Override
    public Integer call() {
        RstFmtConfig config = ConfigLoader.load(configPath);
        RstParser parser = new RstParser(config.markupRegistry());
        Path dumps = dumpDirectory != null ? dumpDirectory : config.check().dumpPathOrTemp();
        IdempotenceChecker checker = new IdempotenceChecker(
            parser, new NodeFormatter(), config.check().effectiveWidths(), dumps);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        int failures = 0;
        for (String name : SourceFiles.orStdin(files)) {
            try {
                checker.check(parser.parse(SourceFiles.read(name, System.in).text()));
                out.println("ok " + name);
            } catch (ConsistencyViolationException e) {
                out.println("FAILED " + name + ": " + e.getMessage());
                ViolationReport.print(err, e);
                failures++;
            } catch (RstParseException | UncheckedIOException e) {
                out.println("FAILED " + name + ": " + e.getMessage());
                log.debug("Check failed for {}", name, e);
                failures++;
            }
        }
        out.flush();
        log.info("Checked {} file(s), {} failed", SourceFiles.orStdin(files).size(), failures);
        return failures == 0 ? 0 : 1;
    }
}
