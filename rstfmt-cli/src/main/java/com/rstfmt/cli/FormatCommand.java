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
import com.rstfmt.core.inspect.TreeDumper;
import com.rstfmt.core.model.Node;
import com.rstfmt.core.output.ConsoleWriter;
import com.rstfmt.core.output.FormattedFile;
import com.rstfmt.core.output.InPlaceWriter;
import com.rstfmt.core.output.OutputWriter;
import com.rstfmt.core.parser.RstParseException;
import com.rstfmt.core.parser.RstParser;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to format reStructuredText files.
 *
 * <p>Each input is parsed, optionally checked for stable formatting, rendered at the target
 * width and written to standard output or back to its file. A failing input is reported
 * and skipped; the remaining inputs are still processed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Format to standard output
 * rstfmt format README.rst
 *
 * # Rewrite in place, unbounded width
 * rstfmt format -i -w 0 docs/index.rst docs/usage.rst
 *
 * # Verify stability before formatting
 * rstfmt format --test README.rst
 * }</pre>
 */
@Command(
    name = "format",
    description = "Format reStructuredText files (standard input when no file or - is given)",
    mixinStandardHelpOptions = true
)
public class FormatCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-i", "--in-place"}, description = "Rewrite files in place")
    private boolean inPlace;

    @Option(names = {"-v", "--verbose"}, description = "Dump each parsed tree to standard error")
    private boolean verbose;

    @Option(
        names = {"-w", "--width"},
        description = "Target line width; 0 or negative for unbounded (default: from config, 72)"
    )
    private Integer width;

    @Option(names = {"--test"}, description = "Check that formatting is stable before writing")
    private boolean test;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: .rstfmt.yaml)"
    )
    private Path configPath = Path.of(ConfigLoader.DEFAULT_FILE_NAME);

    @Parameters(arity = "0..*", paramLabel = "FILE", description = "Files to format")
    private List<String> files = new ArrayList<>();

    @Override
    public Integer call() {
        RstFmtConfig config = ConfigLoader.load(configPath);
        int effectiveWidth = width != null ? width : config.format().width();
        RstParser parser = new RstParser(config.markupRegistry());
        NodeFormatter formatter = new NodeFormatter();
        IdempotenceChecker checker = test
            ? new IdempotenceChecker(parser, formatter, config.check().effectiveWidths(), config.check().dumpPathOrTemp())
            : null;
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        OutputWriter console = new ConsoleWriter(out);
        OutputWriter inPlaceWriter = new InPlaceWriter();

        int failures = 0;
        for (String name : SourceFiles.orStdin(files)) {
            try {
                SourceFiles.Source source = SourceFiles.read(name, System.in);
                Node document = parser.parse(source.text());
                if (verbose) {
                    err.print(new TreeDumper(System.console() != null).dump(document));
                    err.flush();
                }
                if (checker != null) {
                    checker.check(document);
                }
                String content = formatter.render(document, effectiveWidth);
                FormattedFile file = new FormattedFile(source.label(), source.path(), source.text(), content);
                writerFor(source, console, inPlaceWriter).write(file);
            } catch (ConsistencyViolationException e) {
                err.println("Failed consistency test on " + name + "!");
                ViolationReport.print(err, e);
                log.error("{}: {}", name, e.getMessage());
                failures++;
            } catch (RstParseException | UncheckedIOException | IllegalStateException e) {
                log.error("{}: {}", name, e.getMessage());
                failures++;
            }
        }
        return failures == 0 ? 0 : 1;
    }

    private OutputWriter writerFor(SourceFiles.Source source, OutputWriter console, OutputWriter inPlaceWriter) {
        if (!inPlace) {
            return console;
        }
        if (source.isStdin()) {
            log.warn("Cannot edit standard input in place; writing to standard output");
            return console;
        }
        return inPlaceWriter;
    }
}
