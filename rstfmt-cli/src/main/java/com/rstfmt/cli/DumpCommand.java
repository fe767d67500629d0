package com.rstfmt.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rstfmt.core.config.ConfigLoader;
import com.rstfmt.core.config.RstFmtConfig;
import com.rstfmt.core.inspect.TreeDumper;
import com.rstfmt.core.model.Node;
import com.rstfmt.core.parser.RstParseException;
import com.rstfmt.core.parser.RstParser;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to print the document tree of each input.
 */
@Command(
    name = "dump",
    description = "Print the parsed document tree",
    mixinStandardHelpOptions = true
)
public class DumpCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DumpCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"--raw"}, description = "Keep diagnostics and skip reference linking")
    private boolean raw;

    @Option(names = {"--color"}, description = "Highlight node kinds with ANSI colors")
    private boolean color;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: .rstfmt.yaml)"
    )
    private Path configPath = Path.of(ConfigLoader.DEFAULT_FILE_NAME);

    @Parameters(arity = "0..*", paramLabel = "FILE", description = "Files to dump")
    private List<String> files = new ArrayList<>();

    @Override
    public Integer call() {
        RstFmtConfig config = ConfigLoader.load(configPath);
        RstParser parser = new RstParser(config.markupRegistry());
        TreeDumper dumper = new TreeDumper(color);
        PrintWriter out = spec.commandLine().getOut();

        int failures = 0;
        for (String name : SourceFiles.orStdin(files)) {
            try {
                String text = SourceFiles.read(name, System.in).text();
                Node document = raw ? parser.parseRaw(text) : parser.parse(text);
                out.print(dumper.dump(document));
            } catch (RstParseException | UncheckedIOException e) {
                log.error("{}: {}", name, e.getMessage());
                failures++;
            }
        }
        out.flush();
        return failures == 0 ? 0 : 1;
    }
}
