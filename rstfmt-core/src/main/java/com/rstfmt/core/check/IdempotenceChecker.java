package com.rstfmt.core.check;

import com.rstfmt.core.format.NodeFormatter;
import com.rstfmt.core.inspect.TreeDumper;
import com.rstfmt.core.model.Node;
import com.rstfmt.core.parser.RstParseException;
import com.rstfmt.core.parser.RstParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Verifies that formatting a document is a fixed point.
 *
 * <p>For every configured width the checker renders the document, parses the output,
 * renders the new tree at the same width and requires that
 * <ol>
 *   <li>both trees are structurally equal ({@link TreeComparator}), and</li>
 *   <li>both outputs are identical.</li>
 * </ol>
 * The first failing width raises a {@link ConsistencyViolationException}. When a dump
 * directory is set, the two tree dumps and the two outputs are also written there as
 * {@code dump1.txt}, {@code dump2.txt}, {@code out1.txt} and {@code out2.txt}.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * IdempotenceChecker checker = new IdempotenceChecker(parser, formatter);
 * checker.check(parser.parse(source));
 * }</pre>
 */
public class IdempotenceChecker {

    private static final Logger log = LoggerFactory.getLogger(IdempotenceChecker.class);

    /** Widths checked by default; {@code null} is unbounded. */
    public static final List<Integer> DEFAULT_WIDTHS =
        Collections.unmodifiableList(Arrays.asList(1, 2, 3, 5, 8, 13, 34, 55, 89, 144, 72, null));

    private final RstParser parser;
    private final NodeFormatter formatter;
    private final List<Integer> widths;
    private final Path dumpDirectory;
    private final TreeDumper dumper = new TreeDumper();

    public IdempotenceChecker(RstParser parser, NodeFormatter formatter) {
        this(parser, formatter, DEFAULT_WIDTHS, null);
    }

    /**
     * Creates a checker.
     *
     * @param parser parser used to read rendered output back
     * @param formatter formatter under test
     * @param widths widths to check in order; null entries mean unbounded
     * @param dumpDirectory directory for failure artifacts, or null to keep them in the exception only
     */
    public IdempotenceChecker(RstParser parser, NodeFormatter formatter, List<Integer> widths, Path dumpDirectory) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
        Objects.requireNonNull(widths, "widths must not be null");
        if (widths.isEmpty()) {
            throw new IllegalArgumentException("At least one width is required");
        }
        this.widths = Collections.unmodifiableList(new ArrayList<>(widths));
        this.dumpDirectory = dumpDirectory;
    }

    public List<Integer> widths() {
        return widths;
    }

    /**
     * Checks a document at every configured width.
     *
     * @param document preprocessed document tree
     * @throws ConsistencyViolationException at the first width where formatting is not stable
     */
    public void check(Node document) {
        Objects.requireNonNull(document, "document must not be null");
        for (Integer width : widths) {
            checkWidth(document, width);
        }
        log.debug("Formatting stable at {} widths", widths.size());
    }

    private void checkWidth(Node document, Integer width) {
        String firstOutput = formatter.render(document, width);
        Node reparsed;
        try {
            reparsed = parser.parse(firstOutput);
        } catch (RstParseException e) {
            throw violation(width, "rendered output does not parse: " + e.getMessage(),
                document, null, firstOutput, "");
        }
        String secondOutput = formatter.render(reparsed, width);

        Optional<String> difference = TreeComparator.difference(document, reparsed);
        if (difference.isPresent()) {
            throw violation(width, "trees differ at " + difference.get(), document, reparsed, firstOutput, secondOutput);
        }
        if (!firstOutput.equals(secondOutput)) {
            throw violation(width, "outputs differ", document, reparsed, firstOutput, secondOutput);
        }
    }

    private ConsistencyViolationException violation(Integer width, String reason, Node first, Node second,
                                                    String firstOutput, String secondOutput) {
        String firstDump = dumper.dump(first);
        String secondDump = second != null ? dumper.dump(second) : "";
        boolean written = dumpDirectory != null && writeArtifacts(firstDump, secondDump, firstOutput, secondOutput);
        return new ConsistencyViolationException(width, reason, firstDump, secondDump, firstOutput, secondOutput,
            written ? dumpDirectory : null);
    }

    private boolean writeArtifacts(String firstDump, String secondDump, String firstOutput, String secondOutput) {
        try {
            Files.createDirectories(dumpDirectory);
            Files.writeString(dumpDirectory.resolve("dump1.txt"), firstDump, StandardCharsets.UTF_8);
            Files.writeString(dumpDirectory.resolve("dump2.txt"), secondDump, StandardCharsets.UTF_8);
            Files.writeString(dumpDirectory.resolve("out1.txt"), firstOutput + "\n", StandardCharsets.UTF_8);
            Files.writeString(dumpDirectory.resolve("out2.txt"), secondOutput + "\n", StandardCharsets.UTF_8);
            log.info("Wrote consistency dumps to: {}", dumpDirectory);
            return true;
        } catch (IOException e) {
            log.error("Failed to write consistency dumps to {}: {}", dumpDirectory, e.getMessage());
            return false;
        }
    }
}
