package com.rstfmt.core.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.Objects;

/**
 * Writes formatted text to a print writer, standard output by default.
 *
 * <p>Only the formatted text goes to the stream; status messages go to the log.
 */
public class ConsoleWriter implements OutputWriter {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleWriter.class);

    private final PrintWriter out;

    public ConsoleWriter() {
        this(new PrintWriter(System.out, true));
    }

    public ConsoleWriter(PrintWriter out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void write(FormattedFile file) {
        logger.debug("Writing {} to console ({} characters)", file.label(), file.content().length());
        out.print(file.output());
        out.flush();
    }
}
