package com.rstfmt.core.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Writes formatted text back to the file it was read from.
 *
 * <p>Files whose content would not change are left untouched.
 */
public class InPlaceWriter implements OutputWriter {

    private static final Logger logger = LoggerFactory.getLogger(InPlaceWriter.class);

    @Override
    public String getId() {
        return "in-place";
    }

    @Override
    public void write(FormattedFile file) {
        if (file.path() == null) {
            throw new IllegalStateException("Cannot edit " + file.label() + " in place: no file path");
        }
        if (!file.isChanged()) {
            logger.debug("Unchanged: {}", file.path());
            return;
        }
        try {
            Files.writeString(file.path(), file.output(), StandardCharsets.UTF_8);
            logger.info("Reformatted: {}", file.path());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write file: " + file.path(), e);
        }
    }
}
