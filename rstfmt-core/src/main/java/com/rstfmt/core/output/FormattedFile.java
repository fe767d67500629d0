package com.rstfmt.core.output;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Result of formatting one input.
 *
 * @param label name used in messages ({@code -} for standard input)
 * @param path source file, or null for standard input
 * @param original text before formatting
 * @param content formatted text, without the final newline
 */
public record FormattedFile(
    String label,
    Path path,
    String original,
    String content
) {
    /**
     * Compact constructor with validation.
     */
    public FormattedFile {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(original, "original must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Returns the text as it is written out: the formatted content plus a final newline.
     *
     * @return output text
     */
    public String output() {
        return content + "\n";
    }

    public boolean isChanged() {
        return !original.equals(output());
    }
}
