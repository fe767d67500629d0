package com.rstfmt.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads command inputs: file paths, or standard input for {@code -}.
 */
final class SourceFiles {

    static final String STDIN = "-";

    /**
     * One input document.
     *
     * @param label name used in messages
     * @param path file path, or null for standard input
     * @param text document text
     */
    record Source(String label, Path path, String text) {

        boolean isStdin() {
            return path == null;
        }
    }

    private SourceFiles() {
    }

    /**
     * Returns the inputs to process: the given names, or standard input when there are none.
     */
    static List<String> orStdin(List<String> names) {
        return names == null || names.isEmpty() ? List.of(STDIN) : names;
    }

    static Source read(String name, InputStream stdin) {
        try {
            if (STDIN.equals(name)) {
                return new Source(STDIN, null, new String(stdin.readAllBytes(), StandardCharsets.UTF_8));
            }
            Path path = Path.of(name);
            return new Source(name, path, Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + name + ": " + e.getMessage(), e);
        }
    }
}
