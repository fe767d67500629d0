package com.rstfmt.core.output;

/**
 * Destination for formatted text.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class BackupWriter implements OutputWriter {
 *     @Override
 *     public String getId() {
 *         return "backup";
 *     }
 *
 *     @Override
 *     public void write(FormattedFile file) {
 *         Files.writeString(file.path().resolveSibling(file.path().getFileName() + ".fmt"), file.output());
 *     }
 * }
 * }</pre>
 */
public interface OutputWriter {

    /**
     * Returns unique identifier for this writer, lowercase (e.g. "console", "in-place").
     *
     * @return writer identifier
     */
    String getId();

    /**
     * Writes one formatted file.
     *
     * @param file formatted file
     * @throws java.io.UncheckedIOException if writing fails
     * @throws IllegalStateException if the writer cannot handle the file
     */
    void write(FormattedFile file);
}
