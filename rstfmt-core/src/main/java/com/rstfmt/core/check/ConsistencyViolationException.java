package com.rstfmt.core.check;

import java.nio.file.Path;

/**
 * Thrown when formatting is not a fixed point: re-parsing the output produced a different
 * tree, or formatting it again produced different text.
 */
public class ConsistencyViolationException extends RuntimeException {

    private final Integer width;
    private final String firstDump;
    private final String secondDump;
    private final String firstOutput;
    private final String secondOutput;
    private final Path dumpDirectory;

    /**
     * Creates a new violation.
     *
     * @param width width the violation occurred at, or null for unbounded
     * @param reason what differed
     * @param firstDump dump of the original tree
     * @param secondDump dump of the re-parsed tree (empty if the output did not parse)
     * @param firstOutput output of the original tree
     * @param secondOutput output of the re-parsed tree (empty if the output did not parse)
     * @param dumpDirectory directory the four artifacts were written to, or null if they were not written
     */
    public ConsistencyViolationException(Integer width, String reason,
                                         String firstDump, String secondDump,
                                         String firstOutput, String secondOutput,
                                         Path dumpDirectory) {
        super("Formatting is not stable at width " + (width == null ? "unbounded" : width) + ": " + reason);
        this.width = width;
        this.firstDump = firstDump;
        this.secondDump = secondDump;
        this.firstOutput = firstOutput;
        this.secondOutput = secondOutput;
        this.dumpDirectory = dumpDirectory;
    }

    public Integer getWidth() {
        return width;
    }

    public String getFirstDump() {
        return firstDump;
    }

    public String getSecondDump() {
        return secondDump;
    }

    public String getFirstOutput() {
        return firstOutput;
    }

    public String getSecondOutput() {
        return secondOutput;
    }

    public Path getDumpDirectory() {
        return dumpDirectory;
    }
}
