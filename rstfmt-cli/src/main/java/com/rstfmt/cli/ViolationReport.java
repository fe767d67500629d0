package com.rstfmt.cli;

import com.rstfmt.core.check.ConsistencyViolationException;

import java.io.PrintWriter;

/**
 * Reports a failed consistency check so both trees and both outputs can be diffed.
 *
 * <p>When the checker wrote its artifacts, only their location is printed. Otherwise the
 * dumps and outputs are printed in full.
 */
final class ViolationReport {

    private ViolationReport() {
        // Utility class
    }

    static void print(PrintWriter err, ConsistencyViolationException e) {
        err.println(e.getMessage());
        if (e.getDumpDirectory() != null) {
            err.println("Wrote dump1.txt, dump2.txt, out1.txt and out2.txt to " + e.getDumpDirectory());
        } else {
            section(err, "dump1", e.getFirstDump());
            section(err, "dump2", e.getSecondDump());
            section(err, "out1", e.getFirstOutput());
            section(err, "out2", e.getSecondOutput());
        }
        err.flush();
    }

    private static void section(PrintWriter err, String name, String content) {
        err.println("--- " + name + " ---");
        err.println(content.endsWith("\n") ? content.substring(0, content.length() - 1) : content);
    }
}
