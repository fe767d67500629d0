package com.rstfmt.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Line-level helpers shared by the block parsers.
 */
final class TextBlocks {

    private static final int TAB_WIDTH = 8;
    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

    private TextBlocks() {
    }

    /**
     * Splits source text into lines with tabs expanded and trailing whitespace removed.
     */
    static List<String> lines(String source) {
        String text = source.startsWith("\uFEFF") ? source.substring(1) : source;
        String[] parts = LINE_BREAK.split(text, -1);
        List<String> lines = new ArrayList<>(parts.length);
        for (String part : parts) {
            lines.add(expandTabs(part.replace('\f', ' ').replace('\u000B', ' ')).stripTrailing());
        }
        return lines;
    }

    static String expandTabs(String line) {
        if (line.indexOf('\t') < 0) {
            return line;
        }
        StringBuilder sb = new StringBuilder(line.length() + TAB_WIDTH);
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\t') {
                sb.append(" ".repeat(TAB_WIDTH - sb.length() % TAB_WIDTH));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static int indentOf(String line) {
        int i = 0;
        while (i < line.length() && line.charAt(i) == ' ') {
            i++;
        }
        return i;
    }

    static boolean isBlank(String line) {
        return line.isEmpty();
    }

    /**
     * Returns the end (exclusive) of the block starting at {@code from} whose lines are blank
     * or indented by at least {@code minIndent}, with trailing blank lines excluded.
     */
    static int indentedBlockEnd(List<String> lines, int from, int minIndent) {
        int end = from;
        while (end < lines.size() && (isBlank(lines.get(end)) || indentOf(lines.get(end)) >= minIndent)) {
            end++;
        }
        while (end > from && isBlank(lines.get(end - 1))) {
            end--;
        }
        return end;
    }

    static int skipBlank(List<String> lines, int from) {
        int i = from;
        while (i < lines.size() && isBlank(lines.get(i))) {
            i++;
        }
        return i;
    }

    /**
     * Removes the smallest indentation shared by all non-blank lines.
     */
    static List<String> dedent(List<String> lines) {
        int common = Integer.MAX_VALUE;
        for (String line : lines) {
            if (!isBlank(line)) {
                common = Math.min(common, indentOf(line));
            }
        }
        if (common == Integer.MAX_VALUE || common == 0) {
            return new ArrayList<>(lines);
        }
        return strip(lines, common);
    }

    /**
     * Removes exactly {@code indent} columns from every non-blank line.
     */
    static List<String> strip(List<String> lines, int indent) {
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            result.add(isBlank(line) ? line : line.substring(Math.min(indent, indentOf(line))));
        }
        return result;
    }

    /**
     * Drops leading and trailing blank lines.
     */
    static List<String> trimBlank(List<String> lines) {
        int start = 0;
        int end = lines.size();
        while (start < end && isBlank(lines.get(start))) {
            start++;
        }
        while (end > start && isBlank(lines.get(end - 1))) {
            end--;
        }
        return new ArrayList<>(lines.subList(start, end));
    }
}
