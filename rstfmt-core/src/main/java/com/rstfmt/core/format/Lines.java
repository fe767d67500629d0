package com.rstfmt.core.format;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Stream helpers for line sequences.
 */
final class Lines {

    private Lines() {
        // Utility class
    }

    /**
     * Concatenates blocks of lines with a separator line between non-empty blocks.
     *
     * @param separator line placed between blocks
     * @param blocks blocks in order
     * @return joined lines
     */
    static Stream<String> joinBlocks(String separator, Stream<Stream<String>> blocks) {
        boolean[] first = {true};
        return blocks
            .map(Stream::toList)
            .filter(block -> !block.isEmpty())
            .flatMap(block -> {
                if (first[0]) {
                    first[0] = false;
                    return block.stream();
                }
                return Stream.concat(Stream.of(separator), block.stream());
            });
    }

    /**
     * Prefixes every non-empty line with {@code n} spaces.
     *
     * @param n indentation
     * @param lines lines to indent
     * @return indented lines
     */
    static Stream<String> indent(int n, Stream<String> lines) {
        String prefix = " ".repeat(n);
        return lines.map(line -> line.isEmpty() ? line : prefix + line);
    }

    /**
     * Emits a blank line before the given lines, but only if there is at least one.
     *
     * @param lines lines
     * @return lines with a leading blank line, or nothing
     */
    static Stream<String> blankBeforeAny(Stream<String> lines) {
        List<String> collected = lines.toList();
        if (collected.isEmpty()) {
            return Stream.empty();
        }
        return Stream.concat(Stream.of(""), collected.stream());
    }

    /**
     * Zips groups of lines, padding exhausted groups with null.
     *
     * @param groups line groups
     * @return rows of lines, one entry per group
     */
    static List<List<String>> zipLongest(List<List<String>> groups) {
        List<Iterator<String>> iterators = new ArrayList<>(groups.size());
        for (List<String> group : groups) {
            iterators.add(group.iterator());
        }
        List<List<String>> rows = new ArrayList<>();
        while (iterators.stream().anyMatch(Iterator::hasNext)) {
            List<String> row = new ArrayList<>(iterators.size());
            for (Iterator<String> iterator : iterators) {
                row.add(iterator.hasNext() ? iterator.next() : null);
            }
            rows.add(row);
        }
        return rows;
    }
}
