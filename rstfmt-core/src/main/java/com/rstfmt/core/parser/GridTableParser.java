package com.rstfmt.core.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.rstfmt.core.model.Node;
import com.rstfmt.core.model.NodeKind;

/**
 * Parses grid tables without spanning cells.
 *
 * <p>Column boundaries come from the {@code +} positions of the top border. Every content
 * line must carry a {@code |} at each boundary and every separator must be a complete
 * border, so tables with row or column spans are rejected. A {@code +===+} separator ends
 * the header rows. Cell text is dedented and parsed as nested body content.
 */
final class GridTableParser {

    static final String COLS = "cols";

    @FunctionalInterface
    interface CellParser {
        List<Node> parse(List<String> lines, int firstLine);
    }

    private final List<String> lines;
    private final int firstLine;
    private final CellParser cellParser;
    private final List<Integer> boundaries = new ArrayList<>();

    private GridTableParser(List<String> lines, int firstLine, CellParser cellParser) {
        this.lines = lines;
        this.firstLine = firstLine;
        this.cellParser = cellParser;
    }

    /**
     * Parses one table.
     *
     * @param lines table lines, top border first
     * @param firstLine source line of the top border
     * @param cellParser parser for cell contents
     * @return TABLE node
     * @throws RstParseException if the table is malformed or uses spans
     */
    static Node parse(List<String> lines, int firstLine, CellParser cellParser) {
        return new GridTableParser(lines, firstLine, cellParser).parse();
    }

    private Node parse() {
        String top = lines.get(0);
        for (int i = 0; i < top.length(); i++) {
            if (top.charAt(i) == '+') {
                boundaries.add(i);
            }
        }
        int last = lines.size() - 1;
        if (last < 2 || !(isBorder(lines.get(last), '-') || isBorder(lines.get(last), '='))) {
            throw new RstParseException("Malformed table: missing bottom border", firstLine + last);
        }

        List<Node> headRows = null;
        List<Node> rows = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        int rowStart = 1;
        for (int i = 1; i <= last; i++) {
            String line = lines.get(i);
            boolean header = isBorder(line, '=');
            if (header || isBorder(line, '-')) {
                if (pending.isEmpty()) {
                    throw new RstParseException("Malformed table: empty row", firstLine + i);
                }
                rows.add(row(pending, firstLine + rowStart));
                pending.clear();
                rowStart = i + 1;
                if (header && i < last) {
                    if (headRows != null) {
                        throw new RstParseException("Malformed table: more than one header separator", firstLine + i);
                    }
                    headRows = new ArrayList<>(rows);
                    rows.clear();
                }
            } else if (isContentLine(line)) {
                pending.add(line);
            } else {
                throw new RstParseException(
                    "Malformed table: spanning cells and ragged borders are not supported", firstLine + i);
            }
        }

        List<Node> group = new ArrayList<>();
        for (int c = 0; c + 1 < boundaries.size(); c++) {
            int width = boundaries.get(c + 1) - boundaries.get(c) - 1;
            group.add(Node.of(NodeKind.COLSPEC, Map.of(Node.COLWIDTH, width), List.of()));
        }
        if (headRows != null) {
            group.add(Node.of(NodeKind.THEAD, headRows));
        }
        group.add(Node.of(NodeKind.TBODY, rows));

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(COLS, boundaries.size() - 1);
        return Node.of(NodeKind.TABLE, List.of(Node.of(NodeKind.TGROUP, attributes, group)));
    }

    private Node row(List<String> rowLines, int line) {
        List<Node> entries = new ArrayList<>();
        for (int c = 0; c + 1 < boundaries.size(); c++) {
            List<String> cell = new ArrayList<>(rowLines.size());
            for (String rowLine : rowLines) {
                cell.add(rowLine.substring(boundaries.get(c) + 1, boundaries.get(c + 1)).stripTrailing());
            }
            entries.add(Node.of(NodeKind.ENTRY, cellParser.parse(TextBlocks.dedent(TextBlocks.trimBlank(cell)), line)));
        }
        return Node.of(NodeKind.ROW, entries);
    }

    private boolean isBorder(String line, char fill) {
        if (line.length() != lines.get(0).length()) {
            return false;
        }
        for (int i = 0; i < line.length(); i++) {
            char expected = boundaries.contains(i) ? '+' : fill;
            if (line.charAt(i) != expected) {
                return false;
            }
        }
        return true;
    }

    private boolean isContentLine(String line) {
        if (line.length() != lines.get(0).length()) {
            return false;
        }
        for (int boundary : boundaries) {
            if (line.charAt(boundary) != '|') {
                return false;
            }
        }
        return true;
    }
}
