package com.rstfmt.core.format;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import com.rstfmt.core.model.Node;
import com.rstfmt.core.model.NodeKind;

/**
 * Renders grid tables from their declared column widths.
 *
 * <p>Widths come from the {@code colspec} children of a table group and are trusted as
 * declared. Content wider than its column produces a ragged table; this is accepted
 * behavior, the widths are never recomputed from content.
 *
 * <p><b>Output shape:</b>
 * <pre>
 * +----------+----------+
 * | Header 1 | Header 2 |
 * +==========+==========+
 * | a        | b        |
 * +----------+----------+
 * </pre>
 */
final class TableFormatter {

    private static final char BORDER_FILL = '-';
    private static final char HEADER_FILL = '=';
    private static final int CELL_PADDING = 2;

    private final NodeFormatter formatter;

    TableFormatter(NodeFormatter formatter) {
        this.formatter = formatter;
    }

    Stream<String> tgroup(Node node, FormatContext context) {
        List<Integer> widths = new ArrayList<>();
        for (Node child : node.children()) {
            if (child.is(NodeKind.COLSPEC)) {
                widths.add(child.intAttribute(Node.COLWIDTH, CELL_PADDING + 1));
            }
        }
        FormatContext groupContext = context.withColumnWidths(widths);
        String border = border(widths, BORDER_FILL);

        List<String> lines = new ArrayList<>();
        lines.add(border);
        for (Node child : node.children()) {
            if (child.is(NodeKind.THEAD)) {
                rowGroup(child, groupContext).forEach(lines::add);
                lines.add(border(widths, HEADER_FILL));
            } else if (child.is(NodeKind.TBODY)) {
                rowGroup(child, groupContext).forEach(lines::add);
                lines.add(border);
            }
        }
        return lines.stream();
    }

    Stream<String> rowGroup(Node node, FormatContext context) {
        String border = border(requireWidths(context), BORDER_FILL);
        return Lines.joinBlocks(border, node.children().stream().map(row -> formatter.format(row, context)));
    }

    Stream<String> row(Node node, FormatContext context) {
        List<Integer> widths = requireWidths(context);
        int columns = Math.min(widths.size(), node.children().size());

        List<List<String>> cells = new ArrayList<>(columns);
        for (int i = 0; i < columns; i++) {
            Node entry = node.children().get(i);
            FormatContext cellContext = context.withWidth(widths.get(i) - CELL_PADDING);
            cells.add(Lines.joinBlocks("",
                entry.children().stream().map(child -> formatter.format(child, cellContext))).toList());
        }

        List<List<String>> rows = Lines.zipLongest(cells);
        if (rows.isEmpty()) {
            List<String> blank = new ArrayList<>(columns);
            for (int i = 0; i < columns; i++) {
                blank.add(null);
            }
            rows = List.of(blank);
        }

        List<String> lines = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            StringBuilder sb = new StringBuilder("|");
            for (int i = 0; i < columns; i++) {
                String line = row.get(i) != null ? row.get(i) : "";
                sb.append(' ').append(leftJustify(line, widths.get(i) - CELL_PADDING)).append(' ').append('|');
            }
            lines.add(sb.toString());
        }
        return lines.stream();
    }

    static String border(List<Integer> widths, char fill) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            sb.append(String.valueOf(fill).repeat(width)).append('+');
        }
        return sb.toString();
    }

    private static String leftJustify(String text, int width) {
        int length = text.codePointCount(0, text.length());
        return length >= width ? text : text + " ".repeat(width - length);
    }

    private static List<Integer> requireWidths(FormatContext context) {
        if (context.columnWidths() == null) {
            throw new IllegalStateException("Table rows rendered outside of a table group");
        }
        return context.columnWidths();
    }
}
