package com.rstfmt.core.inspect;

import com.rstfmt.core.model.DirectiveOption;
import com.rstfmt.core.model.Node;
import com.rstfmt.core.model.NodeKind;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders a document tree as an indented outline for inspection.
 *
 * <p>One line per node, four spaces per depth level:
 * <pre>
 * - document {}
 *     - paragraph {}
 *         - text 'This is '
 *         - strong {}
 *             - text 'bold'
 * </pre>
 * Element nodes list their non-empty attributes; text nodes show their text quoted and
 * truncated to 100 characters. Kind names can be highlighted with ANSI colors for
 * terminal output.
 */
public class TreeDumper {

    private static final String ANSI_BLUE = "\u001B[34m";
    private static final String ANSI_RESET = "\u001B[m";
    private static final String INDENT = "    ";
    private static final int MAX_TEXT = 100;

    private final boolean useColors;

    public TreeDumper() {
        this(false);
    }

    public TreeDumper(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Dumps a tree.
     *
     * @param root root node
     * @return outline, one line per node, each terminated by a newline
     */
    public String dump(Node root) {
        StringBuilder sb = new StringBuilder();
        dump(root, 0, sb);
        return sb.toString();
    }

    private void dump(Node node, int depth, StringBuilder sb) {
        sb.append(INDENT.repeat(depth)).append("- ");
        String kind = node.kind().tagName();
        sb.append(useColors ? ANSI_BLUE + kind + ANSI_RESET : kind).append(' ');
        if (node.is(NodeKind.TEXT)) {
            sb.append(quote(truncate(node.astext())));
        } else {
            sb.append(attributes(node));
        }
        sb.append('\n');
        for (Node child : node.children()) {
            dump(child, depth + 1, sb);
        }
    }

    private static String attributes(Node node) {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (Map.Entry<String, Object> entry : node.attributes().entrySet()) {
            Object value = entry.getValue();
            if (isEmpty(value)) {
                continue;
            }
            joiner.add(quote(entry.getKey()) + ": " + format(value));
        }
        return joiner.toString();
    }

    private static boolean isEmpty(Object value) {
        return value == null
            || Boolean.FALSE.equals(value)
            || (value instanceof Integer i && i == 0)
            || (value instanceof String s && s.isEmpty())
            || (value instanceof Collection<?> c && c.isEmpty());
    }

    private static String format(Object value) {
        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof Node target) {
            // back-reference, shown by kind only
            return "<" + target.kind().tagName() + ">";
        }
        if (value instanceof DirectiveOption option) {
            return option.hasValue() ? "(" + quote(option.key()) + ", " + quote(option.value()) + ")" : quote(option.key());
        }
        if (value instanceof List<?> list) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (Object element : list) {
                joiner.add(format(element));
            }
            return joiner.toString();
        }
        return String.valueOf(value);
    }

    private static String truncate(String text) {
        return text.length() > MAX_TEXT ? text.substring(0, MAX_TEXT) : text;
    }

    private static String quote(String text) {
        StringBuilder sb = new StringBuilder("'");
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                default -> sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }
}
