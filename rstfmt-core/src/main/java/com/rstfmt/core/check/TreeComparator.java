package com.rstfmt.core.check;

import com.rstfmt.core.model.Node;
import com.rstfmt.core.model.NodeKind;

import java.util.List;
import java.util.Optional;

/**
 * Structural comparison of document trees.
 *
 * <p>Two trees are structurally equal when their roots have the same kind and the same
 * number of children, recursively. Attribute values and text are not compared, and
 * {@code system_message} nodes are ignored on both sides.
 */
public final class TreeComparator {

    private TreeComparator() {
    }

    /**
     * Describes the first structural difference found in document order.
     *
     * @param first first tree
     * @param second second tree
     * @return path and description of the difference, or empty when equivalent
     */
    public static Optional<String> difference(Node first, Node second) {
        return difference(first, second, first.kind().tagName());
    }

    private static Optional<String> difference(Node first, Node second, String path) {
        if (first.kind() != second.kind()) {
            return Optional.of(path + ": " + first.kind().tagName() + " vs " + second.kind().tagName());
        }
        List<Node> left = significantChildren(first);
        List<Node> right = significantChildren(second);
        if (left.size() != right.size()) {
            return Optional.of(path + ": " + left.size() + " children vs " + right.size());
        }
        for (int i = 0; i < left.size(); i++) {
            String childPath = path + "/" + left.get(i).kind().tagName() + "[" + i + "]";
            Optional<String> difference = difference(left.get(i), right.get(i), childPath);
            if (difference.isPresent()) {
                return difference;
            }
        }
        return Optional.empty();
    }

    private static List<Node> significantChildren(Node node) {
        return node.children().stream()
            .filter(child -> !child.is(NodeKind.SYSTEM_MESSAGE))
            .toList();
    }
}
