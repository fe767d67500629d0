package com.rstfmt.core.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rstfmt.core.model.Node;
import com.rstfmt.core.model.NodeKind;

/**
 * Prepares a parsed tree for formatting.
 *
 * <ul>
 *   <li>Removes {@code system_message} nodes, logging each one.</li>
 *   <li>Marks every reference immediately followed by a target sibling with a
 *       {@link Node#TARGET_REF} attribute pointing at that target, so the formatter writes
 *       the named {@code `title <uri>`_} form instead of the anonymous one.</li>
 * </ul>
 *
 * <p>The input tree is not modified; a new tree is returned.
 */
public final class TreePreprocessor {

    private static final Logger log = LoggerFactory.getLogger(TreePreprocessor.class);

    public Node process(Node root) {
        return visit(root);
    }

    private Node visit(Node node) {
        if (node.children().isEmpty()) {
            return node;
        }
        List<Node> children = new ArrayList<>(node.children().size());
        for (Node child : node.children()) {
            if (child.is(NodeKind.SYSTEM_MESSAGE)) {
                report(child);
            } else {
                children.add(visit(child));
            }
        }
        for (int i = 0; i + 1 < children.size(); i++) {
            if (children.get(i).is(NodeKind.REFERENCE) && children.get(i + 1).is(NodeKind.TARGET)) {
                children.set(i, children.get(i).withAttribute(Node.TARGET_REF, children.get(i + 1)));
            }
        }
        return node.withChildren(children);
    }

    private static void report(Node message) {
        int level = message.intAttribute(Node.LEVEL, SystemMessages.WARNING);
        int line = message.intAttribute(Node.LINE, 0);
        if (level >= SystemMessages.WARNING) {
            log.warn("line {}: {}", line, message.stringAttribute(Node.MESSAGE));
        } else {
            log.debug("line {}: {}", line, message.stringAttribute(Node.MESSAGE));
        }
    }
}
