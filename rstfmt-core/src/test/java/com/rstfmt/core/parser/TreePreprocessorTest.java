package com.rstfmt.core.parser;

import com.rstfmt.core.model.Node;
import com.rstfmt.core.model.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TreePreprocessor}.
 */
class TreePreprocessorTest {

    private final TreePreprocessor preprocessor = new TreePreprocessor();

    @Test
    void process_removesSystemMessagesAtAnyDepth() {
        Node message = SystemMessages.create(SystemMessages.WARNING, "something odd", 3);
        Node quote = Node.of(NodeKind.BLOCK_QUOTE, List.of(message, Node.of(NodeKind.PARAGRAPH, List.of(Node.text("x")))));
        Node document = Node.of(NodeKind.DOCUMENT, List.of(message, quote));

        Node processed = preprocessor.process(document);

        assertThat(processed.children()).extracting(Node::kind).containsExactly(NodeKind.BLOCK_QUOTE);
        assertThat(processed.children().get(0).children()).extracting(Node::kind).containsExactly(NodeKind.PARAGRAPH);
    }

    @Test
    void process_linksReferenceToFollowingTarget() {
        Node reference = Node.of(NodeKind.REFERENCE, Map.of(Node.REFURI, "http://x.org"), List.of(Node.text("x")));
        Node target = Node.of(NodeKind.TARGET, Map.of(Node.NAMES, List.of("x"), Node.REFURI, "http://x.org"), List.of());
        Node paragraph = Node.of(NodeKind.PARAGRAPH, List.of(reference, target, Node.text(" and "), reference));
        Node document = Node.of(NodeKind.DOCUMENT, List.of(paragraph));

        Node processed = preprocessor.process(document);

        List<Node> children = processed.children().get(0).children();
        assertThat(children.get(0).attribute(Node.TARGET_REF)).isEqualTo(target);
        assertThat(children.get(3).hasAttribute(Node.TARGET_REF)).isFalse();
    }

    @Test
    void process_leavesInputUntouched() {
        Node reference = Node.of(NodeKind.REFERENCE, Map.of(Node.REFURI, "http://x.org"), List.of(Node.text("x")));
        Node target = Node.of(NodeKind.TARGET, Map.of(Node.REFURI, "http://x.org"), List.of());
        Node document = Node.of(NodeKind.DOCUMENT, List.of(Node.of(NodeKind.PARAGRAPH, List.of(reference, target))));

        preprocessor.process(document);

        assertThat(document.children().get(0).children().get(0).hasAttribute(Node.TARGET_REF)).isFalse();
    }
}
