package com.rstfmt.core.parser;

import com.rstfmt.core.model.Node;
import com.rstfmt.core.model.NodeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link InlineParser}.
 */
class InlineParserTest {

    private List<Node> messages;

    @BeforeEach
    void setUp() {
        messages = new ArrayList<>();
    }

    @Test
    void parse_basicMarkup() {
        List<Node> nodes = parse("**bold** and *em* and ``lit``");

        assertThat(nodes).extracting(Node::kind).containsExactly(
            NodeKind.STRONG, NodeKind.TEXT, NodeKind.EMPHASIS, NodeKind.TEXT, NodeKind.LITERAL);
        assertThat(nodes.get(0).astext()).isEqualTo("bold");
        assertThat(nodes.get(4).astext()).isEqualTo("lit");
        assertThat(messages).isEmpty();
    }

    @Test
    void parse_embeddedUri_addsTargetSibling() {
        List<Node> nodes = parse("`Python <http://python.org>`_");

        assertThat(nodes).extracting(Node::kind).containsExactly(NodeKind.REFERENCE, NodeKind.TARGET);
        assertThat(nodes.get(0).stringAttribute(Node.REFURI)).isEqualTo("http://python.org");
        assertThat(nodes.get(0).astext()).isEqualTo("Python");
        assertThat(nodes.get(1).listAttribute(Node.NAMES, String.class)).containsExactly("python");
    }

    @Test
    void parse_anonymousEmbeddedUri_hasNoTarget() {
        List<Node> nodes = parse("`anon <http://a.org>`__");

        assertThat(nodes).extracting(Node::kind).containsExactly(NodeKind.REFERENCE);
        assertThat(nodes.get(0).flag(Node.ANONYMOUS)).isTrue();
    }

    @Test
    void parse_namedReferences() {
        List<Node> nodes = parse("`Some  Phrase`_ name_ and other__");

        assertThat(nodes).extracting(Node::kind).containsExactly(
            NodeKind.REFERENCE, NodeKind.TEXT, NodeKind.REFERENCE, NodeKind.TEXT, NodeKind.REFERENCE);
        assertThat(nodes.get(0).stringAttribute(Node.REFNAME)).isEqualTo("some phrase");
        assertThat(nodes.get(2).stringAttribute(Node.REFNAME)).isEqualTo("name");
        assertThat(nodes.get(4).flag(Node.ANONYMOUS)).isTrue();
    }

    @Test
    void parse_standaloneUriAndEmail() {
        List<Node> nodes = parse("see https://example.org. or me@example.org");

        assertThat(nodes).extracting(Node::kind).containsExactly(
            NodeKind.TEXT, NodeKind.REFERENCE, NodeKind.TEXT, NodeKind.REFERENCE);
        assertThat(nodes.get(1).stringAttribute(Node.REFURI)).isEqualTo("https://example.org");
        assertThat(nodes.get(2).astext()).isEqualTo(". or ");
        assertThat(nodes.get(3).stringAttribute(Node.REFURI)).isEqualTo("mailto:me@example.org");
    }

    @Test
    void parse_roles() {
        List<Node> nodes = parse(":func:`run` :emphasis:`x` `y`:strong: `title`");

        assertThat(nodes).extracting(Node::kind).containsExactly(
            NodeKind.ROLE, NodeKind.TEXT, NodeKind.EMPHASIS, NodeKind.TEXT, NodeKind.STRONG,
            NodeKind.TEXT, NodeKind.TITLE_REFERENCE);
        assertThat(nodes.get(0).stringAttribute(Node.RAWSOURCE)).isEqualTo(":func:`run`");
        assertThat(messages).isEmpty();
    }

    @Test
    void parse_unknownRole_keptWithDiagnostic() {
        List<Node> nodes = parse(":mystery:`x`");

        assertThat(nodes).extracting(Node::kind).containsExactly(NodeKind.ROLE);
        assertThat(messages).hasSize(1);
        assertThat(messages.get(0).stringAttribute(Node.MESSAGE)).contains("mystery");
    }

    @Test
    void parse_substitutions() {
        List<Node> plain = parse("|Sub Name|");
        List<Node> linked = parse("|sub|_");

        assertThat(plain).extracting(Node::kind).containsExactly(NodeKind.SUBSTITUTION_REFERENCE);
        assertThat(plain.get(0).stringAttribute(Node.REFNAME)).isEqualTo("sub name");
        assertThat(linked).extracting(Node::kind).containsExactly(NodeKind.REFERENCE);
        assertThat(linked.get(0).children().get(0).kind()).isEqualTo(NodeKind.SUBSTITUTION_REFERENCE);
    }

    @Test
    void parse_unterminatedStartString_staysText() {
        List<Node> nodes = parse("*unterminated text");

        assertThat(nodes).extracting(Node::kind).containsExactly(NodeKind.TEXT);
        assertThat(nodes.get(0).astext()).isEqualTo("*unterminated text");
        assertThat(messages).hasSize(1);
        assertThat(messages.get(0).intAttribute(Node.LEVEL, 0)).isEqualTo(SystemMessages.WARNING);
    }

    @Test
    void parse_markupInsideWord_isIgnored() {
        List<Node> nodes = parse("2*3*4");

        assertThat(nodes).extracting(Node::kind).containsExactly(NodeKind.TEXT);
    }

    @Test
    void parse_escapes_keepRawSource() {
        List<Node> nodes = parse("\\*not emphasis\\*");

        assertThat(nodes).hasSize(1);
        assertThat(nodes.get(0).astext()).isEqualTo("*not emphasis*");
        assertThat(nodes.get(0).stringAttribute(Node.RAWSOURCE)).isEqualTo("\\*not emphasis\\*");
    }

    @Test
    void parse_escapedWhitespace_isRemoved() {
        List<Node> nodes = parse("a\\ *b*");

        assertThat(nodes).extracting(Node::kind).containsExactly(NodeKind.TEXT, NodeKind.EMPHASIS);
        assertThat(nodes.get(0).astext()).isEqualTo("a");
    }

    @Test
    void normalizeName_collapsesWhitespaceAndLowercases() {
        assertThat(InlineParser.normalizeName("  Some\n  Name ")).isEqualTo("some name");
        assertThat(InlineParser.whitespaceNormalize("  Some\n  Name ")).isEqualTo("Some Name");
    }

    private List<Node> parse(String text) {
        return InlineParser.parse(text, MarkupRegistry.defaults(), 1, messages);
    }
}
