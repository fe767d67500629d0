package com.rstfmt.core.check;

import com.rstfmt.core.format.NodeFormatter;
import com.rstfmt.core.model.Node;
import com.rstfmt.core.model.NodeKind;
import com.rstfmt.core.parser.RstParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link IdempotenceChecker}.
 */
class IdempotenceCheckerTest {

    @TempDir
    Path tempDir;

    private RstParser parser;
    private NodeFormatter formatter;

    @BeforeEach
    void setUp() {
        parser = new RstParser();
        formatter = new NodeFormatter();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "Title\n=====\n\nThis is **bold** text with *emphasis* and ``literal`` markup.\n\n"
            + "Sub title\n---------\n\nSee `Python <http://python.org>`_ for details.\n",
        "- item one\n- item two\n\n#. first\n#. second\n",
        "term\n   The definition.\n\nA paragraph.\n\n   A quote.\n",
        ".. note::\n\n   Be careful.\n\n.. toctree::\n   :maxdepth: 2\n\n   intro\n   usage\n\n"
            + ".. code:: python\n\n   print(1)\n\n.. image:: pic.png\n",
        "+-----+-----+\n| a   | b   |\n+=====+=====+\n| c   | d   |\n+-----+-----+\n",
        ".. _python: http://python.org\n\n.. __: http://anon.org\n\n.. a comment\n\nUse python_ here.\n",
        "Escaped \\*star\\* and a\\ *b*\\ c and |logo| text.\n\n.. |logo| image:: logo.png\n",
        "Guide\n=====\n\n- item with ``code``\n\n  second paragraph\n",
        "Example::\n\n   raw text\n   kept as is\n",
        "#. first item with some words\n\n   second paragraph of the item\n\n#. another item\n"
    })
    void check_sampleDocuments_areStableAtAllDefaultWidths(String source) {
        IdempotenceChecker checker = new IdempotenceChecker(parser, formatter);

        assertThatCode(() -> checker.check(parser.parse(source))).doesNotThrowAnyException();
    }

    @Test
    void check_unstableTree_reportsFirstFailingWidth() {
        Node document = paragraphDocument("- not a list");
        IdempotenceChecker checker = new IdempotenceChecker(parser, formatter, List.of(40, 1), null);

        assertThatThrownBy(() -> checker.check(document))
            .isInstanceOf(ConsistencyViolationException.class)
            .hasMessageContaining("not stable at width 40")
            .satisfies(e -> {
                ConsistencyViolationException violation = (ConsistencyViolationException) e;
                assertThat(violation.getWidth()).isEqualTo(40);
                assertThat(violation.getFirstOutput()).isEqualTo("- not a list");
                assertThat(violation.getSecondDump()).contains("bullet_list");
                assertThat(violation.getDumpDirectory()).isNull();
            });
    }

    @Test
    void check_sameTreeButDifferentText_reportsOutputDifference() {
        NodeFormatter drifting = new NodeFormatter() {
            private int calls;

            @Override
            public String render(Node root, Integer width) {
                String text = super.render(root, width);
                return calls++ == 0 ? text : text + " ";
            }
        };
        IdempotenceChecker checker = new IdempotenceChecker(parser, drifting, List.of(72), null);

        assertThatThrownBy(() -> checker.check(parser.parse("Hello there.\n")))
            .isInstanceOf(ConsistencyViolationException.class)
            .hasMessageContaining("outputs differ")
            .satisfies(e -> {
                ConsistencyViolationException violation = (ConsistencyViolationException) e;
                assertThat(violation.getFirstOutput()).isEqualTo("Hello there.");
                assertThat(violation.getSecondOutput()).isEqualTo("Hello there. ");
            });
    }

    @Test
    void check_withDumpDirectory_writesArtifacts() throws IOException {
        Path dumps = tempDir.resolve("dumps");
        IdempotenceChecker checker = new IdempotenceChecker(parser, formatter, List.of(72), dumps);

        assertThatThrownBy(() -> checker.check(paragraphDocument("- not a list")))
            .isInstanceOf(ConsistencyViolationException.class)
            .satisfies(e -> assertThat(((ConsistencyViolationException) e).getDumpDirectory()).isEqualTo(dumps));

        assertThat(dumps.resolve("dump1.txt")).exists();
        assertThat(dumps.resolve("dump2.txt")).exists();
        assertThat(Files.readString(dumps.resolve("out1.txt"))).isEqualTo("- not a list\n");
        assertThat(Files.readString(dumps.resolve("out2.txt"))).isEqualTo("- not a list\n");
    }

    @Test
    void constructor_rejectsEmptyWidths() {
        assertThatThrownBy(() -> new IdempotenceChecker(parser, formatter, List.of(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultWidths_includeUnbounded() {
        assertThat(new IdempotenceChecker(parser, formatter).widths())
            .containsExactlyElementsOf(IdempotenceChecker.DEFAULT_WIDTHS)
            .containsNull();
    }

    private static Node paragraphDocument(String text) {
        return Node.of(NodeKind.DOCUMENT, List.of(Node.of(NodeKind.PARAGRAPH, List.of(Node.text(text)))));
    }
}
