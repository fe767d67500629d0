package com.rstfmt.core.format;

import com.rstfmt.core.model.DirectiveOption;
import com.rstfmt.core.model.Node;
import com.rstfmt.core.model.NodeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NodeFormatter}.
 */
class NodeFormatterTest {

    private NodeFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new NodeFormatter();
    }

    @Test
    void render_paragraphWithStrong_fitsOnOneLine() {
        Node document = document(paragraph(
            Node.text("This is "), Node.of(NodeKind.STRONG, List.of(Node.text("bold"))), Node.text(" text.")));

        assertThat(formatter.render(document, 72)).isEqualTo("This is **bold** text.");
    }

    @Test
    void render_paragraphAtNarrowWidth_keepsMarkupTokenWhole() {
        Node document = document(paragraph(
            Node.text("This is "), Node.of(NodeKind.STRONG, List.of(Node.text("bold"))), Node.text(" text.")));

        assertThat(lines(formatter.render(document, 5))).containsExactly("This", "is", "**bold**", "text.");
    }

    @Test
    void render_paragraphUnbounded_producesSingleLine() {
        Node document = document(paragraph(Node.text("one two three four five six seven eight nine ten")));

        assertThat(formatter.render(document, null)).isEqualTo("one two three four five six seven eight nine ten");
        assertThat(formatter.render(document, 0)).isEqualTo("one two three four five six seven eight nine ten");
    }

    @Test
    void render_wrappedParagraph_neverExceedsWidthWithBreakableText() {
        Node document = document(paragraph(Node.text(
            "Lorem ipsum dolor sit amet, consectetur adipiscing elit, sed do eiusmod tempor incididunt.")));

        assertThat(lines(formatter.render(document, 20))).allSatisfy(line -> assertThat(line).hasSizeLessThanOrEqualTo(20));
    }

    @Test
    void render_sectionTitle_underlinesWithDepthCharacter() {
        Node section = Node.of(NodeKind.SECTION, List.of(
            Node.of(NodeKind.TITLE, List.of(Node.text("Example"))),
            paragraph(Node.text("Body."))));

        assertThat(lines(formatter.render(document(section), 72)))
            .containsExactly("Example", "=======", "", "Body.");
    }

    @Test
    void render_nestedSection_usesSecondLevelCharacter() {
        Node inner = Node.of(NodeKind.SECTION, List.of(Node.of(NodeKind.TITLE, List.of(Node.text("Inner")))));
        Node outer = Node.of(NodeKind.SECTION, List.of(Node.of(NodeKind.TITLE, List.of(Node.text("Outer"))), inner));

        assertThat(lines(formatter.render(document(outer), 72)))
            .containsExactly("Outer", "=====", "", "Inner", "-----");
    }

    @Test
    void render_table_usesDeclaredColumnWidths() {
        Node tgroup = Node.of(NodeKind.TGROUP, Map.of("cols", 2), List.of(
            colspec(10), colspec(10),
            Node.of(NodeKind.THEAD, List.of(row("Header 1", "Header 2"))),
            Node.of(NodeKind.TBODY, List.of(row("a", "b"), row("c", "d")))));
        Node table = Node.of(NodeKind.TABLE, List.of(tgroup));

        assertThat(lines(formatter.render(document(table), 72))).containsExactly(
            "+----------+----------+",
            "| Header 1 | Header 2 |",
            "+==========+==========+",
            "| a        | b        |",
            "+----------+----------+",
            "| c        | d        |",
            "+----------+----------+");
    }

    @Test
    void render_tableCell_wrapsToColumnWidth() {
        Node tgroup = Node.of(NodeKind.TGROUP, Map.of("cols", 1), List.of(
            colspec(8),
            Node.of(NodeKind.TBODY, List.of(row("one two three")))));

        assertThat(lines(formatter.render(document(Node.of(NodeKind.TABLE, List.of(tgroup))), 72))).containsExactly(
            "+--------+",
            "| one    |",
            "| two    |",
            "| three  |",
            "+--------+");
    }

    @Test
    void render_bulletList_separatesItemsWithBlankLine() {
        Node list = Node.of(NodeKind.BULLET_LIST, List.of(item(paragraph(Node.text("item one"))),
            item(paragraph(Node.text("item two")))));

        assertThat(lines(formatter.render(document(list), 72))).containsExactly("- item one", "", "- item two");
    }

    @Test
    void render_enumeratedList_usesAutoEnumerator() {
        Node list = Node.of(NodeKind.ENUMERATED_LIST, List.of(item(paragraph(Node.text("first")))));

        assertThat(formatter.render(document(list), 72)).isEqualTo("#. first");
    }

    @Test
    void render_enumeratedListItemWithSeveralBlocks_indentsContinuationByThree() {
        Node list = Node.of(NodeKind.ENUMERATED_LIST, List.of(
            item(paragraph(Node.text("first")), paragraph(Node.text("second")))));

        assertThat(lines(formatter.render(document(list), 72))).containsExactly("#. first", "", "   second");
    }

    @Test
    void render_enumeratedListItemWrapping_accountsForEnumeratorWidth() {
        Node list = Node.of(NodeKind.ENUMERATED_LIST, List.of(item(paragraph(Node.text("aaaa bbbb cccc")))));

        assertThat(lines(formatter.render(document(list), 12))).containsExactly("#. aaaa bbbb", "   cccc");
    }

    @Test
    void render_listItemWithSeveralBlocks_indentsContinuation() {
        Node list = Node.of(NodeKind.BULLET_LIST, List.of(
            item(paragraph(Node.text("first")), paragraph(Node.text("second")))));

        assertThat(lines(formatter.render(document(list), 72))).containsExactly("- first", "", "  second");
    }

    @Test
    void render_listItemWrapping_accountsForBulletWidth() {
        Node list = Node.of(NodeKind.BULLET_LIST, List.of(item(paragraph(Node.text("aaaa bbbb cccc")))));

        assertThat(lines(formatter.render(document(list), 11))).containsExactly("- aaaa bbbb", "  cccc");
    }

    @Test
    void render_emptyListItem_rendersBareBullet() {
        Node list = Node.of(NodeKind.BULLET_LIST, List.of(item()));

        assertThat(formatter.render(document(list), 72)).isEqualTo("-");
    }

    @Test
    void render_blockQuote_indentsByThree() {
        Node quote = Node.of(NodeKind.BLOCK_QUOTE, List.of(paragraph(Node.text("quoted"))));

        assertThat(formatter.render(document(quote), 72)).isEqualTo("   quoted");
    }

    @Test
    void render_definitionList_indentsDefinition() {
        Node item = Node.of(NodeKind.DEFINITION_LIST_ITEM, List.of(
            Node.of(NodeKind.TERM, List.of(Node.text("term"))),
            Node.of(NodeKind.DEFINITION, List.of(paragraph(Node.text("meaning"))))));

        assertThat(lines(formatter.render(document(Node.of(NodeKind.DEFINITION_LIST, List.of(item))), 72)))
            .containsExactly("term", "   meaning");
    }

    @Test
    void render_referenceWithTarget_usesNamedEmbeddedForm() {
        Node target = Node.of(NodeKind.TARGET, Map.of(Node.NAMES, List.of("python"), Node.REFURI, "http://python.org"),
            List.of());
        Node reference = Node.of(NodeKind.REFERENCE, Map.of(Node.NAME, "Python", Node.REFURI, "http://python.org"),
            List.of(Node.text("Python"))).withAttribute(Node.TARGET_REF, target);

        assertThat(formatter.render(document(paragraph(reference, target)), 72))
            .isEqualTo("`Python <http://python.org>`_");
    }

    @Test
    void render_referenceWithoutTarget_usesAnonymousEmbeddedForm() {
        Node reference = Node.of(NodeKind.REFERENCE, Map.of(Node.REFURI, "http://example"),
            List.of(Node.text("example")));

        assertThat(formatter.render(document(paragraph(reference)), 72)).isEqualTo("`example <http://example>`__");
    }

    @Test
    void render_standaloneUri_rendersBare() {
        Node reference = Node.of(NodeKind.REFERENCE, Map.of(Node.REFURI, "https://example.org"),
            List.of(Node.text("https://example.org")));
        Node email = Node.of(NodeKind.REFERENCE, Map.of(Node.REFURI, "mailto:me@example.org"),
            List.of(Node.text("me@example.org")));

        assertThat(formatter.render(document(paragraph(reference, Node.text(" or "), email)), 72))
            .isEqualTo("https://example.org or me@example.org");
    }

    @Test
    void render_namedReferences_quoteOnlyWhenNeeded() {
        Node simple = Node.of(NodeKind.REFERENCE, Map.of(Node.REFNAME, "docs"), List.of(Node.text("docs")));
        Node phrase = Node.of(NodeKind.REFERENCE, Map.of(Node.REFNAME, "two words"), List.of(Node.text("two words")));
        Node anonymous = Node.of(NodeKind.REFERENCE, Map.of(Node.REFNAME, "anon", Node.ANONYMOUS, true),
            List.of(Node.text("anon")));

        assertThat(formatter.render(document(paragraph(
            simple, Node.text(" "), phrase, Node.text(" "), anonymous)), null))
            .isEqualTo("docs_ `two words`_ anon__");
    }

    @Test
    void render_markupTouchingText_insertsEscapedSpace() {
        Node paragraph = paragraph(Node.text("a"), Node.of(NodeKind.EMPHASIS, List.of(Node.text("b"))), Node.text("c"));

        assertThat(formatter.render(document(paragraph), 72)).isEqualTo("a\\ *b*\\ c");
    }

    @Test
    void render_markupTouchingPunctuation_needsNoEscape() {
        Node paragraph = paragraph(Node.text("("), Node.of(NodeKind.LITERAL, List.of(Node.text("x"))), Node.text(")."));

        assertThat(formatter.render(document(paragraph), 72)).isEqualTo("(``x``).");
    }

    @Test
    void render_roleAndSubstitution_keepSource() {
        Node role = Node.of(NodeKind.ROLE, Map.of(Node.RAWSOURCE, ":func:`run`"), List.of());
        Node substitution = Node.of(NodeKind.SUBSTITUTION_REFERENCE, List.of(Node.text("name")));

        assertThat(formatter.render(document(paragraph(role, Node.text(" "), substitution)), 72))
            .isEqualTo(":func:`run` |name|");
    }

    @Test
    void render_directive_writesArgumentsOptionsAndContent() {
        Node directive = Node.of(NodeKind.DIRECTIVE, Map.of(
            Node.NAME, "toctree",
            Node.ARGUMENTS, List.of(),
            Node.OPTIONS, List.of(new DirectiveOption("maxdepth", "2"), new DirectiveOption("hidden", null)),
            Node.CONTENT, List.of("intro", "usage")), List.of());

        assertThat(lines(formatter.render(document(directive), 72))).containsExactly(
            ".. toctree::", "   :maxdepth: 2", "   :hidden:", "", "   intro", "   usage");
    }

    @Test
    void render_directiveWithoutContent_omitsBlankLine() {
        Node directive = Node.of(NodeKind.DIRECTIVE, Map.of(
            Node.NAME, "autoclass", Node.ARGUMENTS, List.of("pkg.Widget")), List.of());

        assertThat(formatter.render(document(directive), 72)).isEqualTo(".. autoclass:: pkg.Widget");
    }

    @Test
    void render_substitutionDefinition_includesName() {
        Node definition = Node.of(NodeKind.SUBSTITUTION_DEFINITION, Map.of(
            Node.NAMES, List.of("logo"), Node.NAME, "image", Node.ARGUMENTS, List.of("logo.png")), List.of());

        assertThat(formatter.render(document(definition), 72)).isEqualTo(".. |logo| image:: logo.png");
    }

    @Test
    void render_admonition_indentsBody() {
        Node note = Node.of(NodeKind.NOTE, List.of(paragraph(Node.text("Be careful."))));

        assertThat(lines(formatter.render(document(note), 72))).containsExactly(".. note::", "", "   Be careful.");
    }

    @Test
    void render_literalBlock_writesCodeDirective() {
        Node code = Node.of(NodeKind.LITERAL_BLOCK, Map.of(Node.CLASSES, List.of("code", "python")),
            List.of(Node.text("print(1)\nprint(2)")));
        Node plain = Node.of(NodeKind.LITERAL_BLOCK, Map.of(Node.CLASSES, List.of()), List.of(Node.text("raw")));

        assertThat(lines(formatter.render(document(code, plain), 72))).containsExactly(
            ".. code:: python", "", "   print(1)", "   print(2)", "", ".. code::", "", "   raw");
    }

    @Test
    void render_commentImageAndTargets() {
        Node comment = Node.of(NodeKind.COMMENT, List.of(Node.text("hidden\nnote")));
        Node image = Node.of(NodeKind.IMAGE, Map.of(Node.URI, "diagram.png"), List.of());
        Node named = Node.of(NodeKind.TARGET, Map.of(Node.NAMES, List.of("home"), Node.REFURI, "http://home"), List.of());
        Node anonymous = Node.of(NodeKind.TARGET, Map.of(Node.ANONYMOUS, true, Node.REFURI, "http://anon"), List.of());
        Node colon = Node.of(NodeKind.TARGET, Map.of(Node.NAMES, List.of("a:b"), Node.REFURI, "http://ab"), List.of());

        assertThat(lines(formatter.render(document(comment, image, named, anonymous, colon), 72))).containsExactly(
            "..", "   hidden", "   note", "",
            ".. image:: diagram.png", "",
            ".. _home: http://home", "",
            ".. __: http://anon", "",
            ".. _`a:b`: http://ab");
    }

    @Test
    void render_unmappedKind_rendersPlaceholder() {
        Node message = Node.of(NodeKind.SYSTEM_MESSAGE, Map.of(Node.MESSAGE, "oops"), List.of());

        assertThat(formatter.render(document(message), 72)).contains("SYSTEM_MESSAGE");
    }

    @Test
    void render_blocks_areSeparatedBySingleBlankLine() {
        assertThat(formatter.render(document(paragraph(Node.text("one")), paragraph(Node.text("two"))), 72))
            .isEqualTo("one\n\ntwo");
    }

    private static Node document(Node... children) {
        return Node.of(NodeKind.DOCUMENT, Arrays.asList(children));
    }

    private static Node paragraph(Node... children) {
        return Node.of(NodeKind.PARAGRAPH, Arrays.asList(children));
    }

    private static Node item(Node... children) {
        return Node.of(NodeKind.LIST_ITEM, Arrays.asList(children));
    }

    private static Node colspec(int width) {
        return Node.of(NodeKind.COLSPEC, Map.of(Node.COLWIDTH, width), List.of());
    }

    private static Node row(String... cells) {
        return Node.of(NodeKind.ROW, Arrays.stream(cells)
            .map(cell -> Node.of(NodeKind.ENTRY, List.of(paragraph(Node.text(cell)))))
            .toList());
    }

    private static List<String> lines(String text) {
        return Arrays.asList(text.split("\n", -1));
    }
}
