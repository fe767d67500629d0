package com.rstfmt.core.format;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rstfmt.core.model.DirectiveOption;
import com.rstfmt.core.model.Node;
import com.rstfmt.core.model.NodeKind;

/**
 * Renders a document tree as canonical reStructuredText.
 *
 * <p>Each {@link NodeKind} maps to a rule in one of two registries:
 * <ul>
 *   <li><b>Block rules</b> produce a lazy sequence of output lines.</li>
 *   <li><b>Inline rules</b> produce {@link InlineFragment}s that the enclosing block feeds to
 *       the {@link WordWrapper}.</li>
 * </ul>
 * Rules recurse into children through {@link #format(Node, FormatContext)} and
 * {@link #inline(Node, FormatContext)}, passing a derived {@link FormatContext}. A kind
 * without a rule renders as a visible placeholder so that inspecting odd trees never aborts.
 *
 * <p>The formatter holds no mutable state; one instance can serve any number of documents
 * and threads.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * NodeFormatter formatter = new NodeFormatter();
 * String text = formatter.render(document, 72);
 * }</pre>
 */
public class NodeFormatter {

    private static final Logger log = LoggerFactory.getLogger(NodeFormatter.class);

    /** Marker of bullet list items. */
    public static final String BULLET = "-";

    /** Marker of enumerated list items (auto-numbered). */
    public static final String ENUMERATOR = "#.";

    private static final int BLOCK_INDENT = 3;
    private static final String BLANK = "";
    private static final String ANSI_MAGENTA = "\u001B[35m";
    private static final String ANSI_RESET = "\u001B[m";

    private static final Pattern REFERENCE_NAME = Pattern.compile("[A-Za-z0-9]+(?:[-_.:+][A-Za-z0-9]+)*");

    /**
     * Rule producing output lines for a block-level node.
     */
    @FunctionalInterface
    public interface BlockRule {
        Stream<String> format(Node node, FormatContext context);
    }

    /**
     * Rule producing inline fragments for an inline node.
     */
    @FunctionalInterface
    public interface InlineRule {
        Stream<InlineFragment> format(Node node, FormatContext context);
    }

    private final Map<NodeKind, BlockRule> blockRules = new EnumMap<>(NodeKind.class);
    private final Map<NodeKind, InlineRule> inlineRules = new EnumMap<>(NodeKind.class);
    private final TableFormatter tables = new TableFormatter(this);

    public NodeFormatter() {
        registerStructure();
        registerLists();
        registerExplicitMarkup();
        registerTables();
        registerInline();
    }

    /**
     * Renders a whole tree to text.
     *
     * @param root document (or any node)
     * @param width target width; null, zero or negative for unbounded output
     * @return rendered lines joined by newlines, without a trailing newline
     */
    public String render(Node root, Integer width) {
        Objects.requireNonNull(root, "root must not be null");
        return format(root, FormatContext.root(width)).collect(Collectors.joining("\n"));
    }

    /**
     * Renders one node as output lines.
     *
     * @param node node to render
     * @param context rendering state
     * @return lines, lazily produced
     */
    public Stream<String> format(Node node, FormatContext context) {
        BlockRule rule = blockRules.get(node.kind());
        if (rule != null) {
            return rule.format(node, context);
        }
        if (inlineRules.containsKey(node.kind())) {
            return WordWrapper.wrap(context.width(), inline(node, context).toList()).stream();
        }
        return Stream.of(placeholder(node));
    }

    /**
     * Renders one node as inline fragments.
     *
     * @param node inline node
     * @param context rendering state
     * @return fragments, lazily produced
     */
    public Stream<InlineFragment> inline(Node node, FormatContext context) {
        InlineRule rule = inlineRules.get(node.kind());
        if (rule == null) {
            return Stream.of(InlineFragment.markup(placeholder(node)));
        }
        return rule.format(node, context);
    }

    // --- Structure ---

    private void registerStructure() {
        blockRules.put(NodeKind.DOCUMENT, this::blockChildren);
        blockRules.put(NodeKind.SECTION, (node, ctx) -> blockChildren(node, ctx.inSection()));
        blockRules.put(NodeKind.TITLE, (node, ctx) -> {
            String text = WordWrapper.singleLine(inlineChildren(node, ctx));
            int length = text.codePointCount(0, text.length());
            return Stream.of(text, String.valueOf(ctx.sectionCharacter()).repeat(length));
        });
        blockRules.put(NodeKind.PARAGRAPH,
            (node, ctx) -> WordWrapper.wrap(ctx.width(), inlineChildren(node, ctx)).stream());
        blockRules.put(NodeKind.BLOCK_QUOTE,
            (node, ctx) -> Lines.indent(BLOCK_INDENT, blockChildren(node, ctx.indent(BLOCK_INDENT))));
        blockRules.put(NodeKind.TARGET, (node, ctx) -> explicitTarget(node));
    }

    private Stream<String> blockChildren(Node node, FormatContext context) {
        return Lines.joinBlocks(BLANK, node.children().stream().map(child -> format(child, context)));
    }

    private Stream<String> explicitTarget(Node node) {
        List<String> names = node.listAttribute(Node.NAMES, String.class);
        String label;
        if (names.isEmpty() || node.flag(Node.ANONYMOUS)) {
            label = "__";
        } else {
            String name = names.get(0);
            label = "_" + (name.contains(":") ? "`" + name + "`" : name);
        }
        String uri = node.stringAttribute(Node.REFURI);
        return Stream.of(".. " + label + ":" + (uri != null ? " " + uri : ""));
    }

    // --- Lists ---

    private void registerLists() {
        blockRules.put(NodeKind.BULLET_LIST, (node, ctx) -> blockChildren(node, ctx.withBullet(BULLET)));
        blockRules.put(NodeKind.ENUMERATED_LIST, (node, ctx) -> blockChildren(node, ctx.withBullet(ENUMERATOR)));
        blockRules.put(NodeKind.LIST_ITEM, this::listItem);
        blockRules.put(NodeKind.DEFINITION_LIST, this::blockChildren);
        blockRules.put(NodeKind.DEFINITION_LIST_ITEM, this::definitionListItem);
        blockRules.put(NodeKind.TERM, (node, ctx) -> Stream.of(WordWrapper.singleLine(inlineChildren(node, ctx))));
        blockRules.put(NodeKind.DEFINITION, this::blockChildren);
    }

    private Stream<String> listItem(Node node, FormatContext context) {
        String bullet = context.bullet() != null ? context.bullet() : BULLET;
        int width = bullet.length() + 1;
        String first = bullet + " ";
        String rest = " ".repeat(width);

        List<String> body = blockChildren(node, context.indent(width)).toList();
        List<String> lines = new ArrayList<>(body.size());
        boolean bulletWritten = false;
        for (String line : body) {
            if (line.isEmpty()) {
                lines.add(line);
            } else if (!bulletWritten) {
                lines.add(first + line);
                bulletWritten = true;
            } else {
                lines.add(rest + line);
            }
        }
        if (!bulletWritten) {
            return Stream.of(bullet);
        }
        return lines.stream();
    }

    private Stream<String> definitionListItem(Node node, FormatContext context) {
        return node.children().stream().flatMap(child -> {
            if (child.is(NodeKind.TERM)) {
                return format(child, context);
            }
            if (child.is(NodeKind.DEFINITION)) {
                return Lines.indent(BLOCK_INDENT, format(child, context.indent(BLOCK_INDENT)));
            }
            return Stream.empty();
        });
    }

    // --- Explicit markup ---

    private void registerExplicitMarkup() {
        blockRules.put(NodeKind.DIRECTIVE,
            (node, ctx) -> directive(".. " + node.stringAttribute(Node.NAME) + "::", node));
        blockRules.put(NodeKind.SUBSTITUTION_DEFINITION, (node, ctx) -> directive(
            ".. |" + firstName(node) + "| " + node.stringAttribute(Node.NAME) + "::", node));
        blockRules.put(NodeKind.COMMENT, (node, ctx) -> {
            String text = node.children().stream().map(Node::astext).collect(Collectors.joining("\n"));
            return Stream.concat(Stream.of(".."), Lines.indent(BLOCK_INDENT, Stream.of(text.split("\n", -1))));
        });
        blockRules.put(NodeKind.IMAGE, (node, ctx) -> Stream.of(".. image:: " + node.stringAttribute(Node.URI)));
        blockRules.put(NodeKind.LITERAL_BLOCK, (node, ctx) -> {
            List<String> languages = node.listAttribute(Node.CLASSES, String.class).stream()
                .filter(c -> !"code".equals(c))
                .toList();
            String header = ".. code::" + (languages.isEmpty() ? "" : " " + languages.get(0));
            String text = node.children().stream().map(Node::astext).collect(Collectors.joining());
            return Stream.concat(Stream.of(header, BLANK), Lines.indent(BLOCK_INDENT, Stream.of(text.split("\n", -1))));
        });
        for (NodeKind kind : NodeKind.values()) {
            if (kind.isAdmonition()) {
                blockRules.put(kind, (node, ctx) -> Stream.concat(
                    Stream.of(".. " + kind.directiveName() + "::", BLANK),
                    Lines.indent(BLOCK_INDENT, blockChildren(node, ctx.indent(BLOCK_INDENT)))));
            }
        }
    }

    private Stream<String> directive(String header, Node node) {
        List<String> first = new ArrayList<>();
        first.add(header);
        first.addAll(node.listAttribute(Node.ARGUMENTS, String.class));

        List<String> lines = new ArrayList<>();
        lines.add(String.join(" ", first));
        for (DirectiveOption option : node.listAttribute(Node.OPTIONS, DirectiveOption.class)) {
            lines.add(option.hasValue()
                ? "   :" + option.key() + ": " + option.value()
                : "   :" + option.key() + ":");
        }
        List<String> content = node.listAttribute(Node.CONTENT, String.class);
        return Stream.concat(lines.stream(),
            Lines.blankBeforeAny(Lines.indent(BLOCK_INDENT, content.stream())));
    }

    private static String firstName(Node node) {
        List<String> names = node.listAttribute(Node.NAMES, String.class);
        return names.isEmpty() ? "" : names.get(0);
    }

    // --- Tables ---

    private void registerTables() {
        blockRules.put(NodeKind.TABLE, this::blockChildren);
        blockRules.put(NodeKind.TGROUP, tables::tgroup);
        blockRules.put(NodeKind.THEAD, tables::rowGroup);
        blockRules.put(NodeKind.TBODY, tables::rowGroup);
        blockRules.put(NodeKind.ROW, tables::row);
        blockRules.put(NodeKind.ENTRY, this::blockChildren);
        blockRules.put(NodeKind.COLSPEC, (node, ctx) -> Stream.empty());
    }

    // --- Inline ---

    private void registerInline() {
        inlineRules.put(NodeKind.TEXT, (node, ctx) -> {
            String raw = node.stringAttribute(Node.RAWSOURCE);
            return Stream.of(InlineFragment.plain(raw != null ? raw : node.stringAttribute(Node.TEXT)));
        });
        inlineRules.put(NodeKind.EMPHASIS, (node, ctx) -> delimited("*", node, ctx));
        inlineRules.put(NodeKind.STRONG, (node, ctx) -> delimited("**", node, ctx));
        inlineRules.put(NodeKind.LITERAL, (node, ctx) -> delimited("``", node, ctx));
        inlineRules.put(NodeKind.TITLE_REFERENCE, (node, ctx) -> delimited("`", node, ctx));
        inlineRules.put(NodeKind.SUBSTITUTION_REFERENCE, (node, ctx) -> delimited("|", node, ctx));
        inlineRules.put(NodeKind.ROLE,
            (node, ctx) -> Stream.of(InlineFragment.markup(node.stringAttribute(Node.RAWSOURCE))));
        inlineRules.put(NodeKind.INLINE,
            (node, ctx) -> node.children().stream().flatMap(child -> inline(child, ctx)));
        inlineRules.put(NodeKind.TARGET, (node, ctx) -> Stream.empty());
        inlineRules.put(NodeKind.REFERENCE, this::reference);
    }

    private Stream<InlineFragment> delimited(String delimiter, Node node, FormatContext context) {
        String inner = node.children().stream()
            .flatMap(child -> inline(child, context))
            .map(InlineFragment::text)
            .collect(Collectors.joining());
        return Stream.of(InlineFragment.markup(delimiter + inner + delimiter));
    }

    private Stream<InlineFragment> reference(Node node, FormatContext context) {
        String title = WordWrapper.singleLine(inlineChildren(node, context));
        boolean hasTarget = node.hasAttribute(Node.TARGET_REF);

        if (node.hasAttribute(Node.REFURI)) {
            String uri = node.stringAttribute(Node.REFURI);
            if (!hasTarget && (uri.equals(title) || uri.equals("mailto:" + title))) {
                return Stream.of(InlineFragment.markup(title));
            }
            String suffix = hasTarget ? "_" : "__";
            return Stream.of(InlineFragment.markup("`" + title + " <" + uri + ">`" + suffix));
        }

        String suffix = node.flag(Node.ANONYMOUS) ? "__" : "_";
        boolean singleWord = REFERENCE_NAME.matcher(title).matches()
            || (node.children().size() == 1 && node.children().get(0).is(NodeKind.SUBSTITUTION_REFERENCE));
        return Stream.of(InlineFragment.markup((singleWord ? title : "`" + title + "`") + suffix));
    }

    private List<InlineFragment> inlineChildren(Node node, FormatContext context) {
        return node.children().stream().flatMap(child -> inline(child, context)).toList();
    }

    private static String placeholder(Node node) {
        log.warn("No formatting rule for node kind '{}'", node.kind().tagName());
        return ANSI_MAGENTA + node.kind().name() + ANSI_RESET;
    }
}
