package com.rstfmt.core.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rstfmt.core.model.DirectiveOption;
import com.rstfmt.core.model.Node;
import com.rstfmt.core.model.NodeKind;

/**
 * Line-based parser for the block structure of a reStructuredText document.
 *
 * <p>Recognizes section titles (underlined, or over- and underlined), paragraphs, literal
 * blocks introduced by {@code ::}, bullet and enumerated lists, definition lists, block
 * quotes, grid tables and explicit markup (directives, substitution definitions, hyperlink
 * targets and comments). Inline text is handed to {@link InlineParser}.
 *
 * <p>Sections are only recognized at document level. Nested bodies (list items, quotes,
 * table cells, admonitions) are parsed recursively from their dedented lines.
 */
final class BlockParser {

    private static final Logger log = LoggerFactory.getLogger(BlockParser.class);

    private static final String ADORNMENT_CHARS = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";
    private static final int MIN_SHORT_UNDERLINE = 4;

    private static final String DIRECTIVE_NAME = "[A-Za-z0-9](?:[-_.+:]?[A-Za-z0-9])*";

    private static final Pattern BULLET = Pattern.compile("([-*+\u2022])(?: +(.*))?");
    private static final Pattern ENUMERATOR = Pattern.compile("(?:(#|\\d+)([.)])|\\((#|\\d+)\\))(?: +(.*))?");
    private static final Pattern GRID_BORDER = Pattern.compile("\\+(?:-+\\+)+");
    private static final Pattern EXPLICIT = Pattern.compile("\\.\\.(?: +(.*))?");
    private static final Pattern ANONYMOUS_TARGET = Pattern.compile("__:(?:\\s+(.*))?");
    private static final Pattern TARGET = Pattern.compile("_(`[^`]+`|[^`:\\s][^:]*):(?:\\s+(.*))?");
    private static final Pattern SUBSTITUTION = Pattern.compile(
        "\\|([^|\\s](?:[^|]*[^|\\s])?)\\|\\s+(" + DIRECTIVE_NAME + ")::(?:\\s+(.*))?");
    private static final Pattern DIRECTIVE = Pattern.compile("(" + DIRECTIVE_NAME + ")::(?:\\s+(.*))?");
    private static final Pattern OPTION = Pattern.compile(":([^:\\s][^:]*):(?:\\s+(.*))?");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final String BULLET_ATTRIBUTE = "bullet";
    static final String ENUMTYPE = "enumtype";
    static final String PREFIX = "prefix";
    static final String SUFFIX = "suffix";

    private final MarkupRegistry registry;

    BlockParser(MarkupRegistry registry) {
        this.registry = registry;
    }

    /**
     * Parses a whole document.
     *
     * @param source document source
     * @return DOCUMENT node, including diagnostics
     * @throws RstParseException on structural errors
     */
    Node parseDocument(String source) {
        Sections sections = new Sections();
        parseBlocks(TextBlocks.lines(source), 1, sections::add, sections);
        return sections.finish();
    }

    private List<Node> parseNested(List<String> lines, int firstLine) {
        List<Node> nodes = new ArrayList<>();
        parseBlocks(lines, firstLine, nodes::add, null);
        return nodes;
    }

    private void parseBlocks(List<String> lines, int firstLine, Consumer<Node> sink, Sections sections) {
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (TextBlocks.isBlank(line)) {
                i++;
            } else if (TextBlocks.indentOf(line) > 0) {
                i = blockQuote(lines, i, firstLine, sink);
            } else if (EXPLICIT.matcher(line).matches()) {
                i = explicitMarkup(lines, i, firstLine, sink);
            } else if (sections != null && isOverlinedTitle(lines, i)) {
                i = title(lines, i + 1, lines.get(i + 2).charAt(0) + "o", firstLine, sections);
            } else if (sections != null && isUnderlinedTitle(lines, i, firstLine, sink)) {
                i = title(lines, i, lines.get(i + 1).charAt(0) + "u", firstLine, sections);
            } else if (BULLET.matcher(line).matches()) {
                i = bulletList(lines, i, firstLine, sink);
            } else if (ENUMERATOR.matcher(line).matches()) {
                i = enumeratedList(lines, i, firstLine, sink);
            } else if (GRID_BORDER.matcher(line).matches()) {
                i = table(lines, i, firstLine, sink);
            } else if (isDefinitionItem(lines, i)) {
                i = definitionList(lines, i, firstLine, sink);
            } else {
                i = paragraph(lines, i, firstLine, sink);
            }
        }
    }

    // --- Sections ---

    private static boolean isAdornment(String line) {
        if (line.isEmpty() || ADORNMENT_CHARS.indexOf(line.charAt(0)) < 0) {
            return false;
        }
        for (int i = 1; i < line.length(); i++) {
            if (line.charAt(i) != line.charAt(0)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isOverlinedTitle(List<String> lines, int i) {
        if (i + 2 >= lines.size() || !isAdornment(lines.get(i))) {
            return false;
        }
        String text = lines.get(i + 1).strip();
        return !text.isEmpty()
            && lines.get(i + 2).equals(lines.get(i))
            && lines.get(i).length() >= text.codePointCount(0, text.length());
    }

    private static boolean isUnderlinedTitle(List<String> lines, int i, int firstLine, Consumer<Node> sink) {
        if (i + 1 >= lines.size() || isAdornment(lines.get(i)) || !isAdornment(lines.get(i + 1))) {
            return false;
        }
        String text = lines.get(i);
        int underline = lines.get(i + 1).length();
        if (underline >= text.codePointCount(0, text.length())) {
            return true;
        }
        if (underline < MIN_SHORT_UNDERLINE) {
            return false;
        }
        sink.accept(SystemMessages.create(SystemMessages.WARNING, "Title underline too short.", firstLine + i + 1));
        return true;
    }

    private int title(List<String> lines, int textLine, String style, int firstLine, Sections sections) {
        String text = lines.get(textLine).strip();
        int line = firstLine + textLine;
        List<Node> messages = new ArrayList<>();
        Node title = Node.of(NodeKind.TITLE, InlineParser.parse(text, registry, line, messages));
        sections.open(style, title, InlineParser.normalizeName(title.astext()), line);
        messages.forEach(sections::add);
        return textLine + 2;
    }

    /**
     * Open sections during a document parse, innermost on top.
     */
    private static final class Sections {

        private record Frame(int level, Map<String, Object> attributes, List<Node> children) {
        }

        private final List<String> styles = new ArrayList<>();
        private final Deque<Frame> frames = new ArrayDeque<>();

        Sections() {
            frames.push(new Frame(0, Map.of(), new ArrayList<>()));
        }

        void add(Node node) {
            frames.peek().children().add(node);
        }

        void open(String style, Node title, String name, int line) {
            int depth = frames.size() - 1;
            int level = styles.indexOf(style) + 1;
            if (level == 0) {
                level = styles.size() + 1;
                if (level > depth + 1) {
                    throw new RstParseException("Title level inconsistent", line);
                }
                styles.add(style);
            }
            while (frames.size() - 1 >= level) {
                close();
            }
            List<Node> children = new ArrayList<>();
            children.add(title);
            frames.push(new Frame(level, Map.of(Node.NAMES, List.of(name)), children));
        }

        private void close() {
            Frame frame = frames.pop();
            add(Node.of(NodeKind.SECTION, frame.attributes(), frame.children()));
        }

        Node finish() {
            while (frames.size() > 1) {
                close();
            }
            return Node.of(NodeKind.DOCUMENT, frames.peek().children());
        }
    }

    // --- Paragraphs and literal blocks ---

    private int paragraph(List<String> lines, int i, int firstLine, Consumer<Node> sink) {
        int end = i;
        while (end < lines.size() && !TextBlocks.isBlank(lines.get(end)) && TextBlocks.indentOf(lines.get(end)) == 0) {
            end++;
        }
        String text = String.join("\n", lines.subList(i, end));
        int line = firstLine + i;

        if (text.endsWith("::")) {
            int start = TextBlocks.skipBlank(lines, end);
            if (start < lines.size() && TextBlocks.indentOf(lines.get(start)) > 0) {
                int blockEnd = TextBlocks.indentedBlockEnd(lines, start, 1);
                String stripped = text.strip();
                if (!stripped.equals("::")) {
                    String shortened = Character.isWhitespace(text.charAt(text.length() - 3))
                        ? text.substring(0, text.length() - 2).stripTrailing()
                        : text.substring(0, text.length() - 1);
                    emitInline(NodeKind.PARAGRAPH, shortened, line, sink);
                }
                List<String> body = TextBlocks.dedent(lines.subList(start, blockEnd));
                sink.accept(Node.of(NodeKind.LITERAL_BLOCK, Map.of(Node.CLASSES, List.of()),
                    List.of(Node.text(String.join("\n", body)))));
                return blockEnd;
            }
        }

        emitInline(NodeKind.PARAGRAPH, text, line, sink);
        if (end < lines.size() && !TextBlocks.isBlank(lines.get(end))) {
            sink.accept(SystemMessages.create(SystemMessages.ERROR, "Unexpected indentation.", firstLine + end));
        }
        return end;
    }

    private void emitInline(NodeKind kind, String text, int line, Consumer<Node> sink) {
        List<Node> messages = new ArrayList<>();
        sink.accept(Node.of(kind, InlineParser.parse(text, registry, line, messages)));
        messages.forEach(sink);
    }

    private int blockQuote(List<String> lines, int i, int firstLine, Consumer<Node> sink) {
        int end = TextBlocks.indentedBlockEnd(lines, i, 1);
        List<String> body = TextBlocks.dedent(lines.subList(i, end));
        sink.accept(Node.of(NodeKind.BLOCK_QUOTE, parseNested(body, firstLine + i)));
        return end;
    }

    // --- Lists ---

    private int bulletList(List<String> lines, int i, int firstLine, Consumer<Node> sink) {
        char marker = lines.get(i).charAt(0);
        List<Node> items = new ArrayList<>();
        int next = i;
        int end;
        do {
            Matcher matcher = BULLET.matcher(lines.get(next));
            matcher.matches();
            end = listItem(lines, next, matcher.group(2), firstLine, items);
            next = TextBlocks.skipBlank(lines, end);
        } while (next < lines.size() && lines.get(next).charAt(0) == marker
            && BULLET.matcher(lines.get(next)).matches());

        sink.accept(Node.of(NodeKind.BULLET_LIST, Map.of(BULLET_ATTRIBUTE, String.valueOf(marker)), items));
        return end;
    }

    private int enumeratedList(List<String> lines, int i, int firstLine, Consumer<Node> sink) {
        Matcher first = ENUMERATOR.matcher(lines.get(i));
        first.matches();
        String format = enumerationFormat(first);
        List<Node> items = new ArrayList<>();
        int next = i;
        int end;
        Matcher matcher = first;
        while (true) {
            end = listItem(lines, next, matcher.group(4), firstLine, items);
            next = TextBlocks.skipBlank(lines, end);
            if (next >= lines.size()) {
                break;
            }
            matcher = ENUMERATOR.matcher(lines.get(next));
            if (!matcher.matches() || !enumerationFormat(matcher).equals(format)) {
                break;
            }
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(ENUMTYPE, "arabic");
        attributes.put(PREFIX, format.equals("parens") ? "(" : "");
        attributes.put(SUFFIX, format.equals("period") ? "." : ")");
        sink.accept(Node.of(NodeKind.ENUMERATED_LIST, attributes, items));
        return end;
    }

    private static String enumerationFormat(Matcher matcher) {
        if (matcher.group(3) != null) {
            return "parens";
        }
        return ".".equals(matcher.group(2)) ? "period" : "rparen";
    }

    private int listItem(List<String> lines, int i, String firstText, int firstLine, List<Node> items) {
        String first = lines.get(i);
        List<String> body = new ArrayList<>();
        int bodyIndent;
        if (firstText != null && !firstText.isEmpty()) {
            bodyIndent = first.length() - firstText.length();
            body.add(firstText);
        } else {
            int next = TextBlocks.skipBlank(lines, i + 1);
            bodyIndent = next < lines.size() && TextBlocks.indentOf(lines.get(next)) > 0
                ? TextBlocks.indentOf(lines.get(next))
                : first.length() + 1;
        }
        int end = TextBlocks.indentedBlockEnd(lines, i + 1, bodyIndent);
        body.addAll(TextBlocks.strip(lines.subList(i + 1, end), bodyIndent));
        items.add(Node.of(NodeKind.LIST_ITEM, parseNested(TextBlocks.trimBlank(body), firstLine + i)));
        return end;
    }

    private boolean isDefinitionItem(List<String> lines, int i) {
        if (i + 1 >= lines.size()) {
            return false;
        }
        String term = lines.get(i);
        String next = lines.get(i + 1);
        return !TextBlocks.isBlank(term) && TextBlocks.indentOf(term) == 0
            && !TextBlocks.isBlank(next) && TextBlocks.indentOf(next) > 0
            && !EXPLICIT.matcher(term).matches()
            && !BULLET.matcher(term).matches()
            && !ENUMERATOR.matcher(term).matches()
            && !GRID_BORDER.matcher(term).matches();
    }

    private int definitionList(List<String> lines, int i, int firstLine, Consumer<Node> sink) {
        List<Node> items = new ArrayList<>();
        List<Node> messages = new ArrayList<>();
        int next = i;
        int end;
        do {
            int line = firstLine + next;
            Node term = Node.of(NodeKind.TERM, InlineParser.parse(lines.get(next), registry, line, messages));
            end = TextBlocks.indentedBlockEnd(lines, next + 1, 1);
            List<String> body = TextBlocks.dedent(lines.subList(next + 1, end));
            Node definition = Node.of(NodeKind.DEFINITION, parseNested(body, line + 1));
            items.add(Node.of(NodeKind.DEFINITION_LIST_ITEM, List.of(term, definition)));
            next = TextBlocks.skipBlank(lines, end);
        } while (isDefinitionItem(lines, next));

        sink.accept(Node.of(NodeKind.DEFINITION_LIST, items));
        messages.forEach(sink);
        return end;
    }

    // --- Tables ---

    private int table(List<String> lines, int i, int firstLine, Consumer<Node> sink) {
        int end = i;
        while (end < lines.size() && !TextBlocks.isBlank(lines.get(end))
            && (lines.get(end).charAt(0) == '+' || lines.get(end).charAt(0) == '|')) {
            end++;
        }
        sink.accept(GridTableParser.parse(lines.subList(i, end), firstLine + i, this::parseNested));
        return end;
    }

    // --- Explicit markup ---

    private int explicitMarkup(List<String> lines, int i, int firstLine, Consumer<Node> sink) {
        Matcher explicit = EXPLICIT.matcher(lines.get(i));
        explicit.matches();
        String rest = explicit.group(1) != null ? explicit.group(1).strip() : "";
        int line = firstLine + i;

        if (rest.isEmpty() && (i + 1 >= lines.size() || TextBlocks.isBlank(lines.get(i + 1)))) {
            sink.accept(Node.of(NodeKind.COMMENT, List.of()));
            return i + 1;
        }
        int end = TextBlocks.indentedBlockEnd(lines, i + 1, 1);
        List<String> block = TextBlocks.dedent(lines.subList(i + 1, end));

        Matcher matcher;
        if ((matcher = ANONYMOUS_TARGET.matcher(rest)).matches()) {
            sink.accept(target(null, matcher.group(1), block));
        } else if ((matcher = TARGET.matcher(rest)).matches()) {
            String name = matcher.group(1);
            if (name.startsWith("`")) {
                name = name.substring(1, name.length() - 1);
            }
            sink.accept(target(name, matcher.group(2), block));
        } else if ((matcher = SUBSTITUTION.matcher(rest)).matches()) {
            Node definition = opaqueDirective(NodeKind.SUBSTITUTION_DEFINITION, matcher.group(2), matcher.group(3), block)
                .withAttribute(Node.NAMES, List.of(InlineParser.whitespaceNormalize(matcher.group(1))));
            sink.accept(definition);
        } else if ((matcher = DIRECTIVE.matcher(rest)).matches()) {
            directive(matcher.group(1), matcher.group(2), block, line, sink);
        } else {
            List<String> text = new ArrayList<>();
            if (!rest.isEmpty()) {
                text.add(rest);
            }
            text.addAll(block);
            sink.accept(Node.of(NodeKind.COMMENT, List.of(Node.text(String.join("\n", text)))));
        }
        return end;
    }

    private static Node target(String name, String firstLine, List<String> block) {
        StringBuilder uri = new StringBuilder(firstLine != null ? firstLine.strip() : "");
        for (String line : block) {
            uri.append(line.strip());
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        if (name == null) {
            attributes.put(Node.ANONYMOUS, true);
        } else {
            attributes.put(Node.NAMES, List.of(InlineParser.normalizeName(name)));
        }
        if (uri.length() > 0) {
            attributes.put(Node.REFURI, WHITESPACE.matcher(uri).replaceAll(""));
        }
        return Node.of(NodeKind.TARGET, attributes, List.of());
    }

    private void directive(String name, String arguments, List<String> block, int line, Consumer<Node> sink) {
        DirectiveType type = registry.directive(name);
        if (type == null) {
            log.debug("Unknown directive '{}' at line {} kept verbatim", name, line);
            sink.accept(SystemMessages.create(SystemMessages.ERROR, "Unknown directive type \"" + name + "\".", line));
            type = DirectiveType.OPAQUE;
        }
        switch (type) {
            case ADMONITION -> {
                List<String> body = new ArrayList<>();
                if (arguments != null) {
                    body.add(arguments);
                }
                body.addAll(block.subList(optionsEnd(block, 0), block.size()));
                NodeKind kind = NodeKind.admonitionFor(name);
                sink.accept(Node.of(kind, parseNested(TextBlocks.trimBlank(body), line)));
            }
            case IMAGE -> {
                StringBuilder uri = new StringBuilder(arguments != null ? arguments : "");
                int k = 0;
                while (k < block.size() && !TextBlocks.isBlank(block.get(k)) && !OPTION.matcher(block.get(k)).matches()) {
                    uri.append(block.get(k).strip());
                    k++;
                }
                Map<String, Object> attributes = new LinkedHashMap<>();
                attributes.put(Node.URI, WHITESPACE.matcher(uri).replaceAll(""));
                attributes.put(Node.OPTIONS, options(block, k));
                sink.accept(Node.of(NodeKind.IMAGE, attributes, List.of()));
            }
            case CODE -> {
                List<String> content = TextBlocks.trimBlank(block.subList(optionsEnd(block, 0), block.size()));
                if (content.isEmpty()) {
                    sink.accept(SystemMessages.create(SystemMessages.ERROR,
                        "Content block expected for the \"" + name + "\" directive; none found.", line));
                    return;
                }
                List<String> classes = new ArrayList<>();
                classes.add("code");
                if (arguments != null) {
                    classes.add(WHITESPACE.split(arguments.strip())[0]);
                }
                sink.accept(Node.of(NodeKind.LITERAL_BLOCK, Map.of(Node.CLASSES, classes),
                    List.of(Node.text(String.join("\n", TextBlocks.dedent(content))))));
            }
            default -> sink.accept(opaqueDirective(NodeKind.DIRECTIVE, name, arguments, block));
        }
    }

    private static Node opaqueDirective(NodeKind kind, String name, String arguments, List<String> block) {
        int contentStart = optionsEnd(block, 0);
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(Node.NAME, name);
        attributes.put(Node.ARGUMENTS, arguments != null
            ? List.of(WHITESPACE.split(arguments.strip()))
            : List.of());
        attributes.put(Node.OPTIONS, options(block, 0));
        attributes.put(Node.CONTENT, TextBlocks.trimBlank(block.subList(contentStart, block.size())));
        return Node.of(kind, attributes, List.of());
    }

    private static int optionsEnd(List<String> block, int from) {
        int k = from;
        while (k < block.size() && OPTION.matcher(block.get(k)).matches()) {
            k++;
            while (k < block.size() && !TextBlocks.isBlank(block.get(k)) && TextBlocks.indentOf(block.get(k)) > 0) {
                k++;
            }
        }
        return k;
    }

    private static List<DirectiveOption> options(List<String> block, int from) {
        List<DirectiveOption> options = new ArrayList<>();
        int k = from;
        Matcher matcher;
        while (k < block.size() && (matcher = OPTION.matcher(block.get(k))).matches()) {
            StringBuilder value = new StringBuilder(matcher.group(2) != null ? matcher.group(2) : "");
            k++;
            while (k < block.size() && !TextBlocks.isBlank(block.get(k)) && TextBlocks.indentOf(block.get(k)) > 0) {
                value.append(value.length() > 0 ? " " : "").append(block.get(k).strip());
                k++;
            }
            options.add(new DirectiveOption(matcher.group(1), value.length() > 0 ? value.toString() : null));
        }
        return options;
    }
}
