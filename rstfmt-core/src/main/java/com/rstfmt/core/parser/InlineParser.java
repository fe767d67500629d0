package com.rstfmt.core.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.IntPredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.rstfmt.core.model.Node;
import com.rstfmt.core.model.NodeKind;

/**
 * Parses the inline markup of one text block into inline nodes.
 *
 * <p>Recognized constructs, tried at every position where inline markup may start:
 * <ul>
 *   <li>{@code **strong**}, {@code *emphasis*}, {@code ``literal``}</li>
 *   <li>{@code `interpreted`} (title reference) with an optional {@code :role:} prefix or
 *       suffix</li>
 *   <li>{@code `phrase`_}, {@code `title <uri>`_}, {@code name_} and their anonymous
 *       {@code __} forms</li>
 *   <li>{@code |substitution|}, optionally followed by {@code _} or {@code __}</li>
 *   <li>standalone URIs and e-mail addresses</li>
 * </ul>
 *
 * <p>Markup may start at the beginning of the text or after whitespace or one of
 * {@code - : / ' " < ( [ {}; it may end at the end of the text or before whitespace or one
 * of {@code - . , : ; ! ? \ / ' " ) ] } >}. A start-string without a matching end-string is
 * kept as plain text and reported as a warning.
 *
 * <p>Text leaves carry the unescaped text plus, when it differs, the source slice with
 * escaped whitespace removed; the formatter writes the latter so that escapes survive.
 */
final class InlineParser {

    private static final String PRE_CHARS = "-:/'\"<([{";
    private static final String POST_CHARS = "-.,:;!?\\/'\")]}>";
    private static final String OPENERS = "'\"<([{";
    private static final String CLOSERS = "'\">)]}";

    static final String NAME = "[A-Za-z0-9]+(?:[-_.:+][A-Za-z0-9]+)*";

    private static final Pattern ROLE_PREFIX = Pattern.compile(":(" + NAME + "):`");
    private static final Pattern ROLE_SUFFIX = Pattern.compile(":(" + NAME + "):");
    private static final Pattern SIMPLE_REFERENCE = Pattern.compile("(" + NAME + ")(__?)");
    private static final Pattern EMBEDDED_URI = Pattern.compile("(?s)(?:(.*\\S)\\s+)?<([^<>]+)>");
    private static final Pattern STANDALONE_URI = Pattern.compile(
        "(?:(?:https?|ftp|sftp|file)://[^\\s<>\"'`]*[^\\s<>\"'`.,;:!?)\\]}\\\\*_|]"
            + "|mailto:[A-Za-z0-9._%+-]+@[A-Za-z0-9-]+(?:\\.[A-Za-z0-9-]+)+)");
    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9-]+(?:\\.[A-Za-z0-9-]+)+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private record Match(List<Node> nodes, int end) {
    }

    private final String raw;
    private final MarkupRegistry registry;
    private final int line;
    private final List<Node> messages;
    private final List<Node> nodes = new ArrayList<>();

    private InlineParser(String raw, MarkupRegistry registry, int line, List<Node> messages) {
        this.raw = raw;
        this.registry = registry;
        this.line = line;
        this.messages = messages;
    }

    /**
     * Parses a text block.
     *
     * @param raw source text, lines joined by newlines
     * @param registry known roles
     * @param line source line of the block, for diagnostics
     * @param messages sink for diagnostics
     * @return inline nodes
     */
    static List<Node> parse(String raw, MarkupRegistry registry, int line, List<Node> messages) {
        InlineParser parser = new InlineParser(raw, registry, line, messages);
        parser.run();
        return parser.nodes;
    }

    private void run() {
        int textStart = 0;
        int pos = 0;
        while (pos < raw.length()) {
            if (raw.charAt(pos) == '\\') {
                pos += 2;
                continue;
            }
            Match match = startAllowed(pos) ? markupAt(pos) : null;
            if (match == null) {
                pos++;
            } else if (match.nodes().isEmpty()) {
                // unterminated start-string, stays part of the surrounding text
                pos = match.end();
            } else {
                flushText(textStart, pos);
                nodes.addAll(match.nodes());
                pos = match.end();
                textStart = pos;
            }
        }
        flushText(textStart, raw.length());
    }

    private void flushText(int from, int to) {
        if (to > from) {
            nodes.add(textNode(raw.substring(from, to)));
        }
    }

    private Match markupAt(int pos) {
        char c = raw.charAt(pos);
        if (raw.startsWith("``", pos)) {
            return literal(pos);
        }
        if (raw.startsWith("**", pos)) {
            return delimited(pos, "**", NodeKind.STRONG);
        }
        if (c == '*') {
            return delimited(pos, "*", NodeKind.EMPHASIS);
        }
        if (c == '`') {
            return interpreted(pos, pos, null);
        }
        if (c == '|') {
            return substitution(pos);
        }
        if (c == ':') {
            Matcher role = lookingAt(ROLE_PREFIX, pos);
            return role != null ? interpreted(role.end() - 1, pos, role.group(1)) : null;
        }
        if (Character.isLetterOrDigit(c)) {
            return standalone(pos);
        }
        return null;
    }

    private Match literal(int pos) {
        int contentStart = pos + 2;
        if (!contentStarts(pos, contentStart)) {
            return null;
        }
        for (int k = contentStart + 1; k < raw.length(); k++) {
            if (raw.startsWith("``", k) && !isSpace(raw.charAt(k - 1)) && endAllowed(k + 2)) {
                Node text = Node.text(raw.substring(contentStart, k));
                return new Match(List.of(Node.of(NodeKind.LITERAL, List.of(text))), k + 2);
            }
        }
        return unterminated(pos, 2, "literal");
    }

    private Match delimited(int pos, String delimiter, NodeKind kind) {
        int contentStart = pos + delimiter.length();
        if (!contentStarts(pos, contentStart)) {
            return null;
        }
        int end = findEnd(contentStart, delimiter, this::endAllowed);
        if (end < 0) {
            return unterminated(pos, delimiter.length(), kind.tagName());
        }
        Node node = Node.of(kind, List.of(textNode(raw.substring(contentStart, end))));
        return new Match(List.of(node), end + delimiter.length());
    }

    private Match substitution(int pos) {
        int contentStart = pos + 1;
        if (!contentStarts(pos, contentStart)) {
            return null;
        }
        int end = findEnd(contentStart, "|", after -> endAllowed(after)
            || (raw.startsWith("_", after) && endAllowed(after + 1))
            || (raw.startsWith("__", after) && endAllowed(after + 2)));
        if (end < 0) {
            return unterminated(pos, 1, "substitution_reference");
        }
        String content = raw.substring(contentStart, end);
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(Node.REFNAME, normalizeName(unescape(content)));
        Node reference = Node.of(NodeKind.SUBSTITUTION_REFERENCE, attributes, List.of(textNode(content)));

        int after = end + 1;
        int suffix = raw.startsWith("__", after) ? 2 : raw.startsWith("_", after) ? 1 : 0;
        if (suffix > 0 && endAllowed(after + suffix)) {
            Map<String, Object> linkAttributes = new LinkedHashMap<>();
            linkAttributes.put(Node.REFNAME, normalizeName(unescape(content)));
            if (suffix == 2) {
                linkAttributes.put(Node.ANONYMOUS, true);
            }
            return new Match(List.of(Node.of(NodeKind.REFERENCE, linkAttributes, List.of(reference))), after + suffix);
        }
        return new Match(List.of(reference), after);
    }

    private Match interpreted(int backtick, int rawStart, String rolePrefix) {
        int contentStart = backtick + 1;
        if (!contentStarts(backtick, contentStart) || raw.charAt(contentStart) == '`') {
            return null;
        }
        int end = findEnd(contentStart, "`",
            after -> rolePrefix != null ? endAllowed(after) : suffixEnd(after) >= 0);
        if (end < 0) {
            return unterminated(rawStart, contentStart - rawStart, "interpreted text or phrase reference");
        }
        int matchEnd = rolePrefix != null ? end + 1 : suffixEnd(end + 1);
        String content = raw.substring(contentStart, end);
        String suffix = raw.substring(end + 1, matchEnd);

        if (suffix.startsWith("_")) {
            return new Match(reference(content, suffix.length() == 2), matchEnd);
        }
        String role = rolePrefix;
        if (suffix.startsWith(":")) {
            role = suffix.substring(1, suffix.length() - 1);
        }
        if (role == null) {
            return new Match(List.of(Node.of(NodeKind.TITLE_REFERENCE, List.of(textNode(content)))), matchEnd);
        }
        return new Match(List.of(role(role, content, raw.substring(rawStart, matchEnd))), matchEnd);
    }

    private int suffixEnd(int after) {
        if (raw.startsWith("__", after) && endAllowed(after + 2)) {
            return after + 2;
        }
        if (raw.startsWith("_", after) && endAllowed(after + 1)) {
            return after + 1;
        }
        Matcher role = lookingAt(ROLE_SUFFIX, after);
        if (role != null && endAllowed(role.end())) {
            return role.end();
        }
        return endAllowed(after) ? after : -1;
    }

    private Node role(String name, String content, String source) {
        NodeKind standard = registry.standardRole(name);
        if (standard != null) {
            return Node.of(standard, List.of(textNode(content)));
        }
        if (!registry.isKnownRole(name)) {
            messages.add(SystemMessages.create(SystemMessages.ERROR,
                "Unknown interpreted text role \"" + name + "\".", line));
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(Node.NAME, name);
        attributes.put(Node.RAWSOURCE, source);
        return Node.of(NodeKind.ROLE, attributes, List.of(textNode(content)));
    }

    private List<Node> reference(String content, boolean anonymous) {
        Matcher embedded = EMBEDDED_URI.matcher(content);
        if (embedded.matches()) {
            String uri = WHITESPACE.matcher(unescape(embedded.group(2))).replaceAll("");
            String title = embedded.group(1) != null ? embedded.group(1) : embedded.group(2);

            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put(Node.NAME, whitespaceNormalize(unescape(title)));
            attributes.put(Node.REFURI, uri);
            if (anonymous) {
                attributes.put(Node.ANONYMOUS, true);
            }
            Node reference = Node.of(NodeKind.REFERENCE, attributes, List.of(textNode(title)));
            if (anonymous) {
                return List.of(reference);
            }
            Map<String, Object> targetAttributes = new LinkedHashMap<>();
            targetAttributes.put(Node.NAMES, List.of(normalizeName(unescape(title))));
            targetAttributes.put(Node.REFURI, uri);
            return List.of(reference, Node.of(NodeKind.TARGET, targetAttributes, List.of()));
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(Node.NAME, whitespaceNormalize(unescape(content)));
        attributes.put(Node.REFNAME, normalizeName(unescape(content)));
        if (anonymous) {
            attributes.put(Node.ANONYMOUS, true);
        }
        return List.of(Node.of(NodeKind.REFERENCE, attributes, List.of(textNode(content))));
    }

    private Match standalone(int pos) {
        Matcher uri = lookingAt(STANDALONE_URI, pos);
        if (uri != null && endAllowed(uri.end())) {
            return new Match(List.of(uriReference(uri.group(), uri.group())), uri.end());
        }
        Matcher email = lookingAt(EMAIL, pos);
        if (email != null && endAllowed(email.end())) {
            return new Match(List.of(uriReference("mailto:" + email.group(), email.group())), email.end());
        }
        Matcher name = lookingAt(SIMPLE_REFERENCE, pos);
        if (name != null && endAllowed(name.end())) {
            String word = name.group(1);
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put(Node.NAME, word);
            attributes.put(Node.REFNAME, normalizeName(word));
            if (name.group(2).length() == 2) {
                attributes.put(Node.ANONYMOUS, true);
            }
            return new Match(List.of(Node.of(NodeKind.REFERENCE, attributes, List.of(Node.text(word)))), name.end());
        }
        return null;
    }

    private static Node uriReference(String uri, String text) {
        return Node.of(NodeKind.REFERENCE, Map.of(Node.REFURI, uri), List.of(Node.text(text)));
    }

    private Match unterminated(int pos, int length, String construct) {
        messages.add(SystemMessages.create(SystemMessages.WARNING,
            "Inline " + construct + " start-string without end-string.", line));
        return new Match(List.of(), pos + length);
    }

    /**
     * Finds the first end-string after a non-empty content start, skipping escaped
     * characters. {@code accept} decides whether what follows the candidate is valid.
     */
    private int findEnd(int contentStart, String delimiter, IntPredicate accept) {
        for (int k = contentStart; k < raw.length(); k++) {
            if (raw.charAt(k) == '\\') {
                k++;
                continue;
            }
            if (k > contentStart && raw.startsWith(delimiter, k) && !isSpace(raw.charAt(k - 1))
                && accept.test(k + delimiter.length())) {
                return k;
            }
        }
        return -1;
    }

    private boolean startAllowed(int pos) {
        if (pos == 0) {
            return true;
        }
        char before = raw.charAt(pos - 1);
        return isSpace(before) || PRE_CHARS.indexOf(before) >= 0;
    }

    private boolean contentStarts(int start, int contentStart) {
        if (contentStart >= raw.length() || isSpace(raw.charAt(contentStart))) {
            return false;
        }
        if (start > 0) {
            int opener = OPENERS.indexOf(raw.charAt(start - 1));
            return opener < 0 || raw.charAt(contentStart) != CLOSERS.charAt(opener);
        }
        return true;
    }

    private boolean endAllowed(int pos) {
        if (pos >= raw.length()) {
            return true;
        }
        char after = raw.charAt(pos);
        return isSpace(after) || POST_CHARS.indexOf(after) >= 0;
    }

    private Matcher lookingAt(Pattern pattern, int pos) {
        Matcher matcher = pattern.matcher(raw);
        matcher.region(pos, raw.length());
        matcher.useTransparentBounds(true);
        matcher.useAnchoringBounds(false);
        return matcher.lookingAt() ? matcher : null;
    }

    // --- Text helpers ---

    static Node textNode(String source) {
        String text = unescape(source);
        String kept = removeEscapedWhitespace(source);
        if (kept.equals(text)) {
            return Node.text(text);
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(Node.TEXT, text);
        attributes.put(Node.RAWSOURCE, kept);
        return Node.of(NodeKind.TEXT, attributes, List.of());
    }

    static String unescape(String source) {
        StringBuilder sb = new StringBuilder(source.length());
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\\' && i + 1 < source.length()) {
                char next = source.charAt(++i);
                if (!isSpace(next)) {
                    sb.append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static String removeEscapedWhitespace(String source) {
        StringBuilder sb = new StringBuilder(source.length());
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\\' && i + 1 < source.length()) {
                char next = source.charAt(++i);
                if (!isSpace(next)) {
                    sb.append(c).append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Normalizes a reference name the way targets are matched: whitespace collapsed,
     * lower case.
     *
     * @param name reference name
     * @return normalized name
     */
    static String normalizeName(String name) {
        return whitespaceNormalize(name).toLowerCase(Locale.ROOT);
    }

    static String whitespaceNormalize(String name) {
        return WHITESPACE.matcher(name.strip()).replaceAll(" ");
    }

    private static boolean isSpace(char c) {
        return Character.isWhitespace(c);
    }
}
