package com.rstfmt.core.format;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns inline fragments into wrap-safe tokens and packs them into lines.
 *
 * <p>Processing happens in three steps:
 * <ol>
 *   <li>{@link #split(InlineFragment)} cuts each fragment into whitespace-free {@link Word}s
 *       and records which fragment edges they touched.</li>
 *   <li>{@link #merge(List)} glues markup words to plain words they touch without
 *       whitespace. An escaped space ({@code \ }) goes between them unless the plain side
 *       already ends (or starts) with a character the inline markup recognition rules accept
 *       next to a delimiter. Without the escape, {@code *a*b} would no longer parse as
 *       emphasis.</li>
 *   <li>{@link #wrap(Integer, List)} packs the tokens greedily. Tokens are never split; one
 *       longer than the width sits alone on its line.</li>
 * </ol>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * List<String> lines = WordWrapper.wrap(72, List.of(
 *     InlineFragment.plain("This is "),
 *     InlineFragment.markup("**bold**"),
 *     InlineFragment.plain(" text.")
 * ));
 * // ["This is **bold** text."]
 * }</pre>
 */
public final class WordWrapper {

    /** Characters allowed immediately before an inline markup start-string. */
    static final String PRE_MARKUP_BREAK_CHARS = "-:/'\"<([{";

    /** Characters allowed immediately after an inline markup end-string. */
    static final String POST_MARKUP_BREAK_CHARS = "-.,:;!?\\/'\")]}>";

    private static final String ESCAPED_SPACE = "\\ ";

    private WordWrapper() {
        // Utility class
    }

    /**
     * Splits one fragment into words.
     *
     * @param fragment plain or markup fragment
     * @return words in order
     */
    public static List<Word> split(InlineFragment fragment) {
        String text = fragment.text();
        List<Word> words = new ArrayList<>();

        if (fragment.markup()) {
            for (String token : tokens(text)) {
                words.add(new Word(token, true, false, false, false, false));
            }
            return words;
        }

        if (text.isEmpty()) {
            // Only appears between two markup spans separated by an escaped space. Flagging it
            // endPunct stops the merge with the following span from adding a second escape.
            words.add(new Word("", false, false, false, false, true));
            return words;
        }

        for (String token : tokens(text)) {
            words.add(new Word(token, false, false, false, false, false));
        }
        if (words.isEmpty()) {
            words.add(Word.sentinel());
        }

        char first = text.charAt(0);
        char last = text.charAt(text.length() - 1);
        int lastIndex = words.size() - 1;
        if (isSpace(first)) {
            words.set(0, words.get(0).withStartSpace());
        }
        if (isSpace(last)) {
            words.set(lastIndex, words.get(lastIndex).withEndSpace());
        }
        if (isSpace(first) || POST_MARKUP_BREAK_CHARS.indexOf(first) >= 0) {
            words.set(0, words.get(0).withStartPunct());
        }
        if (isSpace(last) || PRE_MARKUP_BREAK_CHARS.indexOf(last) >= 0) {
            words.set(lastIndex, words.get(lastIndex).withEndPunct());
        }
        return words;
    }

    /**
     * Glues markup words to the plain words they touch and drops empty tokens.
     *
     * @param rawWords words from {@link #split(InlineFragment)}, in order
     * @return tokens ready for line packing
     */
    public static List<String> merge(List<Word> rawWords) {
        List<Word> words = new ArrayList<>();
        words.add(Word.sentinel());

        for (Word word : rawWords) {
            Word last = words.get(words.size() - 1);
            if (!last.inMarkup() && word.inMarkup() && !last.endSpace()) {
                String join = last.endPunct() ? "" : ESCAPED_SPACE;
                words.set(words.size() - 1,
                    new Word(last.text() + join + word.text(), true, false, false, false, false));
            } else if (last.inMarkup() && !word.inMarkup() && !word.startSpace()) {
                String join = word.startPunct() ? "" : ESCAPED_SPACE;
                words.set(words.size() - 1, new Word(last.text() + join + word.text(),
                    false, false, word.endSpace(), word.startPunct(), word.endPunct()));
            } else {
                words.add(word);
            }
        }

        List<String> tokens = new ArrayList<>(words.size());
        for (Word word : words) {
            if (!word.text().isEmpty()) {
                tokens.add(word.text());
            }
        }
        return tokens;
    }

    /**
     * Converts fragments into merged tokens.
     *
     * @param fragments inline fragments in order
     * @return tokens
     */
    public static List<String> tokenize(List<InlineFragment> fragments) {
        List<Word> words = new ArrayList<>();
        for (InlineFragment fragment : fragments) {
            words.addAll(split(fragment));
        }
        return merge(words);
    }

    /**
     * Wraps fragments at the given width.
     *
     * @param width maximum line length, or null for a single unbounded line
     * @param fragments inline fragments in order
     * @return wrapped lines; a single empty line when unbounded and there is no content
     */
    public static List<String> wrap(Integer width, List<InlineFragment> fragments) {
        List<String> tokens = tokenize(fragments);

        if (width == null) {
            return List.of(String.join(" ", tokens));
        }

        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        // measured in code points, like title underlines and table cells
        int lineLength = 0;
        for (String token : tokens) {
            int tokenLength = token.codePointCount(0, token.length());
            if (lineLength > 0 && lineLength + 1 + tokenLength > width) {
                lines.add(line.toString());
                line.setLength(0);
                lineLength = 0;
            }
            if (lineLength > 0) {
                line.append(' ');
                lineLength++;
            }
            line.append(token);
            lineLength += tokenLength;
        }
        if (line.length() > 0) {
            lines.add(line.toString());
        }
        return lines;
    }

    /**
     * Joins fragments on one line regardless of length (titles, terms, reference titles).
     *
     * @param fragments inline fragments in order
     * @return single line, possibly empty
     */
    public static String singleLine(List<InlineFragment> fragments) {
        return String.join(" ", tokenize(fragments));
    }

    private static List<String> tokens(String text) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            while (i < n && isSpace(text.charAt(i))) {
                i++;
            }
            int start = i;
            while (i < n && !isSpace(text.charAt(i))) {
                i++;
            }
            if (i > start) {
                tokens.add(text.substring(start, i));
            }
        }
        return tokens;
    }

    static boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }
}
