package com.rstfmt.core.format;

/**
 * Whitespace-free token produced from an {@link InlineFragment}.
 *
 * <p>The boundary flags describe the fragment edges the word touched. They decide whether
 * a markup word and an adjacent plain word can be written next to each other or need an
 * escaped space ({@code \ }) between them.
 *
 * @param text token text
 * @param inMarkup whether the word comes from a markup span
 * @param startSpace the fragment started with whitespace before this word
 * @param endSpace the fragment ended with whitespace after this word
 * @param startPunct the word starts with a character allowed right after a markup end-string
 * @param endPunct the word ends with a character allowed right before a markup start-string
 */
public record Word(
    String text,
    boolean inMarkup,
    boolean startSpace,
    boolean endSpace,
    boolean startPunct,
    boolean endPunct
) {
    static Word sentinel() {
        return new Word("", false, true, true, true, true);
    }

    Word withStartSpace() {
        return new Word(text, inMarkup, true, endSpace, startPunct, endPunct);
    }

    Word withEndSpace() {
        return new Word(text, inMarkup, startSpace, true, startPunct, endPunct);
    }

    Word withStartPunct() {
        return new Word(text, inMarkup, startSpace, endSpace, true, endPunct);
    }

    Word withEndPunct() {
        return new Word(text, inMarkup, startSpace, endSpace, startPunct, true);
    }
}
