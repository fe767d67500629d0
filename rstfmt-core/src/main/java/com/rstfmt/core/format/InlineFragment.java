package com.rstfmt.core.format;

import java.util.Objects;

/**
 * Piece of paragraph content handed to the {@link WordWrapper}.
 *
 * <p>Plain fragments are ordinary text; markup fragments are already wrapped in their
 * delimiters ({@code *text*}, {@code `title <uri>`_}, ...) and must stay recognizable as
 * one span after wrapping.
 *
 * @param text fragment text
 * @param markup whether the fragment is an inline markup span
 */
public record InlineFragment(
    String text,
    boolean markup
) {
    public InlineFragment {
        Objects.requireNonNull(text, "text must not be null");
    }

    public static InlineFragment plain(String text) {
        return new InlineFragment(text, false);
    }

    public static InlineFragment markup(String text) {
        return new InlineFragment(text, true);
    }
}
