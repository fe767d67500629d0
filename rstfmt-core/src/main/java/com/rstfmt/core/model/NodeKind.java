package com.rstfmt.core.model;

import java.util.Locale;

/**
 * Closed set of node kinds that can appear in a parsed document tree.
 *
 * <p>Names follow the docutils element vocabulary so that tree dumps read the same way
 * reStructuredText tooling users expect ({@code bullet_list}, {@code title_reference}, ...).
 *
 * <p>Admonition kinds carry the name of the directive that produces them, which is also the
 * name the renderer writes back ({@code .. note::}).
 */
public enum NodeKind {
    DOCUMENT,
    SECTION,
    TITLE,
    PARAGRAPH,
    BULLET_LIST,
    ENUMERATED_LIST,
    LIST_ITEM,
    TERM,
    DEFINITION,
    DEFINITION_LIST_ITEM,
    DEFINITION_LIST,
    BLOCK_QUOTE,
    DIRECTIVE,
    SUBSTITUTION_DEFINITION,
    TABLE,
    TGROUP,
    COLSPEC,
    THEAD,
    TBODY,
    ROW,
    ENTRY,
    TEXT,
    REFERENCE,
    TARGET,
    EMPHASIS,
    STRONG,
    LITERAL,
    TITLE_REFERENCE,
    SUBSTITUTION_REFERENCE,
    ROLE,
    INLINE,
    COMMENT,
    ATTENTION(true),
    CAUTION(true),
    DANGER(true),
    ERROR(true),
    HINT(true),
    IMPORTANT(true),
    NOTE(true),
    TIP(true),
    WARNING(true),
    IMAGE,
    LITERAL_BLOCK,
    /** Parser diagnostic; removed before formatting. */
    SYSTEM_MESSAGE;

    private final boolean admonition;

    NodeKind() {
        this(false);
    }

    NodeKind(boolean admonition) {
        this.admonition = admonition;
    }

    /**
     * Returns the docutils-style tag name, e.g. {@code bullet_list}.
     *
     * @return lower-case tag name
     */
    public String tagName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns whether this kind is one of the standard admonitions.
     *
     * @return true for note, warning, hint and the other admonitions
     */
    public boolean isAdmonition() {
        return admonition;
    }

    /**
     * Returns the directive name that produces this admonition.
     *
     * @return directive name
     * @throws IllegalStateException if this kind is not an admonition
     */
    public String directiveName() {
        if (!admonition) {
            throw new IllegalStateException(name() + " is not an admonition");
        }
        return tagName();
    }

    /**
     * Looks up the admonition kind for a directive name.
     *
     * @param directiveName directive name as written in source
     * @return matching admonition kind, or null if the name is not an admonition
     */
    public static NodeKind admonitionFor(String directiveName) {
        if (directiveName == null) {
            return null;
        }
        for (NodeKind kind : values()) {
            if (kind.admonition && kind.tagName().equals(directiveName.toLowerCase(Locale.ROOT))) {
                return kind;
            }
        }
        return null;
    }
}
