package com.rstfmt.core.format;

import java.util.List;

/**
 * Rendering state threaded through the formatter.
 *
 * <p>Every transition returns a new context; a child never observes changes made for a
 * sibling or for its parent.
 *
 * @param sectionDepth number of enclosing sections
 * @param width available line width, or null for unbounded output
 * @param bullet list marker for the list items being rendered, or null outside lists
 * @param columnWidths declared column widths of the enclosing table group, or null
 */
public record FormatContext(
    int sectionDepth,
    Integer width,
    String bullet,
    List<Integer> columnWidths
) {
    /** Underline characters by section depth. */
    public static final String SECTION_CHARS = "=-^\"~+";

    public FormatContext {
        if (sectionDepth < 0) {
            throw new IllegalArgumentException("sectionDepth must not be negative: " + sectionDepth);
        }
        if (width != null && width < 1) {
            throw new IllegalArgumentException("width must be positive: " + width);
        }
        columnWidths = columnWidths != null ? List.copyOf(columnWidths) : null;
    }

    /**
     * Creates the context for a document root.
     *
     * @param width target width, or null (or a value below 1) for unbounded output
     * @return root context
     */
    public static FormatContext root(Integer width) {
        return new FormatContext(0, width == null || width < 1 ? null : width, null, null);
    }

    public boolean isUnbounded() {
        return width == null;
    }

    public FormatContext inSection() {
        return new FormatContext(sectionDepth + 1, width, bullet, columnWidths);
    }

    /**
     * Narrows the width by {@code n} columns, never below 1.
     *
     * @param n columns consumed by indentation
     * @return narrowed context, or this context when unbounded
     */
    public FormatContext indent(int n) {
        if (isUnbounded()) {
            return this;
        }
        return new FormatContext(sectionDepth, Math.max(1, width - n), bullet, columnWidths);
    }

    public FormatContext withWidth(int newWidth) {
        return new FormatContext(sectionDepth, Math.max(1, newWidth), bullet, columnWidths);
    }

    public FormatContext withBullet(String newBullet) {
        return new FormatContext(sectionDepth, width, newBullet, columnWidths);
    }

    public FormatContext withColumnWidths(List<Integer> newColumnWidths) {
        return new FormatContext(sectionDepth, width, bullet, newColumnWidths);
    }

    /**
     * Returns the title underline character for the current depth.
     *
     * <p>Depth 1 uses {@code =}, depth 2 {@code -}, and so on, cycling after six levels. A
     * title outside any section wraps around to the last character.
     *
     * @return adornment character
     */
    public char sectionCharacter() {
        return SECTION_CHARS.charAt(Math.floorMod(sectionDepth - 1, SECTION_CHARS.length()));
    }
}
