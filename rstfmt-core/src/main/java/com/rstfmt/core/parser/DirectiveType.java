package com.rstfmt.core.parser;

/**
 * How the parser turns a directive into tree nodes.
 */
public enum DirectiveType {
    /** Kept verbatim: name, arguments, options and body lines pass through unchanged. */
    OPAQUE,
    /** Body parsed as nested content of an admonition node ({@code note}, {@code warning}, ...). */
    ADMONITION,
    /** Single URI argument producing an {@code image} node. */
    IMAGE,
    /** Verbatim body producing a {@code literal_block} with an optional language class. */
    CODE
}
