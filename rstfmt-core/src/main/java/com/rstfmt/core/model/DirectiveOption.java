package com.rstfmt.core.model;

import java.util.Objects;

/**
 * One {@code :key: value} option line of a directive.
 *
 * @param key option name without colons
 * @param value option value, or null for flag options such as {@code :maxdepth:}
 */
public record DirectiveOption(
    String key,
    String value
) {
    public DirectiveOption {
        Objects.requireNonNull(key, "key must not be null");
    }

    /**
     * Returns whether this option carries a value.
     *
     * @return true if a value is present
     */
    public boolean hasValue() {
        return value != null;
    }
}
