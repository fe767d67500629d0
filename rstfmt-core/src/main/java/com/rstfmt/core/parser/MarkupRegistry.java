package com.rstfmt.core.parser;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.rstfmt.core.model.NodeKind;

/**
 * Directives and roles the parser recognizes.
 *
 * <p>A registry is an explicit value handed to the parser; there is no global
 * registration. Start from {@link #defaults()} and extend it with
 * {@link #withDirectives(Collection)} and {@link #withRoles(Collection)}. Directives and
 * roles added that way are kept verbatim: their source text passes through formatting
 * unchanged.
 *
 * @param directives directive name to parsing strategy
 * @param roles names of non-standard roles accepted without a diagnostic
 */
public record MarkupRegistry(
    Map<String, DirectiveType> directives,
    Set<String> roles
) {
    private static final Map<String, NodeKind> STANDARD_ROLES = Map.of(
        "emphasis", NodeKind.EMPHASIS,
        "strong", NodeKind.STRONG,
        "literal", NodeKind.LITERAL,
        "title-reference", NodeKind.TITLE_REFERENCE,
        "title", NodeKind.TITLE_REFERENCE,
        "t", NodeKind.TITLE_REFERENCE
    );

    public MarkupRegistry {
        Objects.requireNonNull(directives, "directives must not be null");
        Objects.requireNonNull(roles, "roles must not be null");
        directives = Map.copyOf(directives);
        roles = Set.copyOf(roles);
    }

    /**
     * Returns the registry used when nothing else is configured.
     *
     * <p>Contains the admonitions, {@code image}, the code directives, the Sphinx directives
     * kept verbatim ({@code toctree}, {@code autoclass}, ...) and the roles {@code class},
     * {@code download}, {@code func}, {@code ref} and {@code superscript}.
     *
     * @return default registry
     */
    public static MarkupRegistry defaults() {
        Map<String, DirectiveType> directives = new LinkedHashMap<>();
        for (NodeKind kind : NodeKind.values()) {
            if (kind.isAdmonition()) {
                directives.put(kind.directiveName(), DirectiveType.ADMONITION);
            }
        }
        directives.put("image", DirectiveType.IMAGE);
        directives.put("code", DirectiveType.CODE);
        directives.put("code-block", DirectiveType.CODE);
        directives.put("sourcecode", DirectiveType.CODE);
        for (String name : new String[] {
            "toctree", "list-table", "contents", "argparse",
            "autoclass", "automodule", "autofunction", "automethod"}) {
            directives.put(name, DirectiveType.OPAQUE);
        }
        return new MarkupRegistry(directives, Set.of("class", "download", "func", "ref", "superscript"));
    }

    /**
     * Returns a registry that also keeps the named directives verbatim.
     *
     * @param names directive names
     * @return extended registry
     */
    public MarkupRegistry withDirectives(Collection<String> names) {
        Map<String, DirectiveType> extended = new LinkedHashMap<>(directives);
        for (String name : names) {
            extended.putIfAbsent(name.toLowerCase(Locale.ROOT), DirectiveType.OPAQUE);
        }
        return new MarkupRegistry(extended, roles);
    }

    /**
     * Returns a registry that also accepts the named roles.
     *
     * @param names role names
     * @return extended registry
     */
    public MarkupRegistry withRoles(Collection<String> names) {
        Set<String> extended = new LinkedHashSet<>(roles);
        for (String name : names) {
            extended.add(name.toLowerCase(Locale.ROOT));
        }
        return new MarkupRegistry(directives, extended);
    }

    /**
     * Looks up a directive.
     *
     * @param name directive name as written
     * @return parsing strategy, or null when the directive is unknown
     */
    public DirectiveType directive(String name) {
        return directives.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the node kind a standard role produces.
     *
     * @param name role name as written
     * @return node kind, or null for roles kept as raw source
     */
    public NodeKind standardRole(String name) {
        return STANDARD_ROLES.get(name.toLowerCase(Locale.ROOT));
    }

    public boolean isKnownRole(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        return STANDARD_ROLES.containsKey(key) || roles.contains(key);
    }
}
