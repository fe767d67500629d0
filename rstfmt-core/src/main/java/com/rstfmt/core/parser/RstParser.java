package com.rstfmt.core.parser;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rstfmt.core.model.Node;

/**
 * Parses reStructuredText source into a document tree.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * RstParser parser = new RstParser();
 * Node document = parser.parse("Title\n=====\n\nSome *text*.\n");
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class RstParser {

    private static final Logger log = LoggerFactory.getLogger(RstParser.class);

    private final MarkupRegistry registry;
    private final TreePreprocessor preprocessor = new TreePreprocessor();

    public RstParser() {
        this(MarkupRegistry.defaults());
    }

    public RstParser(MarkupRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Parses and preprocesses a document: diagnostics are logged and dropped, references
     * are linked to their inline targets.
     *
     * @param source document source
     * @return document tree ready for formatting
     * @throws RstParseException if the document structure is invalid
     */
    public Node parse(String source) {
        return preprocessor.process(parseRaw(source));
    }

    /**
     * Parses a document without preprocessing; diagnostics stay in the tree as
     * {@code system_message} nodes.
     *
     * @param source document source
     * @return raw document tree
     * @throws RstParseException if the document structure is invalid
     */
    public Node parseRaw(String source) {
        Objects.requireNonNull(source, "source must not be null");
        log.debug("Parsing {} characters", source.length());
        return new BlockParser(registry).parseDocument(source);
    }

    public MarkupRegistry registry() {
        return registry;
    }
}
