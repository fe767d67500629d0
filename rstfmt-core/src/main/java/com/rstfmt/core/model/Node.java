package com.rstfmt.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Element of a parsed reStructuredText document tree.
 *
 * <p>Nodes are immutable. Children are owned by exactly one parent and their order is
 * significant. Attribute values are strings, integers, booleans, lists, or (for the
 * {@link #TARGET_REF} attribute only) a non-owning reference to a sibling node.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Node paragraph = Node.of(NodeKind.PARAGRAPH, List.of(
 *     Node.text("This is "),
 *     Node.of(NodeKind.STRONG, List.of(Node.text("bold"))),
 *     Node.text(" text.")
 * ));
 * }</pre>
 *
 * @param kind node kind
 * @param attributes attribute map, insertion ordered
 * @param children ordered child nodes
 */
public record Node(
    NodeKind kind,
    Map<String, Object> attributes,
    List<Node> children
) {
    public static final String TEXT = "text";
    public static final String NAMES = "names";
    public static final String REFNAME = "refname";
    public static final String REFURI = "refuri";
    public static final String ANONYMOUS = "anonymous";
    public static final String TARGET_REF = "target";
    public static final String RAWSOURCE = "rawsource";
    public static final String CLASSES = "classes";
    public static final String URI = "uri";
    public static final String COLWIDTH = "colwidth";
    public static final String NAME = "name";
    public static final String ARGUMENTS = "arguments";
    public static final String OPTIONS = "options";
    public static final String CONTENT = "content";
    public static final String LEVEL = "level";
    public static final String MESSAGE = "message";
    public static final String LINE = "line";

    public Node {
        Objects.requireNonNull(kind, "kind must not be null");
        attributes = attributes == null || attributes.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = children != null ? List.copyOf(children) : List.of();
    }

    /**
     * Creates a text leaf.
     *
     * @param text text content
     * @return TEXT node
     */
    public static Node text(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return new Node(NodeKind.TEXT, Map.of(TEXT, text), List.of());
    }

    /**
     * Creates a node without attributes.
     *
     * @param kind node kind
     * @param children child nodes
     * @return new node
     */
    public static Node of(NodeKind kind, List<Node> children) {
        return new Node(kind, Map.of(), children);
    }

    /**
     * Creates a node with attributes.
     *
     * @param kind node kind
     * @param attributes attributes
     * @param children child nodes
     * @return new node
     */
    public static Node of(NodeKind kind, Map<String, Object> attributes, List<Node> children) {
        return new Node(kind, attributes, children);
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }

    /**
     * Returns a string attribute.
     *
     * @param key attribute key
     * @return attribute value, or null when absent
     * @throws IllegalStateException if the value is not a string
     */
    public String stringAttribute(String key) {
        Object value = attributes.get(key);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new IllegalStateException("Attribute '" + key + "' of " + kind.tagName() + " is not a string");
    }

    /**
     * Returns an integer attribute.
     *
     * @param key attribute key
     * @param defaultValue value returned when absent
     * @return attribute value or default
     */
    public int intAttribute(String key, int defaultValue) {
        Object value = attributes.get(key);
        return value instanceof Number number ? number.intValue() : defaultValue;
    }

    /**
     * Returns a boolean attribute; absent means false.
     *
     * @param key attribute key
     * @return attribute value
     */
    public boolean flag(String key) {
        return Boolean.TRUE.equals(attributes.get(key));
    }

    /**
     * Returns a list attribute with elements of the given type.
     *
     * @param key attribute key
     * @param elementType expected element type
     * @param <T> element type
     * @return list value, empty when absent
     */
    public <T> List<T> listAttribute(String key, Class<T> elementType) {
        Object value = attributes.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalStateException("Attribute '" + key + "' of " + kind.tagName() + " is not a list");
        }
        List<T> result = new ArrayList<>(list.size());
        for (Object element : list) {
            result.add(elementType.cast(element));
        }
        return result;
    }

    /**
     * Returns the text of a TEXT node, or the concatenated text of all descendants.
     *
     * @return plain text content
     */
    public String astext() {
        if (kind == NodeKind.TEXT) {
            return stringAttribute(TEXT);
        }
        StringBuilder sb = new StringBuilder();
        for (Node child : children) {
            sb.append(child.astext());
        }
        return sb.toString();
    }

    /**
     * Returns a copy with one attribute added or replaced.
     *
     * @param key attribute key
     * @param value attribute value
     * @return new node
     */
    public Node withAttribute(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.put(key, value);
        return new Node(kind, copy, children);
    }

    /**
     * Returns a copy with different children.
     *
     * @param newChildren replacement children
     * @return new node
     */
    public Node withChildren(List<Node> newChildren) {
        return new Node(kind, attributes, newChildren);
    }

    @Override
    public String toString() {
        if (kind == NodeKind.TEXT) {
            return "Node{text=" + stringAttribute(TEXT) + "}";
        }
        return "Node{" + kind.tagName() + ", children=" + children.size() + "}";
    }
}
