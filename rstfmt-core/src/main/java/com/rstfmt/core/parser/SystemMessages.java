package com.rstfmt.core.parser;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.rstfmt.core.model.Node;
import com.rstfmt.core.model.NodeKind;

/**
 * Factory for diagnostic nodes recorded while parsing.
 */
final class SystemMessages {

    static final int INFO = 1;
    static final int WARNING = 2;
    static final int ERROR = 3;

    private SystemMessages() {
    }

    static Node create(int level, String message, int line) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(Node.LEVEL, level);
        attributes.put(Node.MESSAGE, message);
        attributes.put(Node.LINE, line);
        return Node.of(NodeKind.SYSTEM_MESSAGE, attributes, List.of());
    }
}
