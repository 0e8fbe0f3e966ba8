package com.vidnyan.semacro.domain.graph;

import java.util.Locale;
import java.util.Optional;

/**
 * Textual graph description formats.
 */
public enum GraphFormat {
    DOT,
    MERMAID;

    public static Optional<GraphFormat> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "dot", "graphviz" -> Optional.of(DOT);
            case "mermaid", "mmd" -> Optional.of(MERMAID);
            default -> Optional.empty();
        };
    }
}
