package com.vidnyan.semacro.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The keyword that introduced a macro definition.
 */
public enum MacroKind {
    INTERFACE("interface"),
    TEMPLATE("template"),
    DEFINE("define");
    
    private final String keyword;
    
    MacroKind(String keyword) {
        this.keyword = keyword;
    }
    
    public String keyword() {
        return keyword;
    }
    
    /**
     * Single-letter tag used in listings: [i], [t], [d].
     */
    public String tag() {
        return "[" + keyword.charAt(0) + "]";
    }
    
    public static Optional<MacroKind> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        return switch (keyword.toLowerCase(Locale.ROOT)) {
            case "interface" -> Optional.of(INTERFACE);
            case "template" -> Optional.of(TEMPLATE);
            case "define" -> Optional.of(DEFINE);
            default -> Optional.empty();
        };
    }
}
