package com.vidnyan.semacro.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * A macro invocation: name plus ordered argument strings.
 * Created per query, never persisted.
 */
public record MacroCall(
    String name,
    List<String> arguments
) {
    
    public MacroCall {
        Objects.requireNonNull(name, "name");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }
    
    public static MacroCall of(String name, String... arguments) {
        return new MacroCall(name, List.of(arguments));
    }
    
    public boolean hasArguments() {
        return !arguments.isEmpty();
    }
    
    /**
     * Format as {@code name(a, b)}, or just the name when there are no arguments.
     */
    public String format() {
        return arguments.isEmpty() ? name : name + "(" + String.join(", ", arguments) + ")";
    }
}
