package com.vidnyan.semacro.domain.rule;

import java.util.Objects;

/**
 * Any other terminal statement (type_change, typeattribute, role_transition, ...).
 * Passed through verbatim and deduplicated by text.
 */
public record PolicyStatement(String text) implements Rule {
    
    public PolicyStatement {
        Objects.requireNonNull(text, "text");
    }
    
    @Override
    public String render() {
        return text;
    }
}
