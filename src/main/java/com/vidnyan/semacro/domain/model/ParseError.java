package com.vidnyan.semacro.domain.model;

/**
 * A definition that could not be parsed. Recorded while loading, never fatal.
 */
public record ParseError(
    String sourcePath,
    int lineNumber,
    String message
) {
    
    public String format() {
        return sourcePath + ":" + lineNumber + ": " + message;
    }
}
