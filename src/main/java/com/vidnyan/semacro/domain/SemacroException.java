package com.vidnyan.semacro.domain;

/**
 * Base type for all errors raised by the macro engine.
 */
public class SemacroException extends RuntimeException {
    
    public SemacroException(String message) {
        super(message);
    }
    
    public SemacroException(String message, Throwable cause) {
        super(message, cause);
    }
}
