package com.vidnyan.semacro.domain;

/**
 * No usable policy corpus: missing or unreadable include path, or nothing to index.
 * Fatal for the whole run.
 */
public class PolicyLoadException extends SemacroException {
    
    public PolicyLoadException(String message) {
        super(message);
    }
    
    public PolicyLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
