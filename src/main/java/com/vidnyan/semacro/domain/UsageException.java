package com.vidnyan.semacro.domain;

/**
 * Invalid combination of query options, rejected before any expansion work starts.
 */
public class UsageException extends SemacroException {
    
    public UsageException(String message) {
        super(message);
    }
}
