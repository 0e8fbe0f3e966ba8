package com.vidnyan.semacro.parser;

import com.vidnyan.semacro.domain.SemacroException;

/**
 * A macro call string with unbalanced parentheses or quotes.
 */
public class CallParseException extends SemacroException {
    
    private final String input;
    
    public CallParseException(String input, String message) {
        super(message + ": " + input);
        this.input = input;
    }
    
    public String getInput() {
        return input;
    }
}
