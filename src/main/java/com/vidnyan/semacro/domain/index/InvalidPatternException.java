package com.vidnyan.semacro.domain.index;

import com.vidnyan.semacro.domain.SemacroException;

import java.util.regex.PatternSyntaxException;

/**
 * A search pattern that is not a valid regular expression.
 */
public class InvalidPatternException extends SemacroException {
    
    private final String pattern;
    
    public InvalidPatternException(String pattern, PatternSyntaxException cause) {
        super("invalid regex '" + pattern + "': " + cause.getDescription(), cause);
        this.pattern = pattern;
    }
    
    public String getPattern() {
        return pattern;
    }
}
