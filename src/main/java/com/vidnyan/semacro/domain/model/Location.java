package com.vidnyan.semacro.domain.model;

/**
 * Source location of a macro definition.
 */
public record Location(
    String filePath,
    int line
) {
    
    /**
     * Create a location for a file and line.
     */
    public static Location at(String filePath, int line) {
        return new Location(filePath, line);
    }
    
    /**
     * Format as readable string.
     */
    public String format() {
        return filePath + ":" + line;
    }
}
