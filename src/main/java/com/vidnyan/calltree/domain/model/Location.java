package com.vidnyan.calltree.domain.model;

/**
 * Source code location of a function definition.
 */
public record Location(
    String filePath,
    int startLine,
    int endLine
) {

    /**
     * Create a location covering a single line.
     */
    public static Location at(String filePath, int line) {
        return new Location(filePath, line, line);
    }

    /**
     * Format as readable string.
     */
    public String format() {
        if (startLine == endLine) {
            return filePath + ":" + startLine;
        }
        return filePath + ":" + startLine + "-" + endLine;
    }
}
