package com.thesis.tasktree.exception;

/**
 * An input line could not be parsed.
 * 
 * Carries the 1-based line number and the raw line text so the caller
 * can report exactly what was rejected.
 */
public class TreeParseException extends TaskTreeException {

    private final int lineNumber;
    private final String line;

    public TreeParseException(int lineNumber, String line, String reason) {
        super(String.format("line %d: %s (\"%s\")", lineNumber, reason, line));
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public TreeParseException(int lineNumber, String line, String reason, Throwable cause) {
        super(String.format("line %d: %s (\"%s\")", lineNumber, reason, line), cause);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
