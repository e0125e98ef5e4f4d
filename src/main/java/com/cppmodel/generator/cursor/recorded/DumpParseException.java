package com.cppmodel.generator.cursor.recorded;

/**
 * A malformed entry in a recorded cursor dump.
 */
public class DumpParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final int line;

    public DumpParseException(String message, int line) {
        super(message + " at line " + line);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
