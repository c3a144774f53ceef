package com.abidump.validator.exception;

/**
 * Malformed dump text: unbalanced nesting, unknown target or alias names,
 * misplaced header lines.
 */
public class AbiParseException extends AbiDumpException {

    private static final long serialVersionUID = 1L;
    private final int lineNumber;

    public AbiParseException(String message) {
        super(message);
        this.lineNumber = -1;
    }

    public AbiParseException(int lineNumber, String message) {
        super("Line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    /**
     * 1-based line of the offending input, or -1 when the error is not tied to a line.
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
