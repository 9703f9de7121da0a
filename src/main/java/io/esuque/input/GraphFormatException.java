package io.esuque.input;

import java.io.IOException;

/**
 * Graph input that cannot be interpreted, as opposed to input that simply
 * ends early.
 */
public class GraphFormatException extends IOException {
    private final int lineNumber;

    public GraphFormatException(String message, int lineNumber) {
        super(message + " (line " + lineNumber + ")");
        this.lineNumber = lineNumber;
    }

    public GraphFormatException(String message, int lineNumber, Throwable cause) {
        super(message + " (line " + lineNumber + ")", cause);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
