package org.wehi.stringnet;

import java.io.IOException;

/**
 * Thrown when a data line of a STRING file can not be parsed.
 * The line number is 1-based and counts the header line.
 */
public class MalformedRecordException extends IOException {

    private final String source;
    private final int lineNumber;

    public MalformedRecordException(String source, int lineNumber, String message) {
        super(source + ", line " + lineNumber + ": " + message);
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public MalformedRecordException(String source, int lineNumber, String message, Throwable cause) {
        this(source, lineNumber, message);
        initCause(cause);
    }

    public String getSource() {
        return source;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
