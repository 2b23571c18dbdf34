package org.wehi.stringnet;

import java.io.IOException;

/**
 * Thrown when the header of a STRING file matches none of the known record types
 */
public class UnrecognisedFormatException extends IOException {

    private final String header;

    public UnrecognisedFormatException(String source, String header) {
        super("Parse error: unexpected file header in " + source + ": \"" + header + "\"");
        this.header = header;
    }

    public String getHeader() {
        return header;
    }
}
