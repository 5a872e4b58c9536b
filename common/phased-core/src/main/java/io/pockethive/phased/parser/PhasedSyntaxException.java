package io.pockethive.phased.parser;

import io.pockethive.phased.PhasedTemplateException;

/**
 * Raised for malformed {@code phased} tag arguments.
 */
public class PhasedSyntaxException extends PhasedTemplateException {

    private final int lineNumber;

    public PhasedSyntaxException(String message, int lineNumber) {
        super(message + " (line " + lineNumber + ")");
        this.lineNumber = lineNumber;
    }

    public int lineNumber() {
        return lineNumber;
    }
}
