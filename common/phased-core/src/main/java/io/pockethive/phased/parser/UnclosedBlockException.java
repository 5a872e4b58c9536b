package io.pockethive.phased.parser;

import io.pockethive.phased.PhasedTemplateException;

/**
 * Raised when template source ends before a block tag is closed.
 */
public class UnclosedBlockException extends PhasedTemplateException {

    private final String expectedTag;

    public UnclosedBlockException(String openingTag, String expectedTag) {
        super("Unclosed '" + openingTag + "' tag. Looking for one of: " + expectedTag);
        this.expectedTag = expectedTag;
    }

    public String expectedTag() {
        return expectedTag;
    }
}
