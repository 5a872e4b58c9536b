package io.pockethive.phased.snapshot;

import io.pockethive.phased.PhasedTemplateException;

/**
 * Raised when a captured value cannot be converted into serializable form.
 */
public class SnapshotSerializationException extends PhasedTemplateException {

    public SnapshotSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
