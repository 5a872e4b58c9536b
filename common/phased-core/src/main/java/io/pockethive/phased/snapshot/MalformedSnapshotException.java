package io.pockethive.phased.snapshot;

import io.pockethive.phased.PhasedTemplateException;

/**
 * Raised when the snapshot section of a marker cannot be decoded.
 * <p>
 * During second-pass resolution the failing markers are left untouched while all other markers
 * are still resolved; the exception then carries the partially resolved text.
 */
public class MalformedSnapshotException extends PhasedTemplateException {

    private final String partialResult;
    private final int failureCount;

    public MalformedSnapshotException(String message, Throwable cause) {
        super(message, cause);
        this.partialResult = null;
        this.failureCount = 1;
    }

    public MalformedSnapshotException(String partialResult, int failureCount, Throwable firstFailure) {
        super(failureCount + " phased marker(s) carried an unreadable snapshot", firstFailure);
        this.partialResult = partialResult;
        this.failureCount = failureCount;
    }

    /**
     * Text with every readable marker resolved, or {@code null} when raised by the codec itself.
     */
    public String partialResult() {
        return partialResult;
    }

    public int failureCount() {
        return failureCount;
    }
}
