package io.pockethive.phased;

/**
 * Base type for failures raised by the phased rendering protocol.
 * <p>
 * Failures of the underlying template engine are reported separately as
 * {@link io.pockethive.phased.templating.TemplateRenderingException}.
 */
public class PhasedTemplateException extends RuntimeException {

    public PhasedTemplateException(String message) {
        super(message);
    }

    public PhasedTemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
