package io.pockethive.phased.templating;

/**
 * Raised when Pebble cannot parse or evaluate a template.
 * <p>
 * In the first pass this aborts the page. The literal of a phased block is only parsed when the
 * second pass renders it, so an error inside a deferred block surfaces from
 * {@link io.pockethive.phased.marker.SecondPassResolver#resolve} instead. Protocol failures raised
 * inside Pebble are not wrapped; they propagate as their own {@code PhasedTemplateException}.
 */
public final class TemplateRenderingException extends RuntimeException {

    public TemplateRenderingException(String message) {
        super(message);
    }

    public TemplateRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
