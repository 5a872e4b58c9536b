package io.pockethive.phased.context;

import io.pockethive.phased.PhasedTemplateException;

/**
 * Raised when a variable requested by a phased block cannot be resolved in the rendering
 * context. Aborts the render of the enclosing template.
 */
public class UnknownVariableException extends PhasedTemplateException {

    private final String variableName;

    public UnknownVariableException(String variableName) {
        super("\"phased\" tag got an unknown variable: '" + variableName + "'");
        this.variableName = variableName;
    }

    public String variableName() {
        return variableName;
    }
}
