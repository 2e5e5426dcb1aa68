package com.gddoc.template;

/**
 * A filter, test, method or operator was applied to a value of an incompatible kind.
 */
public class TemplateTypeException extends TemplateException {

    private final String operation;

    public TemplateTypeException(String operation, String message, SourcePosition position) {
        super("'" + operation + "': " + message, position);
        this.operation = operation;
    }

    /**
     * @return the filter, test or operator name that failed
     */
    public String getOperation() {
        return operation;
    }
}
