package com.gddoc.template;

/**
 * Base type for every failure raised while compiling or rendering a template.
 * <p>
 * All subtypes are fatal for the current compile/render call; a failed render never
 * returns partial output.
 */
public abstract class TemplateException extends Exception {

    private final SourcePosition position;

    protected TemplateException(String message, SourcePosition position) {
        super(message + " (" + (position != null ? position : SourcePosition.UNKNOWN) + ")");
        this.position = position != null ? position : SourcePosition.UNKNOWN;
    }

    public SourcePosition getPosition() {
        return position;
    }
}
