package com.gddoc.template;

/**
 * Whitespace handling applied while lexing a template.
 *
 * @param trimBlocks   drop the first newline after a statement or comment tag
 * @param lstripBlocks drop spaces and tabs between the start of a line and a statement or comment tag
 */
public record TemplateOptions(boolean trimBlocks, boolean lstripBlocks) {

    /** The settings the class reference templates are written against. */
    public static final TemplateOptions DEFAULTS = new TemplateOptions(true, true);

    /** Emits text exactly as written apart from explicit trim markers. */
    public static final TemplateOptions VERBATIM = new TemplateOptions(false, false);

    public TemplateOptions withTrimBlocks(boolean value) {
        return new TemplateOptions(value, lstripBlocks);
    }

    public TemplateOptions withLstripBlocks(boolean value) {
        return new TemplateOptions(trimBlocks, value);
    }
}
