package com.gddoc.template;

/**
 * A call expression named a macro that has not been defined at the point of the call.
 */
public class UnknownMacroException extends TemplateException {

    private final String macroName;

    public UnknownMacroException(String macroName, SourcePosition position) {
        super("Unknown macro '" + macroName + "'", position);
        this.macroName = macroName;
    }

    public String getMacroName() {
        return macroName;
    }
}
