package com.gddoc.template;

/**
 * Malformed template: unterminated tag or string, unknown tag, unmatched block opener/closer,
 * or an expression that does not parse.
 */
public class TemplateSyntaxException extends TemplateException {

    public TemplateSyntaxException(String message, SourcePosition position) {
        super(message, position);
    }
}
