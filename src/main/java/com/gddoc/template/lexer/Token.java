package com.gddoc.template.lexer;

import com.gddoc.template.SourcePosition;

/**
 * A single lexical token. For {@link TokenKind#STRING} the text is the decoded literal value.
 */
public record Token(TokenKind kind, String text, SourcePosition position) {

    public boolean is(TokenKind kind, String text) {
        return this.kind == kind && this.text.equals(text);
    }

    public boolean isName(String name) {
        return is(TokenKind.NAME, name);
    }

    public boolean isOperator(String op) {
        return is(TokenKind.OPERATOR, op);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + position;
    }
}
