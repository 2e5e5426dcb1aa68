package com.gddoc.template.lexer;

/**
 * Kinds of tokens produced by {@link Lexer}.
 */
public enum TokenKind {
    TEXT,        // literal run outside any tag
    EXPR_START,  // {{
    EXPR_END,    // }}
    STMT_START,  // {%
    STMT_END,    // %}
    TRIM_LEFT,   // '-' right after an opening delimiter
    TRIM_RIGHT,  // '-' right before a closing delimiter
    NAME,
    STRING,
    NUMBER,
    OPERATOR,
    EOF
}
