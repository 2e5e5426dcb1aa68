package com.gddoc.template.lexer;

import com.gddoc.template.TemplateSyntaxException;

/**
 * Pull-based token source. Returns {@link TokenKind#EOF} forever once the input is exhausted.
 */
public interface TokenStream {

    Token next() throws TemplateSyntaxException;
}
