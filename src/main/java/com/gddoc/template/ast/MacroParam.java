package com.gddoc.template.ast;

/**
 * One declared macro parameter: {@code name}, {@code name: type} or {@code name = default}.
 * The type is informational only; the default (may be null) is evaluated at call time.
 */
public record MacroParam(String name, String type, Expr defaultValue) {
}
