package com.gddoc.template;

/**
 * A 1-based line/column location inside template source.
 */
public record SourcePosition(int line, int column) {

    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
