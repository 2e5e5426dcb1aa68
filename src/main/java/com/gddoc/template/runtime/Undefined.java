package com.gddoc.template.runtime;

/**
 * Result of looking up a missing name, field or index. Falsy, equal to none, empty when output.
 */
public enum Undefined implements Value {
    INSTANCE;

    @Override
    public String kind() {
        return "undefined";
    }

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public String asText() {
        return "";
    }

    @Override
    public boolean isNone() {
        return true;
    }
}
