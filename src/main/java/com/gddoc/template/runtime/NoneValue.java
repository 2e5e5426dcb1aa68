package com.gddoc.template.runtime;

/**
 * The explicit "no value" marker.
 */
public enum NoneValue implements Value {
    INSTANCE;

    @Override
    public String kind() {
        return "none";
    }

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public String asText() {
        return "None";
    }

    @Override
    public boolean isNone() {
        return true;
    }
}
