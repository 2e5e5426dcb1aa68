package com.gddoc.template.runtime;

public record BoolValue(boolean value) implements Value {

    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);

    public static BoolValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public String kind() {
        return "bool";
    }

    @Override
    public boolean isTruthy() {
        return value;
    }

    @Override
    public String asText() {
        return value ? "True" : "False";
    }
}
