package com.gddoc.template.runtime;

import java.util.Objects;

public record StringValue(String value) implements Value {

    public static final StringValue EMPTY = new StringValue("");

    public StringValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String kind() {
        return "string";
    }

    @Override
    public boolean isTruthy() {
        return !value.isEmpty();
    }

    @Override
    public String asText() {
        return value;
    }

    @Override
    public String repr() {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
