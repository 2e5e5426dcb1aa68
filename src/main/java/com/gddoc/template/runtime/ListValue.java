package com.gddoc.template.runtime;

import java.util.List;
import java.util.stream.Collectors;

public record ListValue(List<Value> items) implements Value {

    public ListValue {
        items = List.copyOf(items);
    }

    @Override
    public String kind() {
        return "list";
    }

    @Override
    public boolean isTruthy() {
        return !items.isEmpty();
    }

    @Override
    public String asText() {
        return items.stream().map(Value::repr).collect(Collectors.joining(", ", "[", "]"));
    }
}
