package com.gddoc.template.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Named fields in insertion order. Doubles as the mapping type (e.g. enum values).
 */
public record RecordValue(Map<String, Value> fields) implements Value {

    public RecordValue {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    @Override
    public String kind() {
        return "record";
    }

    // Records are truthy even when empty.
    @Override
    public boolean isTruthy() {
        return true;
    }

    @Override
    public String asText() {
        return fields.entrySet().stream()
                .map(e -> "'" + e.getKey() + "': " + e.getValue().repr())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public Value attribute(String name) {
        Value value = fields.get(name);
        return value != null ? value : Undefined.INSTANCE;
    }
}
