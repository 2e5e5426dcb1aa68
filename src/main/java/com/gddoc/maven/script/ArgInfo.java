package com.gddoc.maven.script;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One argument of a signal or method signature.
 */
public class ArgInfo {

    private final String name;
    private final String type;
    private final String defaultValue;

    public ArgInfo(String name, String type, String defaultValue) {
        this.name = name == null ? "" : name.trim();
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    /**
     * @return declared type, or null when untyped or inferred with {@code :=}
     */
    public String getType() {
        return type;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public Map<String, Object> toContext() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("name", name);
        context.put("type", type);
        context.put("default", defaultValue);
        return context;
    }

    @Override
    public String toString() {
        return name + (type != null ? ": " + type : "") + (defaultValue != null ? " = " + defaultValue : "");
    }
}
