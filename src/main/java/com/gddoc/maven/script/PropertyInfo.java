package com.gddoc.maven.script;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A member {@code var} declaration.
 */
public class PropertyInfo {

    private final String name;
    private final String type;
    private final String description;
    private final String defaultValue;
    private final boolean hasSetter;
    private final boolean hasGetter;

    public PropertyInfo(String name, String type, String description, String defaultValue,
            boolean hasSetter, boolean hasGetter) {
        this.name = name;
        this.type = type;
        this.description = description;
        this.defaultValue = defaultValue;
        this.hasSetter = hasSetter;
        this.hasGetter = hasGetter;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public boolean hasSetter() {
        return hasSetter;
    }

    public boolean hasGetter() {
        return hasGetter;
    }

    public Map<String, Object> toContext() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("name", name);
        context.put("type", type);
        context.put("description", description);
        context.put("default", defaultValue);
        context.put("has_setter", hasSetter);
        context.put("has_getter", hasGetter);
        return context;
    }
}
