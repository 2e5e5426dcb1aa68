package com.gddoc.maven.script;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An {@code enum} declaration. Values keep declaration order; a value without a {@code ##}
 * comment maps to null.
 */
public class EnumInfo {

    private final String name;
    private final String description;
    private final Map<String, String> values;

    public EnumInfo(String name, String description, Map<String, String> values) {
        this.name = name == null ? "" : name;
        this.description = description;
        this.values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * @return the enum name, empty for an anonymous enum
     */
    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, String> getValues() {
        return values;
    }

    public Map<String, Object> toContext() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("name", name);
        context.put("description", description);
        context.put("vals", new LinkedHashMap<>(values));
        return context;
    }
}
