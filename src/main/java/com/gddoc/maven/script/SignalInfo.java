package com.gddoc.maven.script;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@code signal} declaration.
 */
public class SignalInfo {

    private final String name;
    private final String description;
    private final List<ArgInfo> args;

    public SignalInfo(String name, String description, List<ArgInfo> args) {
        this.name = name;
        this.description = description;
        this.args = args == null ? List.of() : List.copyOf(args);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<ArgInfo> getArgs() {
        return args;
    }

    public Map<String, Object> toContext() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("name", name);
        context.put("description", description);
        context.put("args", argsContext(args));
        return context;
    }

    static List<Map<String, Object>> argsContext(List<ArgInfo> args) {
        List<Map<String, Object>> list = new ArrayList<>();
        for (ArgInfo arg : args) {
            list.add(arg.toContext());
        }
        return list;
    }
}
