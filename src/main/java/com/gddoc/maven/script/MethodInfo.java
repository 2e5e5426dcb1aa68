package com.gddoc.maven.script;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@code func} declaration.
 */
public class MethodInfo {

    private final String name;
    private final String description;
    private final List<ArgInfo> args;
    private final String returnType;

    public MethodInfo(String name, String description, List<ArgInfo> args, String returnType) {
        this.name = name;
        this.description = description;
        this.args = args == null ? List.of() : List.copyOf(args);
        this.returnType = returnType;
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

    public String getReturnType() {
        return returnType;
    }

    /**
     * The return type is exposed both as {@code return_type} and as {@code type}.
     */
    public Map<String, Object> toContext() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("name", name);
        context.put("description", description);
        context.put("args", SignalInfo.argsContext(args));
        context.put("return_type", returnType);
        context.put("type", returnType);
        return context;
    }
}
