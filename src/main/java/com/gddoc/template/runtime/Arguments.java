package com.gddoc.template.runtime;

import java.util.List;
import java.util.Map;

import com.gddoc.template.SourcePosition;
import com.gddoc.template.TemplateTypeException;

/**
 * Evaluated call arguments for a filter, test or builtin method, bound against its declared
 * parameter names.
 */
public final class Arguments {

    private final String operation;
    private final List<String> parameterNames;
    private final List<Value> positional;
    private final Map<String, Value> keyword;
    private final SourcePosition position;

    Arguments(String operation, List<String> parameterNames, List<Value> positional,
            Map<String, Value> keyword, SourcePosition position) throws TemplateTypeException {
        this.operation = operation;
        this.parameterNames = parameterNames;
        this.positional = positional;
        this.keyword = keyword;
        this.position = position;
        if (positional.size() > parameterNames.size()) {
            throw new TemplateTypeException(operation, "takes at most " + parameterNames.size()
                    + " argument(s), got " + positional.size(), position);
        }
        for (String name : keyword.keySet()) {
            int index = parameterNames.indexOf(name);
            if (index < 0) {
                throw new TemplateTypeException(operation, "unexpected keyword argument '" + name + "'", position);
            }
            if (index < positional.size()) {
                throw new TemplateTypeException(operation, "got multiple values for argument '" + name + "'",
                        position);
            }
        }
    }

    /**
     * @return the argument bound to {@code name}, or {@code fallback} when not supplied
     */
    public Value get(String name, Value fallback) {
        int index = parameterNames.indexOf(name);
        if (index >= 0 && index < positional.size()) {
            return positional.get(index);
        }
        Value value = keyword.get(name);
        return value != null ? value : fallback;
    }

    public boolean flag(String name) {
        return get(name, BoolValue.FALSE).isTruthy();
    }

    public String text(String name, String fallback) {
        Value value = get(name, Undefined.INSTANCE);
        return value.isNone() ? fallback : value.asText();
    }

    public Value required(String name) throws TemplateTypeException {
        Value value = get(name, null);
        if (value == null) {
            throw new TemplateTypeException(operation, "missing required argument '" + name + "'", position);
        }
        return value;
    }

    public String operation() {
        return operation;
    }

    public SourcePosition position() {
        return position;
    }
}
