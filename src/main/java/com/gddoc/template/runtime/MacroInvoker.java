package com.gddoc.template.runtime;

import java.util.List;
import java.util.Map;

import com.gddoc.template.SourcePosition;
import com.gddoc.template.TemplateException;

/**
 * Expands macros registered in the current render.
 */
public interface MacroInvoker {

    boolean hasMacro(String name);

    /**
     * @return the rendered macro body as a string value
     */
    Value callMacro(String name, List<Value> args, Map<String, Value> kwargs, SourcePosition position)
            throws TemplateException;
}
