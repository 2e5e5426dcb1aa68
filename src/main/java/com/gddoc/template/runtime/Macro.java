package com.gddoc.template.runtime;

import java.util.List;

import com.gddoc.template.ast.MacroParam;
import com.gddoc.template.ast.Node;

/**
 * A macro registered during a render. Its body runs in a child of {@code definingScope}.
 */
public record Macro(String name, List<MacroParam> params, List<Node> body, Scope definingScope) {
}
