package com.gddoc.template.runtime;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.gddoc.template.SourcePosition;
import com.gddoc.template.TemplateException;
import com.gddoc.template.TemplateTypeException;
import com.gddoc.template.UnknownMacroException;
import com.gddoc.template.ast.Expr;
import com.gddoc.template.ast.MacroParam;
import com.gddoc.template.ast.Node;

/**
 * Walks a parsed template depth-first and accumulates its output.
 * <p>
 * One instance serves exactly one render: it owns the macro table, which is filled as
 * {@code macro} definitions are reached and stays visible for the rest of the render.
 */
public class Renderer implements MacroInvoker {

    static final int MAX_MACRO_DEPTH = 500;

    private final Map<String, Macro> macros = new HashMap<>();
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator(this);
    private int macroDepth;

    public String render(List<Node> nodes, Scope scope) throws TemplateException {
        StringBuilder out = new StringBuilder();
        renderBlock(nodes, scope, out);
        return out.toString();
    }

    private void renderBlock(List<Node> nodes, Scope scope, StringBuilder out) throws TemplateException {
        for (Node node : nodes) {
            renderNode(node, scope, out);
        }
    }

    private void renderNode(Node node, Scope scope, StringBuilder out) throws TemplateException {
        if (node instanceof Node.Text) {
            out.append(((Node.Text) node).text());
        } else if (node instanceof Node.Output) {
            Node.Output output = (Node.Output) node;
            out.append(evaluator.evaluate(output.expr(), scope).asText());
        } else if (node instanceof Node.If) {
            Node.If branch = (Node.If) node;
            renderBlock(evaluator.isTrue(branch.condition(), scope) ? branch.thenBody() : branch.elseBody(),
                    scope, out);
        } else if (node instanceof Node.For) {
            renderFor((Node.For) node, scope, out);
        } else if (node instanceof Node.MacroDef) {
            Node.MacroDef def = (Node.MacroDef) node;
            macros.put(def.name(), new Macro(def.name(), def.params(), def.body(), scope));
        } else if (node instanceof Node.MacroCall) {
            Node.MacroCall call = (Node.MacroCall) node;
            List<Value> args = new ArrayList<>();
            for (Expr arg : call.args()) {
                args.add(evaluator.evaluate(arg, scope));
            }
            Map<String, Value> kwargs = new LinkedHashMap<>();
            for (Map.Entry<String, Expr> entry : call.kwargs().entrySet()) {
                kwargs.put(entry.getKey(), evaluator.evaluate(entry.getValue(), scope));
            }
            out.append(callMacro(call.name(), args, kwargs, call.position()).asText());
        } else if (node instanceof Node.Set) {
            Node.Set set = (Node.Set) node;
            scope.define(set.name(), evaluator.evaluate(set.value(), scope));
        } else {
            throw new IllegalStateException("Unhandled node: " + node);
        }
    }

    private void renderFor(Node.For loop, Scope scope, StringBuilder out) throws TemplateException {
        Value iterable = evaluator.evaluate(loop.iterable(), scope);
        List<Value> items = Values.iterate(iterable, "for", loop.position());
        if (items.isEmpty()) {
            renderBlock(loop.elseBody(), scope, out);
            return;
        }
        int length = items.size();
        for (int i = 0; i < length; i++) {
            Scope iteration = scope.child();
            bindTargets(loop, items.get(i), iteration);
            iteration.define("loop", loopRecord(i, length));
            renderBlock(loop.body(), iteration, out);
        }
    }

    private static void bindTargets(Node.For loop, Value item, Scope scope) throws TemplateTypeException {
        List<String> targets = loop.targets();
        if (targets.size() == 1) {
            scope.define(targets.get(0), item);
            return;
        }
        if (!(item instanceof ListValue) || ((ListValue) item).items().size() != targets.size()) {
            throw new TemplateTypeException("for", "cannot unpack " + item.kind() + " into "
                    + targets.size() + " names", loop.position());
        }
        List<Value> parts = ((ListValue) item).items();
        for (int i = 0; i < targets.size(); i++) {
            scope.define(targets.get(i), parts.get(i));
        }
    }

    private static Value loopRecord(int index0, int length) {
        Map<String, Value> fields = new LinkedHashMap<>();
        fields.put("index", new NumberValue(index0 + 1));
        fields.put("index0", new NumberValue(index0));
        fields.put("revindex", new NumberValue(length - index0));
        fields.put("revindex0", new NumberValue(length - index0 - 1));
        fields.put("first", BoolValue.of(index0 == 0));
        fields.put("last", BoolValue.of(index0 == length - 1));
        fields.put("length", new NumberValue(length));
        return new RecordValue(fields);
    }

    @Override
    public boolean hasMacro(String name) {
        return macros.containsKey(name);
    }

    /**
     * Binds arguments against the macro's parameters: positional first, then keywords, then the
     * parameter default, else undefined. The body runs in a child of the defining scope.
     */
    @Override
    public Value callMacro(String name, List<Value> args, Map<String, Value> kwargs, SourcePosition position)
            throws TemplateException {
        Macro macro = macros.get(name);
        if (macro == null) {
            throw new UnknownMacroException(name, position);
        }
        List<MacroParam> params = macro.params();
        if (args.size() > params.size()) {
            throw new TemplateTypeException(name, "macro takes not more than " + params.size()
                    + " argument(s), got " + args.size(), position);
        }
        for (String keyword : kwargs.keySet()) {
            int index = indexOf(params, keyword);
            if (index < 0) {
                throw new TemplateTypeException(name, "macro has no parameter '" + keyword + "'", position);
            }
            if (index < args.size()) {
                throw new TemplateTypeException(name, "macro got multiple values for '" + keyword + "'", position);
            }
        }

        Scope local = macro.definingScope().child();
        for (int i = 0; i < params.size(); i++) {
            MacroParam param = params.get(i);
            Value value;
            if (i < args.size()) {
                value = args.get(i);
            } else if (kwargs.containsKey(param.name())) {
                value = kwargs.get(param.name());
            } else if (param.defaultValue() != null) {
                value = evaluator.evaluate(param.defaultValue(), local);
            } else {
                value = Undefined.INSTANCE;
            }
            local.define(param.name(), value);
        }

        if (macroDepth >= MAX_MACRO_DEPTH) {
            throw new TemplateTypeException(name, "maximum macro recursion depth exceeded", position);
        }
        StringBuilder body = new StringBuilder();
        macroDepth++;
        try {
            renderBlock(macro.body(), local, body);
        } finally {
            macroDepth--;
        }
        return new StringValue(body.toString());
    }

    private static int indexOf(List<MacroParam> params, String name) {
        for (int i = 0; i < params.size(); i++) {
            if (params.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }
}
