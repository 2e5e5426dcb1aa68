package com.gddoc.template.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.gddoc.template.SourcePosition;
import com.gddoc.template.TemplateException;
import com.gddoc.template.TemplateTypeException;
import com.gddoc.template.UnknownMacroException;
import com.gddoc.template.ast.Expr;

/**
 * Evaluates {@link Expr} trees against a {@link Scope}.
 * <p>
 * Missing names, fields and indexes evaluate to {@link Undefined}; attribute access on undefined
 * stays undefined. Type errors are reserved for filters and operators applied to the wrong kind.
 */
public class ExpressionEvaluator {

    private final MacroInvoker macros;

    public ExpressionEvaluator(MacroInvoker macros) {
        this.macros = macros;
    }

    public boolean isTrue(Expr expr, Scope scope) throws TemplateException {
        return evaluate(expr, scope).isTruthy();
    }

    public Value evaluate(Expr expr, Scope scope) throws TemplateException {
        if (expr instanceof Expr.Literal) {
            return Value.of(((Expr.Literal) expr).value());
        }
        if (expr instanceof Expr.Var) {
            return scope.lookup(((Expr.Var) expr).name());
        }
        if (expr instanceof Expr.Attribute) {
            return attribute((Expr.Attribute) expr, scope);
        }
        if (expr instanceof Expr.Item) {
            Expr.Item item = (Expr.Item) expr;
            return item(evaluate(item.base(), scope), evaluate(item.key(), scope));
        }
        if (expr instanceof Expr.FilterApply) {
            Expr.FilterApply filter = (Expr.FilterApply) expr;
            Value input = evaluate(filter.base(), scope);
            return Filters.apply(filter.filter(), input, evaluateAll(filter.args(), scope),
                    evaluateAll(filter.kwargs(), scope), filter.position());
        }
        if (expr instanceof Expr.IsTest) {
            Expr.IsTest test = (Expr.IsTest) expr;
            boolean result = Tests.apply(test.test(), evaluate(test.base(), scope),
                    evaluateAll(test.args(), scope), test.position());
            return BoolValue.of(result != test.negated());
        }
        if (expr instanceof Expr.Compare) {
            return compare((Expr.Compare) expr, scope);
        }
        if (expr instanceof Expr.Binary) {
            Expr.Binary binary = (Expr.Binary) expr;
            return Operators.binary(binary.op(), evaluate(binary.left(), scope), evaluate(binary.right(), scope),
                    binary.position());
        }
        if (expr instanceof Expr.Logical) {
            Expr.Logical logical = (Expr.Logical) expr;
            Value left = evaluate(logical.left(), scope);
            if ("and".equals(logical.op())) {
                return left.isTruthy() ? evaluate(logical.right(), scope) : left;
            }
            return left.isTruthy() ? left : evaluate(logical.right(), scope);
        }
        if (expr instanceof Expr.Not) {
            return BoolValue.of(!isTrue(((Expr.Not) expr).operand(), scope));
        }
        if (expr instanceof Expr.Negate) {
            Expr.Negate negate = (Expr.Negate) expr;
            return Operators.negate(evaluate(negate.operand(), scope), negate.position());
        }
        if (expr instanceof Expr.Conditional) {
            Expr.Conditional conditional = (Expr.Conditional) expr;
            if (isTrue(conditional.condition(), scope)) {
                return evaluate(conditional.then(), scope);
            }
            return conditional.otherwise() == null
                    ? Undefined.INSTANCE
                    : evaluate(conditional.otherwise(), scope);
        }
        if (expr instanceof Expr.ListLiteral) {
            return new ListValue(evaluateAll(((Expr.ListLiteral) expr).items(), scope));
        }
        if (expr instanceof Expr.Call) {
            return call((Expr.Call) expr, scope);
        }
        throw new IllegalStateException("Unhandled expression: " + expr);
    }

    private Value attribute(Expr.Attribute attribute, Scope scope) throws TemplateException {
        Value base = evaluate(attribute.base(), scope);
        if ((base instanceof ListValue || base instanceof StringValue) && Filters.isAttributeFilter(attribute.name())) {
            return Filters.apply(attribute.name(), base, List.of(), Map.of(), attribute.position());
        }
        return Values.path(base, attribute.name());
    }

    private static Value item(Value base, Value key) {
        if (base instanceof ListValue && key instanceof NumberValue && ((NumberValue) key).isIntegral()) {
            return Values.index((ListValue) base, ((NumberValue) key).longValue());
        }
        if (base instanceof RecordValue && key instanceof StringValue) {
            return base.attribute(((StringValue) key).value());
        }
        return Undefined.INSTANCE;
    }

    private Value compare(Expr.Compare compare, Scope scope) throws TemplateException {
        Value left = evaluate(compare.left(), scope);
        Value right = evaluate(compare.right(), scope);
        SourcePosition position = compare.position();
        boolean result = switch (compare.op()) {
            case "==" -> Values.equal(left, right);
            case "!=" -> !Values.equal(left, right);
            case "<" -> Values.compareOrdered(left, right, "<", position) < 0;
            case "<=" -> Values.compareOrdered(left, right, "<=", position) <= 0;
            case ">" -> Values.compareOrdered(left, right, ">", position) > 0;
            case ">=" -> Values.compareOrdered(left, right, ">=", position) >= 0;
            case "in" -> Operators.contains(right, left, "in", position);
            case "not in" -> !Operators.contains(right, left, "not in", position);
            default -> throw new TemplateTypeException(compare.op(), "unknown comparison", position);
        };
        return BoolValue.of(result);
    }

    private Value call(Expr.Call call, Scope scope) throws TemplateException {
        Expr callee = call.callee();
        if (callee instanceof Expr.Var) {
            String name = ((Expr.Var) callee).name();
            if (!macros.hasMacro(name)) {
                throw new UnknownMacroException(name, call.position());
            }
            return macros.callMacro(name, evaluateAll(call.args(), scope), evaluateAll(call.kwargs(), scope),
                    call.position());
        }
        if (callee instanceof Expr.Attribute) {
            Expr.Attribute method = (Expr.Attribute) callee;
            Value target = evaluate(method.base(), scope);
            return BuiltinMethods.invoke(target, method.name(), evaluateAll(call.args(), scope),
                    evaluateAll(call.kwargs(), scope), call.position());
        }
        throw new TemplateTypeException("call", "expression is not callable", call.position());
    }

    private List<Value> evaluateAll(List<Expr> exprs, Scope scope) throws TemplateException {
        List<Value> values = new ArrayList<>(exprs.size());
        for (Expr expr : exprs) {
            values.add(evaluate(expr, scope));
        }
        return values;
    }

    private Map<String, Value> evaluateAll(Map<String, Expr> exprs, Scope scope) throws TemplateException {
        Map<String, Value> values = new LinkedHashMap<>();
        for (Map.Entry<String, Expr> entry : exprs.entrySet()) {
            values.put(entry.getKey(), evaluate(entry.getValue(), scope));
        }
        return values;
    }
}
