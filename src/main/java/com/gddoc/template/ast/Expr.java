package com.gddoc.template.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.gddoc.template.SourcePosition;

/**
 * Expression tree evaluated against a scope. Every variant is immutable.
 */
public sealed interface Expr {

    SourcePosition position();

    /**
     * A constant: {@code String}, {@code Long}, {@code Double}, {@code Boolean} or {@code null} for none.
     */
    record Literal(Object value, SourcePosition position) implements Expr {
    }

    record ListLiteral(List<Expr> items, SourcePosition position) implements Expr {
        public ListLiteral {
            items = List.copyOf(items);
        }
    }

    record Var(String name, SourcePosition position) implements Expr {
        public Var {
            Objects.requireNonNull(name, "name");
        }
    }

    /** {@code base.name} */
    record Attribute(Expr base, String name, SourcePosition position) implements Expr {
    }

    /** {@code base[key]} */
    record Item(Expr base, Expr key, SourcePosition position) implements Expr {
    }

    /** {@code callee(args)}: a macro call when the callee is a bare name, a builtin method otherwise. */
    record Call(Expr callee, List<Expr> args, Map<String, Expr> kwargs, SourcePosition position) implements Expr {
        public Call {
            args = List.copyOf(args);
            kwargs = immutableOrdered(kwargs);
        }
    }

    /** {@code base | filter(args)} */
    record FilterApply(Expr base, String filter, List<Expr> args, Map<String, Expr> kwargs,
            SourcePosition position) implements Expr {
        public FilterApply {
            args = List.copyOf(args);
            kwargs = immutableOrdered(kwargs);
        }
    }

    /** {@code base is [not] test} */
    record IsTest(Expr base, String test, boolean negated, List<Expr> args, SourcePosition position)
            implements Expr {
        public IsTest {
            args = List.copyOf(args);
        }
    }

    /** {@code ==, !=, <, <=, >, >=, in, not in} */
    record Compare(String op, Expr left, Expr right, SourcePosition position) implements Expr {
    }

    /** {@code + - * / // % ~} */
    record Binary(String op, Expr left, Expr right, SourcePosition position) implements Expr {
    }

    /** {@code and} / {@code or}, short-circuiting. */
    record Logical(String op, Expr left, Expr right, SourcePosition position) implements Expr {
    }

    record Not(Expr operand, SourcePosition position) implements Expr {
    }

    record Negate(Expr operand, SourcePosition position) implements Expr {
    }

    /** {@code then if condition else otherwise}; {@code otherwise} may be null. */
    record Conditional(Expr condition, Expr then, Expr otherwise, SourcePosition position) implements Expr {
    }

    private static <V> Map<String, V> immutableOrdered(Map<String, V> map) {
        return map == null || map.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
