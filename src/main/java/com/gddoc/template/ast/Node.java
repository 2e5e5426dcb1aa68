package com.gddoc.template.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.gddoc.template.SourcePosition;

/**
 * Statement-level template tree. A block is an ordered {@code List<Node>}; order is output order.
 */
public sealed interface Node {

    record Text(String text) implements Node {
    }

    /** {@code {{ expr }}} */
    record Output(Expr expr, SourcePosition position) implements Node {
    }

    /** {@code elif} chains are nested {@code If} nodes in {@code elseBody}. */
    record If(Expr condition, List<Node> thenBody, List<Node> elseBody, SourcePosition position) implements Node {
        public If {
            thenBody = List.copyOf(thenBody);
            elseBody = List.copyOf(elseBody);
        }
    }

    /** {@code for a[, b] in iterable}; {@code elseBody} renders when the iterable is empty. */
    record For(List<String> targets, Expr iterable, List<Node> body, List<Node> elseBody,
            SourcePosition position) implements Node {
        public For {
            targets = List.copyOf(targets);
            body = List.copyOf(body);
            elseBody = List.copyOf(elseBody);
        }
    }

    record MacroDef(String name, List<MacroParam> params, List<Node> body, SourcePosition position)
            implements Node {
        public MacroDef {
            params = List.copyOf(params);
            body = List.copyOf(body);
        }
    }

    /** {@code {% name(args) %}} */
    record MacroCall(String name, List<Expr> args, Map<String, Expr> kwargs, SourcePosition position)
            implements Node {
        public MacroCall {
            args = List.copyOf(args);
            kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
        }
    }

    /** {@code {% set name = value %}} */
    record Set(String name, Expr value, SourcePosition position) implements Node {
    }
}
