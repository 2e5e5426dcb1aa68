package com.gddoc.template.runtime;

import java.util.HashMap;
import java.util.Map;

/**
 * Name bindings chained to a parent. Lookups fall through to the parent; a missing name is
 * {@link Undefined}, never an error. The parent link is fixed at construction.
 */
public final class Scope {

    private final Scope parent;
    private final Map<String, Value> bindings = new HashMap<>();

    public Scope(Scope parent) {
        this.parent = parent;
    }

    public Scope child() {
        return new Scope(this);
    }

    public Value lookup(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            Value value = scope.bindings.get(name);
            if (value != null) {
                return value;
            }
        }
        return Undefined.INSTANCE;
    }

    public void define(String name, Value value) {
        bindings.put(name, value);
    }

    public Scope getParent() {
        return parent;
    }
}
