package com.gddoc.template.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ScopeTest {

    @Test
    void lookup_fallsThroughToParent() {
        Scope root = new Scope(null);
        root.define("a", new StringValue("root"));
        Scope child = root.child();
        child.define("b", new StringValue("child"));

        assertThat(child.lookup("a").asText()).isEqualTo("root");
        assertThat(child.lookup("b").asText()).isEqualTo("child");
        assertThat(root.lookup("b")).isSameAs(Undefined.INSTANCE);
        assertThat(child.getParent()).isSameAs(root);
    }

    @Test
    void define_shadowsWithoutTouchingParent() {
        Scope root = new Scope(null);
        root.define("x", new NumberValue(1));
        Scope child = root.child();
        child.define("x", new NumberValue(2));

        assertThat(child.lookup("x").asText()).isEqualTo("2");
        assertThat(root.lookup("x").asText()).isEqualTo("1");
    }
}
