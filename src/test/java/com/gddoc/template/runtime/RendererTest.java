package com.gddoc.template.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.gddoc.template.Template;
import com.gddoc.template.TemplateTypeException;

class RendererTest {

    private static String render(String source, Map<String, ?> context) throws Exception {
        return Template.render(source, context);
    }

    @Test
    void for_exposesLoopRecord() throws Exception {
        String template = "{% for x in items %}{{ loop.index }}/{{ loop.length }}{% if not loop.last %},{% endif %}{% endfor %}";
        assertThat(render(template, Map.of("items", List.of("a", "b", "c")))).isEqualTo("1/3,2/3,3/3");
        assertThat(render("{% for x in [1, 2, 3] %}{{ loop.first }}{{ loop.revindex0 }}{{ loop.index0 }} {% endfor %}",
                Map.of())).isEqualTo("True20 False11 False02 ");
    }

    @Test
    void for_elseRendersForEmptyOrMissingIterable() throws Exception {
        assertThat(render("{% for x in [] %}x{% else %}empty{% endfor %}", Map.of())).isEqualTo("empty");
        assertThat(render("{% for x in missing %}x{% else %}empty{% endfor %}", Map.of())).isEqualTo("empty");
        assertThat(render("{% for x in missing %}x{% endfor %}", Map.of())).isEqualTo("");
    }

    @Test
    void for_innerLoopShadowsOuterLoopRecord() throws Exception {
        assertThat(render("{% for a in [1, 2] %}{% for b in [1] %}{{ loop.length }}{% endfor %}{{ loop.length }}{% endfor %}",
                Map.of())).isEqualTo("1212");
    }

    @Test
    void for_iteratesRecordKeysAndStringCharacters() throws Exception {
        assertThat(render("{% for k in m %}{{ k }}{% endfor %}", Map.of("m", Map.of("only", 1)))).isEqualTo("only");
        assertThat(render("{% for c in 'abc' %}{{ c }}.{% endfor %}", Map.of())).isEqualTo("a.b.c.");
    }

    @Test
    void for_loopVariablesDoNotLeak() throws Exception {
        assertThat(render("{% for i in [1] %}{% set y = i %}{% endfor %}[{{ i }}{{ y }}]", Map.of())).isEqualTo("[]");
    }

    @Test
    void for_overNumberIsTypeError() {
        assertThatThrownBy(() -> render("{% for x in 5 %}{% endfor %}", Map.of()))
                .isInstanceOf(TemplateTypeException.class)
                .extracting(e -> ((TemplateTypeException) e).getOperation())
                .isEqualTo("for");
    }

    @Test
    void for_unpackMismatchIsTypeError() {
        assertThatThrownBy(() -> render("{% for a, b in [[1, 2, 3]] %}{% endfor %}", Map.of()))
                .isInstanceOf(TemplateTypeException.class)
                .hasMessageContaining("cannot unpack");
    }

    @Test
    void if_elifChain() throws Exception {
        String template = "{% if n > 10 %}big{% elif n > 5 %}medium{% else %}small{% endif %}";
        assertThat(render(template, Map.of("n", 11))).isEqualTo("big");
        assertThat(render(template, Map.of("n", 6))).isEqualTo("medium");
        assertThat(render(template, Map.of("n", 1))).isEqualTo("small");
    }

    @Test
    void set_bindsInCurrentScope() throws Exception {
        assertThat(render("{% set x = 2 %}{{ x * 3 }}", Map.of())).isEqualTo("6");
        assertThat(render("{% set name = name | upper %}{{ name }}", Map.of("name", "ann"))).isEqualTo("ANN");
    }

    @Test
    void failedRenderRaisesInsteadOfPartialOutput() {
        assertThatThrownBy(() -> render("before {{ 1 / 0 }} after", Map.of()))
                .isInstanceOf(TemplateTypeException.class);
    }
}
