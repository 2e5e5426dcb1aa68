package com.gddoc.template.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.gddoc.template.Template;
import com.gddoc.template.TemplateTypeException;
import com.gddoc.template.UnknownMacroException;

class MacroTest {

    private static final String GREET = "{% macro greet(name, greeting='Hi') %}{{ greeting }}, {{ name }}!{% endmacro %}";

    private static String render(String source) throws Exception {
        return Template.render(source, Map.of());
    }

    @Test
    void call_bindsPositionalKeywordAndDefault() throws Exception {
        assertThat(render(GREET + "{{ greet('Ann') }}|{{ greet('Bo', 'Yo') }}|{{ greet('Cy', greeting='Hey') }}"))
                .isEqualTo("Hi, Ann!|Yo, Bo!|Hey, Cy!");
    }

    @Test
    void call_statementAndExpressionFormsMatch() throws Exception {
        assertThat(render(GREET + "{% greet('Ann') %}")).isEqualTo(render(GREET + "{{ greet('Ann') }}"));
        assertThat(render("{% macro hr() %}--{% endmacro %}{% hr() %}")).isEqualTo("--");
    }

    @Test
    void call_missingArgumentIsUndefined() throws Exception {
        assertThat(render("{% macro show(a, b) %}[{{ b }}]{% endmacro %}{{ show(1) }}")).isEqualTo("[]");
    }

    @Test
    void call_defaultsSeeEarlierParameters() throws Exception {
        assertThat(render("{% macro m(a, b=a ~ '!') %}{{ b }}{% endmacro %}{{ m('x') }}")).isEqualTo("x!");
    }

    @Test
    void body_resolvesNamesInDefiningScope() throws Exception {
        String template = "{% set who = 'outer' %}{% macro m() %}{{ who }}{% endmacro %}"
                + "{% for who in ['loop'] %}{{ m() }}{% endfor %}";
        assertThat(render(template)).isEqualTo("outer");
    }

    @Test
    void body_canRecurse() throws Exception {
        assertThat(render("{% macro count(n) %}{{ n }}{% if n > 0 %}{{ count(n - 1) }}{% endif %}{% endmacro %}"
                + "{{ count(3) }}")).isEqualTo("3210");
    }

    @Test
    void body_unboundedRecursionFailsWithTypedError() {
        assertThatThrownBy(() -> render("{% macro m(a) %}{{ m(a) }}{% endmacro %}{{ m(1) }}"))
                .isInstanceOf(TemplateTypeException.class)
                .hasMessageContaining("maximum macro recursion depth exceeded")
                .extracting(e -> ((TemplateTypeException) e).getOperation())
                .isEqualTo("m");
    }

    @Test
    void body_deepButBoundedRecursionStillRenders() throws Exception {
        String template = "{% macro down(n) %}{% if n > 0 %}{{ down(n - 1) }}{% else %}done{% endif %}{% endmacro %}"
                + "{{ down(200) }}";
        assertThat(render(template)).isEqualTo("done");
    }

    @Test
    void call_beforeDefinitionIsUnknown() {
        assertThatThrownBy(() -> render("{{ later() }}{% macro later() %}{% endmacro %}"))
                .isInstanceOf(UnknownMacroException.class)
                .extracting(e -> ((UnknownMacroException) e).getMacroName())
                .isEqualTo("later");
    }

    @Test
    void call_unknownMacroInStatementForm() {
        assertThatThrownBy(() -> render("{% nope() %}"))
                .isInstanceOf(UnknownMacroException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void call_arityErrors() {
        assertThatThrownBy(() -> render("{% macro m(a) %}{% endmacro %}{{ m(1, 2) }}"))
                .isInstanceOf(TemplateTypeException.class)
                .hasMessageContaining("not more than 1");
        assertThatThrownBy(() -> render("{% macro m(a) %}{% endmacro %}{{ m(b=1) }}"))
                .isInstanceOf(TemplateTypeException.class)
                .hasMessageContaining("no parameter 'b'");
        assertThatThrownBy(() -> render("{% macro m(a) %}{% endmacro %}{{ m(1, a=2) }}"))
                .isInstanceOf(TemplateTypeException.class)
                .hasMessageContaining("multiple values for 'a'");
    }

    @Test
    void result_isStringUsableInExpressions() throws Exception {
        assertThat(render(GREET + "{{ greet('x') | upper }} {{ greet('x') | length }}")).isEqualTo("HI, X! 6");
    }
}
