package com.gddoc.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

class TemplateTest {

    @Test
    void render_textWithoutTagsIsUnchanged() throws Exception {
        String text = "# Title\n\n  indented { braces } and % signs\n";
        assertThat(Template.render(text, Map.of())).isEqualTo(text);
    }

    @Test
    void render_sameContextGivesSameOutput() throws Exception {
        Template template = Template.compile("{% for x in items %}{{ x }}{% endfor %}");
        Map<String, Object> context = Map.of("items", List.of(1, 2, 3));
        assertThat(template.render(context)).isEqualTo("123").isEqualTo(template.render(context));
    }

    @Test
    void render_macrosDoNotCarryOverBetweenRenders() throws Exception {
        Template template = Template.compile("{% if define %}{% macro m() %}x{% endmacro %}{% endif %}{{ m() }}");
        assertThat(template.render(Map.of("define", true))).isEqualTo("x");
        assertThatThrownBy(() -> template.render(Map.of("define", false)))
                .isInstanceOf(UnknownMacroException.class);
    }

    @Test
    void render_concurrentlyFromOneCompiledTemplate() throws Exception {
        Template template = Template.compile("{% set doubled = n * 2 %}{{ n }}:{{ doubled }}");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                int n = i;
                results.add(executor.submit(() -> template.render(Map.of("n", n))));
            }
            for (int i = 0; i < results.size(); i++) {
                assertThat(results.get(i).get(10, TimeUnit.SECONDS)).isEqualTo(i + ":" + (i * 2));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void render_nullContextIsEmpty() throws Exception {
        assertThat(Template.compile("[{{ x }}]").render(null)).isEqualTo("[]");
    }

    @Test
    void compile_reportsSyntaxErrors() {
        assertThatThrownBy(() -> Template.compile("{% if %}"))
                .isInstanceOf(TemplateSyntaxException.class);
    }

    @Test
    void exception_messageCarriesPosition() {
        assertThatThrownBy(() -> Template.compile("line one\n{% endif %}"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessage("Unexpected tag 'endif' (line 2, column 4)");
    }

    @Test
    void options_withers() {
        TemplateOptions options = TemplateOptions.DEFAULTS.withTrimBlocks(false);
        assertThat(options.trimBlocks()).isFalse();
        assertThat(options.lstripBlocks()).isTrue();
        assertThat(options.withLstripBlocks(false)).isEqualTo(TemplateOptions.VERBATIM);
    }
}
