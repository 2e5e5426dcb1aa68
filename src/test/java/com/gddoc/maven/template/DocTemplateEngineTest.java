package com.gddoc.maven.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.gddoc.template.TemplateOptions;
import com.gddoc.template.TemplateSyntaxException;

@ExtendWith(MockitoExtension.class)
class DocTemplateEngineTest {

    @Mock
    private TemplateLoader loader;

    @Test
    void render_compilesEachTemplateOnce() throws Exception {
        when(loader.loadTemplate("greeting.md")).thenReturn("Hello {{ name }}!");
        DocTemplateEngine engine = new DocTemplateEngine(loader);

        assertThat(engine.render("greeting.md", Map.of("name", "Ann"))).isEqualTo("Hello Ann!");
        assertThat(engine.render("greeting.md", Map.of("name", "Bo"))).isEqualTo("Hello Bo!");
        verify(loader, times(1)).loadTemplate("greeting.md");
    }

    @Test
    void render_usesConfiguredWhitespaceOptions() throws Exception {
        when(loader.loadTemplate("t.md")).thenReturn("{% if true %}\nx{% endif %}");

        assertThat(new DocTemplateEngine(loader).render("t.md", Map.of())).isEqualTo("x");
        assertThat(new DocTemplateEngine(loader, TemplateOptions.VERBATIM).render("t.md", Map.of()))
                .isEqualTo("\nx");
    }

    @Test
    void render_propagatesSyntaxErrors() throws Exception {
        when(loader.loadTemplate("broken.md")).thenReturn("{% for x in items %}");
        DocTemplateEngine engine = new DocTemplateEngine(loader);

        TemplateSyntaxException error = assertThrows(TemplateSyntaxException.class,
                () -> engine.render("broken.md", Map.of()));
        assertThat(error.getMessage()).contains("Unclosed 'for' tag");
    }
}
