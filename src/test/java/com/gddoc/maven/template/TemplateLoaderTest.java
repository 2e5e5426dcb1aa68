package com.gddoc.maven.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TemplateLoaderTest {

    @Mock
    private Log log;

    private Path userDir;

    @BeforeEach
    void setUp() throws Exception {
        userDir = Path.of("target/test-output", getClass().getSimpleName(), String.valueOf(System.nanoTime()));
        Files.createDirectories(userDir);
    }

    @Test
    void loadTemplate_prefersUserDirectory() throws Exception {
        Files.writeString(userDir.resolve("class_doc_template.md"), "custom {{ name }}");
        TemplateLoader loader = new TemplateLoader(userDir, log);

        assertThat(loader.loadTemplate("class_doc_template.md")).isEqualTo("custom {{ name }}");
        verify(log).debug(contains("Using user template"));
    }

    @Test
    void loadTemplate_fallsBackToBundledTemplate() throws Exception {
        TemplateLoader loader = new TemplateLoader(userDir, log);

        assertThat(loader.loadTemplate("class_doc_template.md")).contains("{% macro arg_list");
        verify(log).debug(contains("Using bundled template"));
    }

    @Test
    void loadTemplate_withoutUserDirectory() throws Exception {
        TemplateLoader loader = new TemplateLoader(null, log);
        assertThat(loader.loadTemplate("class_doc_template.md")).startsWith("{#");
    }

    @Test
    void loadTemplate_missingEverywhere() {
        TemplateLoader loader = new TemplateLoader(userDir, log);
        IOException error = assertThrows(IOException.class, () -> loader.loadTemplate("nope.md"));
        assertThat(error.getMessage()).contains("Template not found: nope.md");
    }
}
