package com.gddoc.maven.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.gddoc.template.TemplateOptions;

class DocsConfigLoaderTest {

    private Path testBaseDir;

    @BeforeEach
    void setUp() throws Exception {
        testBaseDir = Path.of("target/test-output", getClass().getSimpleName(), String.valueOf(System.nanoTime()));
        Files.createDirectories(testBaseDir);
    }

    @Test
    void loadOrDefault_missingFileUsesBundledDefaults() throws Exception {
        DocsConfig config = DocsConfigLoader.loadOrDefault(testBaseDir.resolve("gddoc.yaml"));
        assertThat(config.getExclude()).isEmpty();
        assertThat(config.isNamedOnly()).isFalse();
        assertThat(config.getFileExtension()).isEqualTo(".md");
        assertThat(config.toTemplateOptions()).isEqualTo(TemplateOptions.DEFAULTS);

        assertThat(DocsConfigLoader.loadOrDefault(null).getFileExtension()).isEqualTo(".md");
    }

    @Test
    void load_readsAllSettings() throws Exception {
        Path file = testBaseDir.resolve("gddoc.yaml");
        Files.writeString(file, String.join("\n",
                "exclude:",
                "  - tests",
                "  - demo/levels",
                "namedOnly: true",
                "trimBlocks: false",
                "lstripBlocks: false",
                "fileExtension: txt",
                ""));

        DocsConfig config = DocsConfigLoader.load(file);

        assertThat(config.getExclude()).containsExactly("tests", "demo/levels");
        assertThat(config.isNamedOnly()).isTrue();
        assertThat(config.getFileExtension()).isEqualTo(".txt");
        assertThat(config.toTemplateOptions()).isEqualTo(TemplateOptions.VERBATIM);
    }

    @Test
    void load_emptyFileGivesDefaults() throws Exception {
        Path file = testBaseDir.resolve("empty.yaml");
        Files.writeString(file, "");
        DocsConfig config = DocsConfigLoader.load(file);
        assertThat(config.isTrimBlocks()).isTrue();
        assertThat(config.getExclude()).isEmpty();
    }

    @Test
    void load_rejectsNonMapping() throws Exception {
        Path file = testBaseDir.resolve("list.yaml");
        Files.writeString(file, "- a\n- b\n");
        IOException error = assertThrows(IOException.class, () -> DocsConfigLoader.load(file));
        assertThat(error.getMessage()).contains("Expected a mapping");
    }

    @Test
    void load_rejectsInvalidYaml() throws Exception {
        Path file = testBaseDir.resolve("broken.yaml");
        Files.writeString(file, "exclude: [unclosed\n");
        IOException error = assertThrows(IOException.class, () -> DocsConfigLoader.load(file));
        assertThat(error.getMessage()).contains("Invalid YAML");
    }

    @Test
    void loadFromResource_missing() {
        IOException error = assertThrows(IOException.class, () -> DocsConfigLoader.loadFromResource("/nope.yaml"));
        assertThat(error.getMessage()).isEqualTo("Resource not found: /nope.yaml");
    }

    @Test
    void fromMap_acceptsLooseValues() {
        Map<String, Object> map = new HashMap<>();
        map.put("exclude", "generated");
        map.put("namedOnly", "true");
        map.put("fileExtension", ".html");
        DocsConfig config = DocsConfig.fromMap(map);
        assertThat(config.getExclude()).isEqualTo(List.of("generated"));
        assertThat(config.isNamedOnly()).isTrue();
        assertThat(config.getFileExtension()).isEqualTo(".html");

        assertThat(DocsConfig.fromMap(null).getFileExtension()).isEqualTo(".md");
    }
}
