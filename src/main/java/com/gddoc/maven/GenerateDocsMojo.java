package com.gddoc.maven;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import com.gddoc.maven.config.DocsConfig;
import com.gddoc.maven.config.DocsConfigLoader;
import com.gddoc.maven.script.ClassInfo;
import com.gddoc.maven.script.ScriptReader;
import com.gddoc.maven.template.DocTemplateEngine;
import com.gddoc.maven.template.TemplateEngine;
import com.gddoc.maven.template.TemplateLoader;
import com.gddoc.template.TemplateException;

/**
 * Maven plugin to generate Markdown class references for the GDScript files of a Godot
 * project.
 */
@Mojo(name = "generate-docs", defaultPhase = LifecyclePhase.PACKAGE, requiresProject = false)
public class GenerateDocsMojo extends AbstractMojo {

    public static final String DEFAULT_TEMPLATE = "class_doc_template.md";

    @Parameter(property = "gddoc.projectDir", defaultValue = "${project.basedir}")
    private File projectDir;

    @Parameter(property = "gddoc.outputDir", defaultValue = "${project.build.directory}/gd_docs")
    private File outputDir;

    @Parameter(property = "gddoc.templateFile")
    private File templateFile;

    @Parameter(property = "gddoc.scriptTemplatesDir", defaultValue = "script_templates")
    private String scriptTemplatesDir;

    @Parameter(property = "gddoc.namedOnly", defaultValue = "false")
    private boolean namedOnly;

    @Parameter(property = "gddoc.forceOverwrite", defaultValue = "false")
    private boolean forceOverwrite;

    @Parameter(property = "gddoc.configFile", defaultValue = "${project.basedir}/gddoc.yaml")
    private File configFile;

    @Parameter(property = "gddoc.skip", defaultValue = "false")
    private boolean skip;

    @Override
    public void execute() throws MojoExecutionException {
        if (skip) {
            getLog().info("GDDoc: Skipping documentation generation.");
            return;
        }
        if (projectDir == null || !projectDir.isDirectory()) {
            throw new MojoExecutionException("GDDoc: Project directory does not exist: " + projectDir);
        }
        if (outputDir == null) {
            throw new MojoExecutionException("GDDoc: No output directory configured.");
        }
        if (templateFile != null && !templateFile.isFile()) {
            throw new MojoExecutionException("GDDoc: Template file does not exist: " + templateFile);
        }

        Path projectRoot = projectDir.toPath().toAbsolutePath().normalize();
        Path outputRoot = outputDir.toPath().toAbsolutePath().normalize();
        if (projectRoot.startsWith(outputRoot)) {
            throw new MojoExecutionException("GDDoc: Output directory " + outputRoot
                    + " must not contain the project directory " + projectRoot);
        }
        getLog().info("GDDoc: Scanning GDScript files in " + projectRoot);

        try {
            DocsConfig config = DocsConfigLoader.loadOrDefault(configFile != null ? configFile.toPath() : null);
            boolean onlyNamed = namedOnly || config.isNamedOnly();

            prepareOutputDir(outputRoot);

            Map<String, ClassInfo> classes = scanScripts(projectRoot, outputRoot, config, onlyNamed);
            if (classes.isEmpty()) {
                getLog().warn("GDDoc: No GDScript classes found in " + projectRoot);
                return;
            }

            TemplateEngine engine = createTemplateEngine(config);
            String templateName = templateFile != null ? templateFile.getName() : DEFAULT_TEMPLATE;
            DocumentLayout layout = new DocumentLayout(outputRoot, classes, config.getFileExtension());

            for (Map.Entry<String, ClassInfo> entry : classes.entrySet()) {
                Path outputFile = layout.resolve(entry.getKey());
                String content;
                try {
                    content = engine.render(templateName, entry.getValue().toContext());
                } catch (TemplateException e) {
                    throw new MojoExecutionException("GDDoc: Failed to render documentation for "
                            + entry.getValue().getFilePath() + ": " + e.getMessage(), e);
                }
                Files.createDirectories(outputFile.getParent());
                Files.writeString(outputFile, content, StandardCharsets.UTF_8);
                getLog().debug("Generated: " + outputFile);
            }

            getLog().info(String.format("GDDoc: Generated %d class reference(s) in %s", classes.size(), outputRoot));
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to generate GDScript docs", e);
        }
    }

    /**
     * A non-empty output directory is only cleared when {@code forceOverwrite} is set.
     */
    private void prepareOutputDir(Path outputRoot) throws IOException, MojoExecutionException {
        if (!Files.isDirectory(outputRoot)) {
            Files.createDirectories(outputRoot);
            return;
        }
        List<Path> contents;
        try (Stream<Path> children = Files.list(outputRoot)) {
            contents = children.collect(Collectors.toList());
        }
        if (contents.isEmpty()) {
            return;
        }
        if (!forceOverwrite) {
            throw new MojoExecutionException("ERROR: Output directory " + outputRoot + " is not empty.\n"
                    + "All of its contents would be deleted. Remove it yourself or run again with "
                    + "-Dgddoc.forceOverwrite=true.");
        }
        getLog().info("GDDoc: Clearing output directory " + outputRoot);
        for (Path child : contents) {
            deleteRecursively(child);
        }
    }

    private static void deleteRecursively(Path path) throws IOException {
        try (Stream<Path> walk = Files.walk(path)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path p : paths) {
                Files.delete(p);
            }
        }
    }

    private Map<String, ClassInfo> scanScripts(Path projectRoot, Path outputRoot, DocsConfig config,
            boolean onlyNamed) throws IOException {
        List<Path> excluded = new ArrayList<>();
        excluded.add(projectRoot.resolve("addons"));
        excluded.add(projectRoot.resolve(scriptTemplatesDir != null ? scriptTemplatesDir : "script_templates"));
        excluded.add(outputRoot);
        for (String dir : config.getExclude()) {
            excluded.add(projectRoot.resolve(dir));
        }

        Map<String, ClassInfo> classes = new LinkedHashMap<>();
        for (Path script : ScriptReader.findScripts(projectRoot, excluded)) {
            ClassInfo info;
            try {
                info = ScriptReader.read(projectRoot, script);
            } catch (IOException e) {
                getLog().warn("Failed to read: " + script, e);
                continue;
            }
            if (info.getName() == null && onlyNamed) {
                getLog().debug("Skipping unnamed script: " + info.getFilePath());
                continue;
            }
            ClassInfo previous = classes.put(info.getKey(), info);
            if (previous != null) {
                getLog().warn("GDDoc: " + info.getFilePath() + " and " + previous.getFilePath()
                        + " both declare " + info.getKey() + "; keeping " + info.getFilePath());
            }
            getLog().debug("Parsed " + info.getFilePath() + " as " + info.getKey());
        }
        return classes;
    }

    private TemplateEngine createTemplateEngine(DocsConfig config) {
        Path userTemplateDir = templateFile != null ? templateFile.toPath().toAbsolutePath().getParent() : null;
        TemplateLoader loader = new TemplateLoader(userTemplateDir, getLog());
        return new DocTemplateEngine(loader, config.toTemplateOptions());
    }
}
