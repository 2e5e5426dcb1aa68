package com.gddoc.maven.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds and reads the GDScript files of a Godot project.
 */
public final class ScriptReader {

    public static final String SCRIPT_EXTENSION = ".gd";

    /**
     * Lists {@code *.gd} files below {@code projectDir} in path order, skipping anything under
     * one of {@code excludedDirs}.
     */
    public static List<Path> findScripts(Path projectDir, Collection<Path> excludedDirs) throws IOException {
        Path root = projectDir.toAbsolutePath().normalize();
        List<Path> excluded = excludedDirs.stream()
                .map(dir -> root.resolve(dir).toAbsolutePath().normalize())
                .collect(Collectors.toList());
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(SCRIPT_EXTENSION))
                    .filter(path -> excluded.stream().noneMatch(path::startsWith))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Reads and parses one script; the recorded file path is relative to the project.
     */
    public static ClassInfo read(Path projectDir, Path script) throws IOException {
        String source = Files.readString(script, StandardCharsets.UTF_8);
        return ScriptParser.parse(relativePath(projectDir, script), source);
    }

    /**
     * @return {@code script} relative to {@code projectDir}, joined with {@code /}
     */
    public static String relativePath(Path projectDir, Path script) {
        Path relative = projectDir.toAbsolutePath().normalize()
                .relativize(script.toAbsolutePath().normalize());
        StringBuilder joined = new StringBuilder();
        for (Path part : relative) {
            if (joined.length() > 0) {
                joined.append('/');
            }
            joined.append(part);
        }
        return joined.toString();
    }

    private ScriptReader() {
    }
}
