package com.gddoc.maven;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.gddoc.maven.script.ClassInfo;

/**
 * Places each class document under the chain of its ancestors.
 * <p>
 * For {@code Player extends Actor} and {@code Actor extends CharacterBody2D} (not a project
 * script) the document of Player is {@code CharacterBody2D/Actor/Player.md}.
 */
public class DocumentLayout {

    private final Path outputDir;
    private final Map<String, ClassInfo> classes;
    private final String extension;

    public DocumentLayout(Path outputDir, Map<String, ClassInfo> classes, String extension) {
        this.outputDir = outputDir;
        this.classes = classes;
        this.extension = extension == null ? "" : extension;
    }

    public Path resolve(String key) {
        Path dir = outputDir;
        for (String ancestor : ancestors(key)) {
            dir = dir.resolve(ancestor);
        }
        return dir.resolve(key + extension);
    }

    /**
     * Walks {@code extends} through the known classes, root ancestor first. The first ancestor
     * that is not a project class ends the chain; so does a cycle.
     */
    public List<String> ancestors(String key) {
        Deque<String> chain = new ArrayDeque<>();
        ClassInfo info = classes.get(key);
        if (info == null) {
            return List.of();
        }
        Set<String> visited = new HashSet<>();
        visited.add(key);
        String base = normalizeBase(info.getExtendsName());
        while (!base.isEmpty()) {
            chain.addFirst(base);
            ClassInfo parent = classes.get(base);
            if (parent == null || !visited.add(base)) {
                break;
            }
            base = normalizeBase(parent.getExtendsName());
        }
        return List.copyOf(chain);
    }

    /**
     * {@code "res://actors/actor.gd"} becomes {@code actors-actor.gd}, the key of an unnamed script.
     */
    static String normalizeBase(String extendsName) {
        if (extendsName == null) {
            return "";
        }
        String unquoted = extendsName.replace("\"", "").replace("'", "").strip();
        if (unquoted.endsWith(".gd")) {
            if (unquoted.startsWith("res://")) {
                unquoted = unquoted.substring("res://".length());
            }
            return unquoted.replace('/', '-');
        }
        return unquoted;
    }
}
