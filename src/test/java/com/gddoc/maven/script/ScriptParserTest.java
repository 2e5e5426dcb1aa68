package com.gddoc.maven.script;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ScriptParserTest {

    private static ClassInfo player;

    @BeforeAll
    static void parsePlayer() throws Exception {
        String source = Files.readString(Path.of("src/test/resources/scripts/player.gd"), StandardCharsets.UTF_8);
        player = ScriptParser.parse("player.gd", source);
    }

    private static PropertyInfo property(String name) {
        return player.getProperties().stream().filter(p -> p.getName().equals(name)).findFirst().orElseThrow();
    }

    private static MethodInfo method(String name) {
        return player.getMethods().stream().filter(m -> m.getName().equals(name)).findFirst().orElseThrow();
    }

    @Test
    void header_nameExtendsAndDoc() {
        assertThat(player.getName()).isEqualTo("Player");
        assertThat(player.getExtendsName()).isEqualTo("CharacterBody2D");
        assertThat(player.getSummary()).isEqualTo("Controllable player character.");
        assertThat(player.getDescription()).isEqualTo("Moves with **WASD** and jumps with `ui_accept`.");
        assertThat(player.getKey()).isEqualTo("Player");
    }

    @Test
    void signals_withAndWithoutArguments() {
        assertThat(player.getSignals()).extracting(SignalInfo::getName)
                .containsExactly("died", "health_changed", "hit");
        SignalInfo died = player.getSignals().get(0);
        assertThat(died.getDescription()).isEqualTo("Emitted when the player dies.");
        assertThat(died.getArgs()).isEmpty();

        SignalInfo changed = player.getSignals().get(1);
        assertThat(changed.getDescription()).isNull();
        assertThat(changed.getArgs()).extracting(ArgInfo::getName).containsExactly("old_value", "new_value");
        assertThat(changed.getArgs()).extracting(ArgInfo::getType).containsExactly("int", "int");
    }

    @Test
    void signals_multiLineArguments() {
        List<ArgInfo> args = player.getSignals().get(2).getArgs();
        assertThat(args).extracting(ArgInfo::getName).containsExactly("damage", "source");
        assertThat(args.get(0).getType()).isEqualTo("float");
        assertThat(args.get(1).getType()).isNull();
        assertThat(args.get(1).getDefaultValue()).isEqualTo("null");
    }

    @Test
    void enums_valuesAndValueDocs() {
        assertThat(player.getEnums()).hasSize(2);
        EnumInfo state = player.getEnums().get(0);
        assertThat(state.getName()).isEqualTo("State");
        assertThat(state.getDescription()).isEqualTo("Movement states.");
        assertThat(state.getValues().keySet()).containsExactly("IDLE", "RUNNING", "JUMPING");
        assertThat(state.getValues()).containsEntry("IDLE", "Standing still")
                .containsEntry("RUNNING", "Moving fast")
                .containsEntry("JUMPING", null);

        EnumInfo anonymous = player.getEnums().get(1);
        assertThat(anonymous.getName()).isEmpty();
        assertThat(anonymous.getValues().keySet()).containsExactly("LEFT", "RIGHT");
    }

    @Test
    void properties_typesAndDefaults() {
        assertThat(player.getProperties()).extracting(PropertyInfo::getName)
                .containsExactly("speed", "health", "sprite", "inventory", "stats", "shield", "_secret");

        PropertyInfo speed = property("speed");
        assertThat(speed.getType()).isEqualTo("float");
        assertThat(speed.getDefaultValue()).isEqualTo("10.0");
        assertThat(speed.getDescription()).isEqualTo("Maximum speed in pixels per second.");

        assertThat(property("health").getType()).isNull();
        assertThat(property("health").getDefaultValue()).isEqualTo("100");
        assertThat(property("sprite").getType()).isEqualTo("Sprite2D");
        assertThat(property("sprite").getDefaultValue()).isNull();
        assertThat(property("inventory").getType()).isEqualTo("Array[String]");
        assertThat(property("inventory").getDefaultValue()).isEqualTo("[]");
        assertThat(property("stats").getDefaultValue()).isEqualTo("{...}");
        assertThat(property("_secret").getDefaultValue()).isEqualTo("\"a#b\"");
    }

    @Test
    void properties_accessorBlocks() {
        PropertyInfo shield = property("shield");
        assertThat(shield.getDefaultValue()).isEqualTo("0");
        assertThat(shield.hasSetter()).isTrue();
        assertThat(shield.hasGetter()).isTrue();
        assertThat(property("speed").hasSetter()).isFalse();
    }

    @Test
    void methods_signaturesAndDocs() {
        assertThat(player.getMethods()).extracting(MethodInfo::getName).containsExactly("move", "create", "_ready");

        MethodInfo move = method("move");
        assertThat(move.getDescription()).isEqualTo("Moves the player.\nSecond line.");
        assertThat(move.getReturnType()).isEqualTo("void");
        assertThat(move.getArgs()).extracting(ArgInfo::toString).hasSize(2);
        assertThat(move.getArgs().get(0).getType()).isEqualTo("Vector2");
        assertThat(move.getArgs().get(1).getDefaultValue()).isEqualTo("1.0");

        MethodInfo create = method("create");
        assertThat(create.getReturnType()).isEqualTo("Player");
        assertThat(create.getArgs()).hasSize(1);
        assertThat(create.getArgs().get(0).getType()).isEqualTo("Dictionary");
        assertThat(create.getArgs().get(0).getDefaultValue()).isEqualTo("{\"a\": 1, \"b\": 2}");

        MethodInfo ready = method("_ready");
        assertThat(ready.getReturnType()).isNull();
        assertThat(ready.getArgs()).isEmpty();
        assertThat(ready.getDescription()).isNull();
    }

    @Test
    void parse_unnamedScriptUsesPathKey() {
        ClassInfo info = ScriptParser.parse("util/helper.gd", "extends \"res://base/base.gd\"\n\nfunc run():\n\tpass\n");
        assertThat(info.getName()).isNull();
        assertThat(info.getExtendsName()).isEqualTo("\"res://base/base.gd\"");
        assertThat(info.getKey()).isEqualTo("util-helper.gd");
        assertThat(info.getMethods()).hasSize(1);
    }

    @Test
    void parse_classNameAfterExtends() {
        ClassInfo info = ScriptParser.parse("enemy.gd", "extends Node2D\nclass_name Enemy\n## An enemy.\n\nvar hp = 3\n");
        assertThat(info.getName()).isEqualTo("Enemy");
        assertThat(info.getExtendsName()).isEqualTo("Node2D");
        assertThat(info.getSummary()).isEqualTo("An enemy.");
        assertThat(info.getProperties()).extracting(PropertyInfo::getName).containsExactly("hp");
    }

    @Test
    void parse_summaryWithoutSeparatorKeepsAllLines() {
        ClassInfo info = ScriptParser.parse("a.gd", "class_name A\n## First [i]line[/i].\n## Second line.\nextends Node\n");
        assertThat(info.getSummary()).isEqualTo("First _line_.\nSecond line.");
        assertThat(info.getDescription()).isNull();
        assertThat(info.getExtendsName()).isEqualTo("Node");
    }

    @Test
    void parse_inlineAccessorsAndStandaloneAnnotations() {
        String source = "extends Node\n\n## Documented.\n@export\nvar level: int = 1: set = set_level, get = get_level\n"
                + "var name_only: get = read_name\n";
        ClassInfo info = ScriptParser.parse("a.gd", source);
        PropertyInfo level = info.getProperties().get(0);
        assertThat(level.getDescription()).isEqualTo("Documented.");
        assertThat(level.getType()).isEqualTo("int");
        assertThat(level.getDefaultValue()).isEqualTo("1");
        assertThat(level.hasSetter()).isTrue();
        assertThat(level.hasGetter()).isTrue();

        PropertyInfo nameOnly = info.getProperties().get(1);
        assertThat(nameOnly.getType()).isNull();
        assertThat(nameOnly.hasGetter()).isTrue();
        assertThat(nameOnly.hasSetter()).isFalse();
    }

    @Test
    void parse_godot3SetgetIsNotPartOfTheDefault() {
        String source = "extends Node\n\nvar w = 5 setget set_w, get_w\n"
                + "var typed: int = 2 setget set_typed\n"
                + "var read_only setget , get_read_only\n"
                + "var tag = \"setget\" setget set_tag\n";
        List<PropertyInfo> properties = ScriptParser.parse("a.gd", source).getProperties();
        assertThat(properties).extracting(PropertyInfo::getName)
                .containsExactly("w", "typed", "read_only", "tag");

        assertThat(properties.get(0).getDefaultValue()).isEqualTo("5");
        assertThat(properties.get(0).hasSetter()).isTrue();
        assertThat(properties.get(0).hasGetter()).isTrue();

        assertThat(properties.get(1).getType()).isEqualTo("int");
        assertThat(properties.get(1).getDefaultValue()).isEqualTo("2");
        assertThat(properties.get(1).hasSetter()).isTrue();
        assertThat(properties.get(1).hasGetter()).isFalse();

        assertThat(properties.get(2).getDefaultValue()).isNull();
        assertThat(properties.get(2).hasSetter()).isFalse();
        assertThat(properties.get(2).hasGetter()).isTrue();

        assertThat(properties.get(3).getDefaultValue()).isEqualTo("\"setget\"");
        assertThat(properties.get(3).hasSetter()).isTrue();
    }

    @Test
    void parse_emptySource() {
        ClassInfo info = ScriptParser.parse("empty.gd", "");
        assertThat(info.getName()).isNull();
        assertThat(info.getExtendsName()).isEmpty();
        assertThat(info.getSignals()).isEmpty();
        assertThat(info.getMethods()).isEmpty();
    }

    @Test
    void helpers() {
        assertThat(ScriptParser.splitTopLevel("a, f(b, c), [d, e], 'x,y',", ','))
                .containsExactly("a", "f(b, c)", "[d, e]", "'x,y'");
        assertThat(ScriptParser.stripComment("var a = \"#x\" # note")).isEqualTo("var a = \"#x\" ");
        assertThat(ScriptParser.abbreviateDefault("{ }")).isEqualTo("{}");
        assertThat(ScriptParser.abbreviateDefault("[1, 2]")).isEqualTo("[...]");
        assertThat(ScriptParser.abbreviateDefault("")).isNull();
        assertThat(ScriptParser.parseArgs("a, b: int, c = 1, d: float = 2.0, e := [], ").stream()
                .map(arg -> arg.getName() + "|" + arg.getType() + "|" + arg.getDefaultValue())
                .collect(Collectors.toList()))
                .containsExactly("a|null|null", "b|int|null", "c|null|1", "d|float|2.0", "e|null|[]");
    }
}
